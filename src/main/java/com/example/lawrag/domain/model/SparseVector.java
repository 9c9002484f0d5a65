package com.example.lawrag.domain.model;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Sparse lexical vector as parallel arrays: {@code values[i]} is the weight of dimension {@code indices[i]}.
 */
public record SparseVector(int[] indices, float[] values) {

    public SparseVector {
        if (indices == null || values == null) {
            throw new IllegalArgumentException("indices and values are required");
        }
        if (indices.length != values.length) {
            throw new IllegalArgumentException("indices and values must have the same length: "
                    + indices.length + " != " + values.length);
        }
    }

    public static SparseVector empty() {
        return new SparseVector(new int[0], new float[0]);
    }

    public int nonZeroCount() {
        return indices.length;
    }

    public boolean isEmpty() {
        return indices.length == 0;
    }

    /**
     * Dimension to weight, keyed by the dimension as a string.
     */
    public Map<String, Float> toFeatureMap() {
        Map<String, Float> out = new LinkedHashMap<>(indices.length * 2);
        for (int i = 0; i < indices.length; i++) {
            out.put(Integer.toString(indices[i]), values[i]);
        }
        return out;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SparseVector other)) {
            return false;
        }
        return Arrays.equals(indices, other.indices) && Arrays.equals(values, other.values);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(indices) + Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "SparseVector[nnz=" + indices.length + "]";
    }
}
