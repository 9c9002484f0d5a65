package com.example.lawrag.domain.port;

import java.util.List;

/**
 * Semantic text encoder producing fixed-dimension dense vectors.
 */
public interface DenseEncoder {

    float[] embed(String text);

    /**
     * Encodes all texts in one call. The i-th vector belongs to the i-th text.
     */
    List<float[]> embedBatch(List<String> texts);

    int dimension();

    String modelName();
}
