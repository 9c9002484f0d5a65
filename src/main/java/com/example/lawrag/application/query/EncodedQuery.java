package com.example.lawrag.application.query;

import com.example.lawrag.domain.model.SparseVector;

public record EncodedQuery(String text, float[] dense, SparseVector sparse) {

    public boolean hasBothVectors() {
        return dense != null && dense.length > 0 && sparse != null && !sparse.isEmpty();
    }
}
