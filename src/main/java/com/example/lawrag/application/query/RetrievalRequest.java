package com.example.lawrag.application.query;

import com.example.lawrag.domain.port.VectorStore.SearchFilter;

public record RetrievalRequest(String collection, EncodedQuery query, SearchFilter filter, int limit) {
}
