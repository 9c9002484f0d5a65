package com.example.lawrag.application.query;

import com.example.lawrag.domain.model.RetrievedChunk;
import java.util.List;

public record RerankRequest(String query, List<RetrievedChunk> candidates, int topK) {
}
