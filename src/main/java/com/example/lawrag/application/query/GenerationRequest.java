package com.example.lawrag.application.query;

import com.example.lawrag.domain.model.RetrievedChunk;
import java.util.List;

public record GenerationRequest(String query, List<RetrievedChunk> chunks, String history) {
}
