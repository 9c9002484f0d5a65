package com.example.lawrag.application.query;

import com.example.lawrag.domain.model.RetrievedChunk;
import java.util.List;
import java.util.Map;

public record FormatRequest(
        String answer,
        List<RetrievedChunk> chunks,
        int chunksRetrieved,
        long elapsedMs,
        int stageCount,
        Map<String, Long> stageTimingsMs
) {
}
