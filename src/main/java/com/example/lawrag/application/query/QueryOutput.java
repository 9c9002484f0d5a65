package com.example.lawrag.application.query;

import com.example.lawrag.domain.model.Source;
import java.util.List;
import java.util.Map;

public record QueryOutput(
        boolean success,
        String answer,
        List<Source> sources,
        long queryTimeMs,
        int chunksRetrieved,
        int chunksAfterRerank,
        int stageCount,
        Map<String, Long> stageTimingsMs,
        String embeddingModel,
        String rerankerModel,
        String llmModel,
        List<String> errors
) {
}
