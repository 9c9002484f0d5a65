package com.example.lawrag.domain.dto;

import com.example.lawrag.domain.model.Source;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Getter;

@Builder
@Getter
public class QueryResponse {
    private String answer;
    private List<Source> sources;
    private String sessionId;
    private String country;
    private long queryTimeMs;
    private int chunksRetrieved;
    private int chunksAfterRerank;
    private Map<String, Long> stageTimingsMs;
    private String embeddingModel;
    private String rerankerModel;
    private String llmModel;
}
