package com.example.lawrag.domain.dto;

import lombok.Builder;
import lombok.Getter;

@Builder
@Getter
public class IngestResponse {
    private boolean success;
    private String collectionName;
    private String lawName;
    private int articlesCount;
    private int chunksCount;
    private int pagesProcessed;
    private long durationMs;
    private String message;
}
