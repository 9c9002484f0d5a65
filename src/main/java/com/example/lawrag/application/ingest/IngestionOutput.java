package com.example.lawrag.application.ingest;

import com.example.lawrag.application.pipeline.StepResult;
import java.util.List;

public record IngestionOutput(
        boolean success,
        String collectionName,
        int articlesCount,
        int chunksCount,
        int pagesProcessed,
        int pointsStored,
        long durationMs,
        List<String> errors,
        List<StepResult> steps
) {
}
