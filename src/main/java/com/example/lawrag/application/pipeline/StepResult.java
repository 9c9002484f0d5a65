package com.example.lawrag.application.pipeline;

import java.util.Map;

/**
 * Outcome of one step execution. Sizes are best effort and null when the data has no natural size.
 */
public record StepResult(
        String name,
        StepStatus status,
        long durationMs,
        Integer inputSize,
        Integer outputSize,
        String error,
        String errorTrace,
        Map<String, Object> metadata
) {

    public StepResult {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public static StepResult success(String name, long durationMs, Integer inputSize, Integer outputSize) {
        return new StepResult(name, StepStatus.SUCCESS, durationMs, inputSize, outputSize, null, null, Map.of());
    }

    public static StepResult failed(String name, long durationMs, Integer inputSize, String error, String errorTrace) {
        return new StepResult(name, StepStatus.FAILED, durationMs, inputSize, null, error, errorTrace, Map.of());
    }

    public boolean succeeded() {
        return status == StepStatus.SUCCESS;
    }
}
