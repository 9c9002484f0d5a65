package com.example.lawrag.application.pipeline;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public record PipelineResult(
        boolean success,
        Object data,
        List<StepResult> steps,
        long totalDurationMs,
        Instant startedAt,
        Instant completedAt,
        List<String> errors,
        Map<String, Object> metadata
) {

    public PipelineResult {
        steps = List.copyOf(steps);
        errors = List.copyOf(errors);
        metadata = Map.copyOf(metadata);
    }

    public List<StepResult> failedSteps() {
        return steps.stream().filter(s -> s.status() == StepStatus.FAILED).toList();
    }

    public List<StepResult> successfulSteps() {
        return steps.stream().filter(StepResult::succeeded).toList();
    }
}
