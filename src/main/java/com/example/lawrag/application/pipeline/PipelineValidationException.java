package com.example.lawrag.application.pipeline;

/**
 * Raised when a step rejects its input. The step's {@code process} is never called in that case.
 */
public class PipelineValidationException extends RuntimeException {

    private final String stepName;

    public PipelineValidationException(String stepName) {
        super("Invalid input for step: " + stepName);
        this.stepName = stepName;
    }

    public PipelineValidationException(String stepName, Throwable cause) {
        super("Invalid input for step: " + stepName, cause);
        this.stepName = stepName;
    }

    public String getStepName() {
        return stepName;
    }
}
