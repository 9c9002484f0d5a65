package com.example.lawrag.application.pipeline;

import com.example.lawrag.util.ExceptionHelper;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs an ordered list of steps, feeding each step's output to the next and recording a
 * {@link StepResult} per executed step.
 *
 * <p>A pipeline keeps no state between runs; all per-run state lives in the context map passed to
 * {@link #run(Object, Map, boolean)}.
 */
public class Pipeline {

    private static final Logger log = LoggerFactory.getLogger(Pipeline.class);

    private final String name;
    private final List<PipelineStep<?, ?>> steps = new ArrayList<>();

    public Pipeline(String name) {
        this.name = name;
    }

    public Pipeline addStep(PipelineStep<?, ?> step) {
        if (step == null) {
            throw new IllegalArgumentException("step must not be null");
        }
        steps.add(step);
        return this;
    }

    public String getName() {
        return name;
    }

    public List<PipelineStep<?, ?>> getSteps() {
        return Collections.unmodifiableList(steps);
    }

    public PipelineResult run(Object initialInput, Map<String, Object> context, boolean stopOnError) {
        Map<String, Object> ctx = context == null ? new LinkedHashMap<>() : context;
        Instant startedAt = Instant.now();
        long t0 = System.nanoTime();

        List<StepResult> results = new ArrayList<>(steps.size());
        List<String> errors = new ArrayList<>();
        Object current = initialInput;

        log.info("event=pipeline_start pipeline={} steps={}", name, steps.size());

        for (PipelineStep<?, ?> step : steps) {
            Execution execution = execute(step, current, ctx);
            results.add(execution.result());

            if (execution.failure() == null) {
                current = execution.output();
                continue;
            }

            errors.add(step.name() + ": " + execution.result().error());
            if (stopOnError) {
                break;
            }
        }

        long totalMs = (System.nanoTime() - t0) / 1_000_000;
        int completed = (int) results.stream().filter(StepResult::succeeded).count();

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("pipeline_name", name);
        metadata.put("total_steps", steps.size());
        metadata.put("completed_steps", completed);

        boolean success = errors.isEmpty();
        if (success) {
            log.info("event=pipeline_done pipeline={} steps={} ms={}", name, completed, totalMs);
        } else {
            log.warn("event=pipeline_failed pipeline={} completed={} executed={} ms={} errors={}",
                    name, completed, results.size(), totalMs, errors);
        }

        return new PipelineResult(success, current, results, totalMs, startedAt, Instant.now(), errors, metadata);
    }

    /**
     * Validates and runs a single step, timing it. Failures (validation included) are captured in
     * the returned execution rather than thrown.
     */
    public static Execution execute(PipelineStep<?, ?> step, Object input, Map<String, Object> context) {
        PipelineStep<Object, Object> typed = (PipelineStep<Object, Object>) step;
        Integer inputSize = PipelineStep.sizeOf(input);
        long t0 = System.nanoTime();
        try {
            validateInput(typed, input);
            Object output = typed.process(input, context);
            long ms = (System.nanoTime() - t0) / 1_000_000;
            Integer outputSize = PipelineStep.sizeOf(output);
            log.info("event=pipeline_step_ok step={} ms={} in={} out={}", step.name(), ms, inputSize, outputSize);
            return new Execution(output, StepResult.success(step.name(), ms, inputSize, outputSize), null);
        } catch (Exception e) {
            long ms = (System.nanoTime() - t0) / 1_000_000;
            String message = ExceptionHelper.messageOf(e);
            log.error("event=pipeline_step_failed step={} ms={} err={}", step.name(), ms, message);
            log.debug("event=pipeline_step_failed_trace step={}", step.name(), e);
            StepResult result = StepResult.failed(step.name(), ms, inputSize, message, ExceptionHelper.getTrace(e));
            return new Execution(null, result, e);
        }
    }

    private static void validateInput(PipelineStep<Object, Object> step, Object input) {
        boolean valid;
        try {
            valid = step.validate(input);
        } catch (ClassCastException e) {
            throw new PipelineValidationException(step.name(), e);
        }
        if (!valid) {
            throw new PipelineValidationException(step.name());
        }
    }

    public record Execution(Object output, StepResult result, Exception failure) {
    }
}
