package com.example.lawrag.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.Test;

class PipelineTest {

    interface Body<I, O> {
        O apply(I input, Map<String, Object> context) throws Exception;
    }

    private static <I, O> PipelineStep<I, O> step(String name, Body<I, O> body) {
        return new PipelineStep<I, O>() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public O process(I input, Map<String, Object> context) throws Exception {
                return body.apply(input, context);
            }
        };
    }

    private final PipelineStep<String, List<String>> words = step("words", (s, ctx) -> {
        ctx.put("word_count", s.split(" ").length);
        return List.of(s.split(" "));
    });

    private final PipelineStep<List<String>, Integer> boom = step("boom", (in, ctx) -> {
        throw new IllegalStateException("boom");
    });

    private final PipelineStep<List<String>, String> joiner = step("joiner", (in, ctx) ->
            String.join("-", in) + ":" + ctx.get("word_count"));

    @Test
    void runsStepsInOrderAndSharesContext() {
        PipelineResult result = new Pipeline("demo").addStep(words).addStep(joiner)
                .run("a b c", new LinkedHashMap<>(), true);

        assertTrue(result.success());
        assertEquals("a-b-c:3", result.data());
        assertEquals(2, result.steps().size());
        assertEquals(5, result.steps().get(0).inputSize());
        assertEquals(3, result.steps().get(0).outputSize());
        assertEquals(3, result.steps().get(1).inputSize());
        assertEquals("demo", result.metadata().get("pipeline_name"));
        assertEquals(2, result.metadata().get("total_steps"));
        assertEquals(2, result.metadata().get("completed_steps"));
        assertTrue(result.errors().isEmpty());
    }

    @Test
    void stopOnErrorHaltsAfterFirstFailure() {
        PipelineResult result = new Pipeline("demo").addStep(words).addStep(boom).addStep(joiner)
                .run("a b", null, true);

        assertFalse(result.success());
        assertEquals(2, result.steps().size());
        assertEquals(StepStatus.FAILED, result.steps().get(1).status());
        assertEquals("boom", result.steps().get(1).error());
        assertEquals(List.of("boom: boom"), result.errors());
        assertEquals(List.of("a", "b"), result.data());
        assertEquals(1, result.metadata().get("completed_steps"));
        assertEquals(3, result.metadata().get("total_steps"));
    }

    @Test
    void continueModeFeedsLastGoodOutputToNextStep() {
        PipelineResult result = new Pipeline("demo").addStep(words).addStep(boom).addStep(joiner)
                .run("x y", null, false);

        assertFalse(result.success());
        assertEquals(3, result.steps().size());
        assertEquals(1, result.failedSteps().size());
        assertEquals(2, result.successfulSteps().size());
        assertEquals("x-y:2", result.data());
    }

    @Test
    void failedValidationSkipsProcess() {
        AtomicBoolean called = new AtomicBoolean();
        PipelineStep<String, String> strict = new PipelineStep<String, String>() {
            @Override
            public String name() {
                return "strict";
            }

            @Override
            public boolean validate(String input) {
                return input != null && input.length() > 10;
            }

            @Override
            public String process(String input, Map<String, Object> context) {
                called.set(true);
                return input;
            }
        };

        PipelineResult result = new Pipeline("demo").addStep(strict).run("short", null, true);

        assertFalse(called.get());
        assertFalse(result.success());
        assertEquals("Invalid input for step: strict", result.steps().get(0).error());
        assertNull(result.steps().get(0).outputSize());
    }

    @Test
    void wrongInputTypeIsAValidationFailure() {
        PipelineStep<String, Integer> length = new PipelineStep<String, Integer>() {
            @Override
            public String name() {
                return "length";
            }

            @Override
            public boolean validate(String input) {
                return !input.isEmpty();
            }

            @Override
            public Integer process(String input, Map<String, Object> context) {
                return input.length();
            }
        };

        Pipeline.Execution execution = Pipeline.execute(length, 42, new LinkedHashMap<>());

        assertInstanceOf(PipelineValidationException.class, execution.failure());
        assertEquals(StepStatus.FAILED, execution.result().status());
    }

    @Test
    void nullInputFailsDefaultValidation() {
        Pipeline.Execution execution = Pipeline.execute(words, null, new LinkedHashMap<>());

        assertInstanceOf(PipelineValidationException.class, execution.failure());
        assertEquals(0, execution.result().inputSize());
    }

    @Test
    void sizeOfCoversCommonShapes() {
        assertEquals(0, PipelineStep.sizeOf(null));
        assertEquals(2, PipelineStep.sizeOf(List.of(1, 2)));
        assertEquals(1, PipelineStep.sizeOf(Map.of("k", "v")));
        assertEquals(4, PipelineStep.sizeOf("abcd"));
        assertEquals(3, PipelineStep.sizeOf(new byte[3]));
        assertNull(PipelineStep.sizeOf(new Object()));
    }
}
