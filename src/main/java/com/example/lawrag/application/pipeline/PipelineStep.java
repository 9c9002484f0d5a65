package com.example.lawrag.application.pipeline;

import java.lang.reflect.Array;
import java.util.Collection;
import java.util.Map;

/**
 * One named transformation in a pipeline.
 *
 * @param <I> accepted input
 * @param <O> produced output, handed to the next step
 */
public interface PipelineStep<I, O> {

    String name();

    default boolean validate(I input) {
        return input != null;
    }

    /**
     * @param context per-run values shared by all steps of the run (counters, cross-cutting metadata)
     */
    O process(I input, Map<String, Object> context) throws Exception;

    /**
     * Best-effort size used in step metrics. Null when the data has no natural size.
     */
    static Integer sizeOf(Object data) {
        if (data == null) {
            return 0;
        }
        if (data instanceof Collection<?> c) {
            return c.size();
        }
        if (data instanceof Map<?, ?> m) {
            return m.size();
        }
        if (data instanceof CharSequence cs) {
            return cs.length();
        }
        if (data.getClass().isArray()) {
            return Array.getLength(data);
        }
        return null;
    }
}
