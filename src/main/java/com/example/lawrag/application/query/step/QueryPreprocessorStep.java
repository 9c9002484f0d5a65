package com.example.lawrag.application.query.step;

import com.example.lawrag.application.pipeline.PipelineStep;
import com.example.lawrag.application.query.NormalizedQuery;
import com.example.lawrag.util.ArabicNormalizer;
import java.util.Map;

/**
 * Orthographic cleanup of the question. Teh marbuta and alef maksura are left untouched.
 */
public class QueryPreprocessorStep implements PipelineStep<String, NormalizedQuery> {

    @Override
    public String name() {
        return "query_preprocessor";
    }

    @Override
    public boolean validate(String input) {
        return input != null && !input.isBlank();
    }

    @Override
    public NormalizedQuery process(String input, Map<String, Object> context) {
        NormalizedQuery query = new NormalizedQuery(input.trim(), ArabicNormalizer.normalizeForQuery(input));
        context.put("original_query", query.raw());
        context.put("normalized_query", query.normalized());
        return query;
    }
}
