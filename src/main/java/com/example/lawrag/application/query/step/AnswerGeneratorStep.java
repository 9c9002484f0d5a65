package com.example.lawrag.application.query.step;

import com.example.lawrag.application.pipeline.PipelineStep;
import com.example.lawrag.application.query.GenerationRequest;
import com.example.lawrag.domain.model.RetrievedChunk;
import com.example.lawrag.domain.port.AnswerGenerator;
import com.example.lawrag.domain.port.AnswerGenerator.ContextBlock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Query stage 5. With nothing to ground on, the fixed fallback answer is returned and the
 * generator is not called.
 */
public class AnswerGeneratorStep implements PipelineStep<GenerationRequest, String> {

    private final AnswerGenerator generator;
    private final String fallbackAnswer;

    public AnswerGeneratorStep(AnswerGenerator generator, String fallbackAnswer) {
        this.generator = generator;
        this.fallbackAnswer = fallbackAnswer;
    }

    @Override
    public String name() {
        return "answer_generator";
    }

    @Override
    public boolean validate(GenerationRequest input) {
        return input != null && input.query() != null && !input.query().isBlank() && input.chunks() != null;
    }

    @Override
    public String process(GenerationRequest input, Map<String, Object> context) {
        if (input.chunks().isEmpty()) {
            context.put("used_fallback_answer", true);
            return fallbackAnswer;
        }
        List<ContextBlock> blocks = new ArrayList<>(input.chunks().size());
        int index = 1;
        for (RetrievedChunk chunk : input.chunks()) {
            blocks.add(new ContextBlock(index++, chunk.lawName(), chunk.articleNumber(), chunk.content()));
        }
        return generator.generate(input.query(), blocks, input.history());
    }
}
