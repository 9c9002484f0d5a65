package com.example.lawrag.application.query.step;

import com.example.lawrag.application.pipeline.PipelineStep;
import com.example.lawrag.application.query.EncodedQuery;
import com.example.lawrag.domain.port.DenseEncoder;
import com.example.lawrag.domain.port.SparseEncoder;
import java.util.Map;

public class DualEncoderStep implements PipelineStep<String, EncodedQuery> {

    private final DenseEncoder denseEncoder;
    private final SparseEncoder sparseEncoder;

    public DualEncoderStep(DenseEncoder denseEncoder, SparseEncoder sparseEncoder) {
        this.denseEncoder = denseEncoder;
        this.sparseEncoder = sparseEncoder;
    }

    @Override
    public String name() {
        return "dual_encoder";
    }

    @Override
    public boolean validate(String input) {
        return input != null && !input.isBlank();
    }

    @Override
    public EncodedQuery process(String input, Map<String, Object> context) {
        float[] dense = denseEncoder.embed(input);
        return new EncodedQuery(input, dense, sparseEncoder.encodeQuery(input));
    }
}
