package com.example.lawrag.application.ingest.step;

import com.example.lawrag.application.pipeline.PipelineStep;
import com.example.lawrag.domain.model.DocumentChunk;
import com.example.lawrag.domain.model.SparseVector;
import com.example.lawrag.domain.port.SparseEncoder;
import java.util.List;
import java.util.Map;

public class SparseEncoderStep implements PipelineStep<List<DocumentChunk>, List<DocumentChunk>> {

    private final SparseEncoder sparseEncoder;

    public SparseEncoderStep(SparseEncoder sparseEncoder) {
        this.sparseEncoder = sparseEncoder;
    }

    @Override
    public String name() {
        return "sparse_encoder";
    }

    @Override
    public boolean validate(List<DocumentChunk> input) {
        return input != null && !input.isEmpty();
    }

    @Override
    public List<DocumentChunk> process(List<DocumentChunk> input, Map<String, Object> context) {
        List<String> texts = input.stream().map(DocumentChunk::getContent).toList();
        List<SparseVector> vectors = sparseEncoder.encodeBatch(texts);
        if (vectors == null || vectors.size() != input.size()) {
            throw new IllegalStateException("Sparse encoder returned " + (vectors == null ? 0 : vectors.size())
                    + " vectors for " + input.size() + " chunks");
        }
        long nonZero = 0;
        for (int i = 0; i < input.size(); i++) {
            input.get(i).setSparseVector(vectors.get(i));
            nonZero += vectors.get(i).nonZeroCount();
        }
        context.put(IngestionContextKeys.SPARSE_VECTORS, vectors.size());
        context.put(IngestionContextKeys.AVG_SPARSE_NONZERO, (double) nonZero / vectors.size());
        return input;
    }
}
