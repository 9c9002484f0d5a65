package com.example.lawrag.application.ingest.step;

import com.example.lawrag.application.pipeline.PipelineStep;
import com.example.lawrag.domain.model.DocumentChunk;
import com.example.lawrag.domain.port.DenseEncoder;
import java.util.List;
import java.util.Map;

public class DenseEmbedderStep implements PipelineStep<List<DocumentChunk>, List<DocumentChunk>> {

    private final DenseEncoder denseEncoder;

    public DenseEmbedderStep(DenseEncoder denseEncoder) {
        this.denseEncoder = denseEncoder;
    }

    @Override
    public String name() {
        return "dense_embedder";
    }

    @Override
    public boolean validate(List<DocumentChunk> input) {
        return input != null && !input.isEmpty();
    }

    @Override
    public List<DocumentChunk> process(List<DocumentChunk> input, Map<String, Object> context) {
        List<String> texts = input.stream().map(DocumentChunk::getContent).toList();
        List<float[]> vectors = denseEncoder.embedBatch(texts);
        if (vectors == null || vectors.size() != input.size()) {
            throw new IllegalStateException("Dense encoder returned " + (vectors == null ? 0 : vectors.size())
                    + " vectors for " + input.size() + " chunks");
        }
        for (int i = 0; i < input.size(); i++) {
            input.get(i).setDenseVector(vectors.get(i));
        }
        context.put(IngestionContextKeys.DENSE_EMBEDDINGS, vectors.size());
        return input;
    }
}
