package com.example.lawrag.application.ingest.step;

import com.example.lawrag.application.pipeline.PipelineStep;
import com.example.lawrag.domain.model.DocumentChunk;
import com.example.lawrag.domain.port.VectorStore;
import com.example.lawrag.domain.port.VectorStore.VectorPoint;
import java.util.List;
import java.util.Map;

/**
 * Upserts chunks into one collection. Refuses the whole batch if any chunk is missing a vector.
 */
public class VectorStoreWriterStep implements PipelineStep<List<DocumentChunk>, Integer> {

    private final VectorStore vectorStore;
    private final String collection;

    public VectorStoreWriterStep(VectorStore vectorStore, String collection) {
        this.vectorStore = vectorStore;
        this.collection = collection;
    }

    @Override
    public String name() {
        return "vector_store_writer";
    }

    @Override
    public boolean validate(List<DocumentChunk> input) {
        return input != null && !input.isEmpty() && input.stream().allMatch(DocumentChunk::hasVectors);
    }

    @Override
    public Integer process(List<DocumentChunk> input, Map<String, Object> context) {
        List<VectorPoint> points = input.stream()
                .map(c -> new VectorPoint(c.getChunkId(), c.getDenseVector(), c.getSparseVector(), c.toPayload()))
                .toList();
        int stored = vectorStore.upsert(collection, points);
        context.put(IngestionContextKeys.POINTS_STORED, stored);
        return stored;
    }
}
