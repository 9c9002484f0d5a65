package com.example.lawrag.application.query.step;

import com.example.lawrag.application.pipeline.PipelineStep;
import com.example.lawrag.application.query.RetrievalRequest;
import com.example.lawrag.domain.model.RetrievedChunk;
import com.example.lawrag.domain.port.VectorStore;
import com.example.lawrag.domain.port.VectorStore.ScoredPoint;
import java.util.List;
import java.util.Map;

/**
 * Query stage 3: wide hybrid recall. Fused candidates come back best first with the fusion score
 * as {@code hybridScore}.
 */
public class HybridRetrieverStep implements PipelineStep<RetrievalRequest, List<RetrievedChunk>> {

    private final VectorStore vectorStore;

    public HybridRetrieverStep(VectorStore vectorStore) {
        this.vectorStore = vectorStore;
    }

    @Override
    public String name() {
        return "hybrid_retriever";
    }

    @Override
    public boolean validate(RetrievalRequest input) {
        return input != null
                && input.collection() != null
                && input.query() != null
                && input.query().hasBothVectors()
                && input.limit() > 0;
    }

    @Override
    public List<RetrievedChunk> process(RetrievalRequest input, Map<String, Object> context) {
        List<ScoredPoint> points = vectorStore.hybridSearch(
                input.collection(),
                input.query().dense(),
                input.query().sparse(),
                input.filter(),
                input.limit());
        List<RetrievedChunk> chunks = points.stream()
                .map(p -> RetrievedChunk.fromPayload(p.id(), p.payload(), p.score()))
                .toList();
        context.put("chunks_retrieved", chunks.size());
        return chunks;
    }
}
