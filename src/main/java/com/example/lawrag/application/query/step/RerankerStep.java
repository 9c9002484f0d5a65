package com.example.lawrag.application.query.step;

import com.example.lawrag.application.pipeline.PipelineStep;
import com.example.lawrag.application.query.RerankRequest;
import com.example.lawrag.domain.model.RetrievedChunk;
import com.example.lawrag.domain.port.Reranker;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Query stage 4: cross-encoder precision. Equal scores keep retrieval order.
 */
public class RerankerStep implements PipelineStep<RerankRequest, List<RetrievedChunk>> {

    private final Reranker reranker;

    public RerankerStep(Reranker reranker) {
        this.reranker = reranker;
    }

    @Override
    public String name() {
        return "reranker";
    }

    @Override
    public boolean validate(RerankRequest input) {
        return input != null
                && input.query() != null
                && !input.query().isBlank()
                && input.candidates() != null
                && input.topK() > 0;
    }

    @Override
    public List<RetrievedChunk> process(RerankRequest input, Map<String, Object> context) {
        List<RetrievedChunk> candidates = input.candidates();
        if (candidates.isEmpty()) {
            context.put("chunks_after_rerank", 0);
            return List.of();
        }

        List<String> documents = candidates.stream().map(RetrievedChunk::content).toList();
        List<Double> scores = reranker.scoreAll(input.query(), documents);
        if (scores == null || scores.size() != candidates.size()) {
            throw new IllegalStateException("Reranker returned " + (scores == null ? 0 : scores.size())
                    + " scores for " + candidates.size() + " candidates");
        }

        List<RetrievedChunk> scored = new ArrayList<>(candidates.size());
        for (int i = 0; i < candidates.size(); i++) {
            scored.add(candidates.get(i).withRerankScore(scores.get(i)));
        }
        scored.sort(Comparator.comparingDouble((RetrievedChunk c) -> c.rerankScore()).reversed());

        List<RetrievedChunk> top = scored.size() > input.topK() ? scored.subList(0, input.topK()) : scored;
        context.put("chunks_after_rerank", top.size());
        return List.copyOf(top);
    }
}
