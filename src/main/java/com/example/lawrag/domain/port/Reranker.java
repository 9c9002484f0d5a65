package com.example.lawrag.domain.port;

import java.util.ArrayList;
import java.util.List;

/**
 * Cross-encoder relevance scorer. Scores are comparable only within one query.
 */
public interface Reranker {

    double score(String query, String document);

    default List<Double> scoreAll(String query, List<String> documents) {
        List<Double> scores = new ArrayList<>(documents.size());
        for (String document : documents) {
            scores.add(score(query, document));
        }
        return scores;
    }

    String modelName();
}
