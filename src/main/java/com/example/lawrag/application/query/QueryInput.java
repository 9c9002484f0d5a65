package com.example.lawrag.application.query;

import java.util.List;

/**
 * @param history prior conversation rendered as prompt text, or null
 */
public record QueryInput(
        String question,
        String country,
        List<String> lawTypes,
        String sessionId,
        int topK,
        String history
) {

    public QueryInput {
        lawTypes = lawTypes == null ? List.of() : List.copyOf(lawTypes);
    }
}
