package com.example.lawrag.domain.model;

/**
 * Citation shown to the user next to a generated answer.
 */
public record Source(
        String lawName,
        int articleNumber,
        String markerText,
        int pageNumber,
        String contentPreview,
        double relevanceScore
) {
}
