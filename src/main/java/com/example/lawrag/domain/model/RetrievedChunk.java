package com.example.lawrag.domain.model;

import java.util.Map;

/**
 * A chunk returned by hybrid retrieval. {@code rerankScore} stays null until the rerank stage scores it.
 */
public record RetrievedChunk(
        String chunkId,
        String content,
        int articleNumber,
        String markerText,
        String lawName,
        String lawType,
        int pageNumber,
        String chapter,
        int chunkPart,
        int totalParts,
        double hybridScore,
        Double rerankScore
) {

    public RetrievedChunk withRerankScore(double score) {
        return new RetrievedChunk(chunkId, content, articleNumber, markerText, lawName, lawType, pageNumber,
                chapter, chunkPart, totalParts, hybridScore, score);
    }

    public double effectiveScore() {
        return rerankScore != null ? rerankScore : hybridScore;
    }

    public static RetrievedChunk fromPayload(String id, Map<String, Object> payload, double score) {
        Object chunkId = payload.get("chunk_id");
        return new RetrievedChunk(
                chunkId == null ? id : String.valueOf(chunkId),
                stringOrEmpty(payload.get("content")),
                intOrZero(payload.get("article_number")),
                stringOrNull(payload.get("article_text")),
                stringOrEmpty(payload.get("law_name")),
                stringOrEmpty(payload.get("law_type")),
                intOrZero(payload.get("page_number")),
                stringOrNull(payload.get("chapter")),
                Math.max(1, intOrZero(payload.get("chunk_part"))),
                Math.max(1, intOrZero(payload.get("total_parts"))),
                score,
                null
        );
    }

    private static String stringOrNull(Object o) {
        return o == null ? null : String.valueOf(o);
    }

    private static String stringOrEmpty(Object o) {
        return o == null ? "" : String.valueOf(o);
    }

    private static int intOrZero(Object o) {
        if (o instanceof Number n) {
            return n.intValue();
        }
        if (o == null) {
            return 0;
        }
        try {
            return Integer.parseInt(String.valueOf(o).trim());
        } catch (NumberFormatException e) {
            return 0;
        }
    }
}
