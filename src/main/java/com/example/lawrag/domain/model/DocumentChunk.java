package com.example.lawrag.domain.model;

import java.util.LinkedHashMap;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Indexable unit of an article. Vectors are attached by the embedding steps after the chunk is built.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DocumentChunk {

    private String chunkId;
    private String content;
    private int articleNumber;
    private String articleText;
    private int pageNumber;
    private String chapter;
    private int chunkPart;
    private int totalParts;
    private ArticleMetadata metadata;

    private float[] denseVector;
    private SparseVector sparseVector;

    public boolean hasVectors() {
        return denseVector != null && denseVector.length > 0 && sparseVector != null;
    }

    public Map<String, Object> toPayload() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("chunk_id", chunkId);
        payload.put("content", content);
        payload.put("article_number", articleNumber);
        payload.put("article_text", articleText);
        payload.put("page_number", pageNumber);
        payload.put("country", metadata.country());
        payload.put("law_type", metadata.lawType());
        payload.put("law_name", metadata.lawName());
        payload.put("law_name_en", metadata.lawNameEn());
        payload.put("law_number", metadata.lawNumber());
        payload.put("law_year", metadata.lawYear());
        payload.put("source_file", metadata.sourceFile());
        payload.put("chapter", chapter);
        payload.put("chunk_part", chunkPart);
        payload.put("total_parts", totalParts);
        return payload;
    }
}
