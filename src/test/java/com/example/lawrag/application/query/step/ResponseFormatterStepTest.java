package com.example.lawrag.application.query.step;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import com.example.lawrag.domain.model.RetrievedChunk;
import com.example.lawrag.domain.model.Source;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ResponseFormatterStepTest {

    @Test
    void previewIsCutAtTwoHundredCharacters() {
        String longText = "ن".repeat(250);

        assertEquals("ن".repeat(200) + "...", ResponseFormatterStep.preview(longText));
        assertEquals("قصير", ResponseFormatterStep.preview("قصير"));
    }

    @Test
    void sourcePrefersRerankScoreRoundedToFourDigits() {
        RetrievedChunk chunk = new RetrievedChunk("id", "نص", 9, "مادة 9", "قانون العمل", "labor", 4, null, 1, 1, 0.0163934, null);

        Source hybridOnly = ResponseFormatterStep.toSource(chunk);
        Source reranked = ResponseFormatterStep.toSource(chunk.withRerankScore(0.876543));

        assertEquals(0.0164, hybridOnly.relevanceScore());
        assertEquals(0.8765, reranked.relevanceScore());
        assertEquals(9, reranked.articleNumber());
        assertEquals(4, reranked.pageNumber());
        assertEquals("قانون العمل", reranked.lawName());
    }

    @Test
    void storedPayloadIsReadBackIntoSourceWithMarker() {
        Map<String, Object> payload = new HashMap<>();
        payload.put("chunk_id", "c-1");
        payload.put("content", "[مادة 5 - جزء ٢ من ٣]\n\nنص الجزء الثاني");
        payload.put("article_number", 5);
        payload.put("article_text", "المادة (5)");
        payload.put("law_name", "القانون المدني");
        payload.put("law_type", "civil");
        payload.put("page_number", 12);
        payload.put("chapter", "الفصل الأول");
        payload.put("chunk_part", 2);
        payload.put("total_parts", 3);

        RetrievedChunk chunk = RetrievedChunk.fromPayload("ignored", payload, 0.03);

        assertEquals("c-1", chunk.chunkId());
        assertEquals("المادة (5)", chunk.markerText());
        assertEquals(2, chunk.chunkPart());
        assertEquals(3, chunk.totalParts());
        assertEquals("الفصل الأول", chunk.chapter());
        assertEquals("المادة (5)", ResponseFormatterStep.toSource(chunk).markerText());
    }

    @Test
    void olderPayloadWithoutPartsReadsAsSingleWholeArticle() {
        RetrievedChunk chunk = RetrievedChunk.fromPayload("id-7", Map.of("content", "نص", "article_number", 7), 0.5);

        assertEquals("id-7", chunk.chunkId());
        assertNull(chunk.markerText());
        assertEquals(1, chunk.chunkPart());
        assertEquals(1, chunk.totalParts());
        assertNull(ResponseFormatterStep.toSource(chunk).markerText());
    }
}
