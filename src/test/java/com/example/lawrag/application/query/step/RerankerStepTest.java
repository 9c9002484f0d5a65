package com.example.lawrag.application.query.step;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.example.lawrag.application.query.RerankRequest;
import com.example.lawrag.domain.model.RetrievedChunk;
import com.example.lawrag.domain.port.Reranker;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class RerankerStepTest {

    private final Reranker reranker = mock(Reranker.class);
    private final RerankerStep step = new RerankerStep(reranker);

    private static RetrievedChunk chunk(String id, int article) {
        return new RetrievedChunk(id, "نص " + id, article, "مادة " + article, "قانون", "civil", 1, null, 1, 1, 0.01, null);
    }

    @Test
    void emptyCandidatesSkipTheModel() {
        Map<String, Object> context = new HashMap<>();

        List<RetrievedChunk> out = step.process(new RerankRequest("سؤال", List.of(), 5), context);

        assertTrue(out.isEmpty());
        assertEquals(0, context.get("chunks_after_rerank"));
        verifyNoInteractions(reranker);
    }

    @Test
    void sortsByScoreKeepingRetrievalOrderOnTies() {
        List<RetrievedChunk> candidates = List.of(chunk("a", 1), chunk("b", 2), chunk("c", 3), chunk("d", 4));
        when(reranker.scoreAll(anyString(), anyList())).thenReturn(List.of(0.5, 0.5, 0.9, 0.1));

        List<RetrievedChunk> out = step.process(new RerankRequest("سؤال", candidates, 10), new HashMap<>());

        assertEquals(List.of("c", "a", "b", "d"), out.stream().map(RetrievedChunk::chunkId).toList());
        assertEquals(0.9, out.get(0).rerankScore());
        assertEquals(0.9, out.get(0).effectiveScore());
    }

    @Test
    void keepsOnlyTopK() {
        List<RetrievedChunk> candidates = List.of(chunk("a", 1), chunk("b", 2), chunk("c", 3));
        when(reranker.scoreAll(anyString(), anyList())).thenReturn(List.of(0.2, 0.7, 0.4));
        Map<String, Object> context = new HashMap<>();

        List<RetrievedChunk> out = step.process(new RerankRequest("سؤال", candidates, 2), context);

        assertEquals(List.of("b", "c"), out.stream().map(RetrievedChunk::chunkId).toList());
        assertEquals(2, context.get("chunks_after_rerank"));
    }

    @Test
    void scoreCountMismatchFails() {
        when(reranker.scoreAll(anyString(), anyList())).thenReturn(List.of(0.2));

        assertThrows(IllegalStateException.class, () -> step.process(
                new RerankRequest("سؤال", List.of(chunk("a", 1), chunk("b", 2)), 2), new HashMap<>()));
    }

    @Test
    void blankQueryOrZeroTopKIsInvalid() {
        assertFalse(step.validate(new RerankRequest(" ", List.of(), 3)));
        assertFalse(step.validate(new RerankRequest("سؤال", List.of(), 0)));
    }
}
