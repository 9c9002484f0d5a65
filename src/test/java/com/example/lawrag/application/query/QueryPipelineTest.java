package com.example.lawrag.application.query;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.example.lawrag.application.pipeline.PipelineValidationException;
import com.example.lawrag.domain.model.SparseVector;
import com.example.lawrag.domain.port.AnswerGenerator;
import com.example.lawrag.domain.port.AnswerGenerator.ContextBlock;
import com.example.lawrag.domain.port.DenseEncoder;
import com.example.lawrag.domain.port.Reranker;
import com.example.lawrag.domain.port.SparseEncoder;
import com.example.lawrag.domain.port.VectorStore;
import com.example.lawrag.domain.port.VectorStore.ScoredPoint;
import com.example.lawrag.domain.port.VectorStore.SearchFilter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class QueryPipelineTest {

    private static final String FALLBACK = "لم أجد معلومات كافية للإجابة على سؤالك.";

    private DenseEncoder denseEncoder;
    private SparseEncoder sparseEncoder;
    private VectorStore vectorStore;
    private Reranker reranker;
    private AnswerGenerator generator;
    private QueryPipeline pipeline;

    @BeforeEach
    void setUp() {
        denseEncoder = mock(DenseEncoder.class);
        sparseEncoder = mock(SparseEncoder.class);
        vectorStore = mock(VectorStore.class);
        reranker = mock(Reranker.class);
        generator = mock(AnswerGenerator.class);

        when(denseEncoder.modelName()).thenReturn("bge-m3");
        when(reranker.modelName()).thenReturn("bge-reranker-v2-m3");
        when(generator.modelName()).thenReturn("gpt-4o-mini");
        when(denseEncoder.embed(anyString())).thenReturn(new float[]{0.1f, 0.2f});
        when(sparseEncoder.encodeQuery(anyString())).thenReturn(new SparseVector(new int[]{7}, new float[]{1f}));

        pipeline = new QueryPipeline(denseEncoder, sparseEncoder, vectorStore, reranker, generator, 25, 5, FALLBACK);
    }

    private static ScoredPoint point(String id, int article, String content) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("chunk_id", id);
        payload.put("content", content);
        payload.put("article_number", article);
        payload.put("law_name", "القانون المدني");
        payload.put("law_type", "civil");
        payload.put("page_number", article + 10);
        return new ScoredPoint(id, 1.0 / (60 + article), payload);
    }

    private static QueryInput input(String question, int topK) {
        return new QueryInput(question, "egypt", List.of("civil"), null, topK, null);
    }

    @Test
    void emptyRetrievalReturnsFallbackWithoutCallingModels() {
        when(vectorStore.hybridSearch(anyString(), any(), any(), any(), anyInt())).thenReturn(List.of());

        QueryOutput output = pipeline.run(input("ما هي شروط العقد؟", 5), "laws_egypt");

        assertTrue(output.success());
        assertEquals(FALLBACK, output.answer());
        assertTrue(output.sources().isEmpty());
        assertEquals(0, output.chunksRetrieved());
        assertEquals(0, output.chunksAfterRerank());
        verifyNoInteractions(reranker);
        verify(generator, never()).generate(anyString(), anyList(), any());
    }

    @Test
    void answersFromRerankedTopK() {
        when(vectorStore.hybridSearch(anyString(), any(), any(), any(), anyInt())).thenReturn(List.of(
                point("c1", 1, "نص المادة الأولى"),
                point("c2", 2, "نص المادة الثانية"),
                point("c3", 3, "نص المادة الثالثة")));
        when(reranker.scoreAll(anyString(), anyList())).thenReturn(List.of(0.1, 0.9, 0.5));
        when(generator.generate(anyString(), anyList(), any())).thenReturn("وفقا للمادة 2 ...");

        QueryOutput output = pipeline.run(input("  ما هي أركان العقد؟ ", 2), "laws_egypt");

        assertEquals("وفقا للمادة 2 ...", output.answer());
        assertEquals(3, output.chunksRetrieved());
        assertEquals(2, output.chunksAfterRerank());
        assertEquals(List.of(2, 3), output.sources().stream().map(s -> s.articleNumber()).toList());
        assertEquals(0.9, output.sources().get(0).relevanceScore());
        assertEquals(12, output.sources().get(0).pageNumber());
        assertEquals(QueryPipeline.STAGE_COUNT, output.stageCount());
        assertEquals(List.of("query_preprocessor", "dual_encoder", "hybrid_retriever", "reranker", "answer_generator"),
                List.copyOf(output.stageTimingsMs().keySet()));
        assertEquals("bge-m3", output.embeddingModel());
        assertEquals("gpt-4o-mini", output.llmModel());

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<ContextBlock>> blocks = ArgumentCaptor.forClass(List.class);
        verify(generator).generate(eq("ما هي أركان العقد؟"), blocks.capture(), any());
        assertEquals(List.of(1, 2), blocks.getValue().stream().map(ContextBlock::index).toList());
        assertEquals(2, blocks.getValue().get(0).articleNumber());
    }

    @Test
    void retrievesWithNormalizedQueryAndFilter() {
        when(vectorStore.hybridSearch(anyString(), any(), any(), any(), anyInt())).thenReturn(List.of());

        pipeline.run(input("ما عُقوبة الإتلاف؟", 5), "laws_egypt");

        verify(denseEncoder).embed("ما عقوبة الاتلاف؟");
        ArgumentCaptor<SearchFilter> filter = ArgumentCaptor.forClass(SearchFilter.class);
        verify(vectorStore).hybridSearch(eq("laws_egypt"), any(), any(), filter.capture(), eq(25));
        assertEquals("egypt", filter.getValue().country());
        assertEquals(List.of("civil"), filter.getValue().lawTypes());
    }

    @Test
    void missingDenseVectorStopsBeforeRetrieval() {
        when(denseEncoder.embed(anyString())).thenReturn(null);

        assertThrows(PipelineValidationException.class, () -> pipeline.run(input("سؤال قانوني", 5), "laws_egypt"));
        verifyNoInteractions(vectorStore);
    }

    @Test
    void questionWithoutSearchableTermsFailsValidation() {
        when(sparseEncoder.encodeQuery(anyString())).thenReturn(SparseVector.empty());

        assertThrows(PipelineValidationException.class, () -> pipeline.run(input("ما هو؟", 5), "laws_egypt"));
        verifyNoInteractions(vectorStore, reranker, generator);
    }

    @Test
    void blankQuestionIsRejected() {
        assertThrows(PipelineValidationException.class, () -> pipeline.run(input("   ", 5), "laws_egypt"));
        verifyNoInteractions(vectorStore);
    }

    @Test
    void generatorFailurePropagates() {
        when(vectorStore.hybridSearch(anyString(), any(), any(), any(), anyInt()))
                .thenReturn(List.of(point("c1", 1, "نص")));
        when(reranker.scoreAll(anyString(), anyList())).thenReturn(List.of(0.3));
        when(generator.generate(anyString(), anyList(), any())).thenThrow(new RuntimeException("LLM HTTP error: 503"));

        RuntimeException e = assertThrows(RuntimeException.class,
                () -> pipeline.run(input("سؤال قانوني", 5), "laws_egypt"));
        assertEquals("LLM HTTP error: 503", e.getMessage());
    }
}
