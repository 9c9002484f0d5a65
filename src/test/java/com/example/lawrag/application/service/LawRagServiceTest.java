package com.example.lawrag.application.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.example.lawrag.application.ingest.IngestionOutput;
import com.example.lawrag.application.ingest.IngestionPipeline;
import com.example.lawrag.application.query.QueryInput;
import com.example.lawrag.application.query.QueryOutput;
import com.example.lawrag.application.query.QueryPipeline;
import com.example.lawrag.application.service.LawRagService.LawDescriptor;
import com.example.lawrag.controller.exception.BusinessException;
import com.example.lawrag.domain.dto.IngestResponse;
import com.example.lawrag.domain.dto.QueryRequest;
import com.example.lawrag.domain.dto.QueryResponse;
import com.example.lawrag.domain.model.ArticleMetadata;
import com.example.lawrag.domain.model.SupportedCountry;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.HttpStatus;

class LawRagServiceTest {

    private IngestionPipeline ingestionPipeline;
    private QueryPipeline queryPipeline;
    private CollectionService collectionService;
    private SessionService sessionService;
    private LawRagService service;

    @BeforeEach
    void setUp() {
        ingestionPipeline = mock(IngestionPipeline.class);
        queryPipeline = mock(QueryPipeline.class);
        collectionService = mock(CollectionService.class);
        sessionService = mock(SessionService.class);
        service = new LawRagService(ingestionPipeline, queryPipeline, collectionService, sessionService);
    }

    private static QueryOutput answer(String text) {
        return new QueryOutput(true, text, List.of(), 42, 3, 1, 6, Map.of("reranker", 5L),
                "bge-m3", "bge-reranker-v2-m3", "gpt-4o-mini", List.of());
    }

    @Test
    void ingestBuildsMetadataAndTargetsCountryCollection() {
        when(collectionService.ensureCountryCollection(SupportedCountry.EGYPT)).thenReturn("laws_egypt");
        when(ingestionPipeline.run(any(), any(), eq("laws_egypt"))).thenReturn(new IngestionOutput(
                true, "laws_egypt", 120, 131, 40, 131, 900, List.of(), List.of()));

        IngestResponse response = service.ingest(new byte[2000], "civil.pdf",
                new LawDescriptor("Egypt", "CIVIL", "القانون المدني", "Civil Code", "131", 1948));

        ArgumentCaptor<ArticleMetadata> metadata = ArgumentCaptor.forClass(ArticleMetadata.class);
        verify(ingestionPipeline).run(any(), metadata.capture(), eq("laws_egypt"));
        assertEquals("egypt", metadata.getValue().country());
        assertEquals("civil", metadata.getValue().lawType());
        assertEquals("civil.pdf", metadata.getValue().sourceFile());
        assertEquals(1948, metadata.getValue().lawYear());
        assertEquals(120, response.getArticlesCount());
        assertEquals(131, response.getChunksCount());
        assertEquals("laws_egypt", response.getCollectionName());
    }

    @Test
    void failedIngestionIsAServerError() {
        when(collectionService.ensureCountryCollection(SupportedCountry.EGYPT)).thenReturn("laws_egypt");
        when(ingestionPipeline.run(any(), any(), anyString())).thenReturn(new IngestionOutput(
                false, "laws_egypt", 0, 0, 0, 0, 10, List.of("pdf_loader: bad header"), List.of()));

        BusinessException e = assertThrows(BusinessException.class, () -> service.ingest(new byte[2000], "x.pdf",
                new LawDescriptor("egypt", "civil", "قانون", null, null, null)));

        assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, e.getStatus());
        assertTrue(e.getMessage().contains("pdf_loader: bad header"));
    }

    @Test
    void unsupportedCountryOrLawTypeIsABadRequest() {
        BusinessException country = assertThrows(BusinessException.class, () -> service.ingest(new byte[2000], "x.pdf",
                new LawDescriptor("france", "civil", "قانون", null, null, null)));
        assertEquals(HttpStatus.BAD_REQUEST, country.getStatus());

        QueryRequest request = QueryRequest.builder().question("سؤال قانوني").lawTypes(List.of("maritime")).build();
        BusinessException lawType = assertThrows(BusinessException.class, () -> service.ask(request));
        assertEquals(HttpStatus.BAD_REQUEST, lawType.getStatus());
        verifyNoInteractions(ingestionPipeline, queryPipeline);
    }

    @Test
    void askingAnEmptyCountryIsNotFound() {
        when(collectionService.hasPoints(SupportedCountry.KUWAIT)).thenReturn(false);

        BusinessException e = assertThrows(BusinessException.class,
                () -> service.ask(QueryRequest.builder().question("سؤال قانوني").country("kuwait").build()));

        assertEquals(HttpStatus.NOT_FOUND, e.getStatus());
        verifyNoInteractions(queryPipeline);
    }

    @Test
    void askRunsQueryWithHistoryAndRecordsTurn() {
        when(collectionService.hasPoints(SupportedCountry.EGYPT)).thenReturn(true);
        when(sessionService.contextForPrompt("s1")).thenReturn("المستخدم: سؤال سابق");
        when(queryPipeline.run(any(), eq("laws_egypt"))).thenReturn(answer("الجواب"));

        QueryResponse response = service.ask(QueryRequest.builder()
                .question("ما هي أركان العقد؟")
                .lawTypes(List.of("civil", "CIVIL"))
                .sessionId("s1")
                .topK(3)
                .build());

        ArgumentCaptor<QueryInput> input = ArgumentCaptor.forClass(QueryInput.class);
        verify(queryPipeline).run(input.capture(), eq("laws_egypt"));
        assertEquals("egypt", input.getValue().country());
        assertEquals(List.of("civil"), input.getValue().lawTypes());
        assertEquals(3, input.getValue().topK());
        assertEquals("المستخدم: سؤال سابق", input.getValue().history());

        verify(sessionService).addUserMessage("s1", "ما هي أركان العقد؟");
        verify(sessionService).addAssistantMessage(eq("s1"), eq("الجواب"), anyList());
        assertEquals("الجواب", response.getAnswer());
        assertEquals("s1", response.getSessionId());
        assertEquals(3, response.getChunksRetrieved());
    }

    @Test
    void sessionFailuresDoNotFailTheQuery() {
        when(collectionService.hasPoints(SupportedCountry.EGYPT)).thenReturn(true);
        when(sessionService.contextForPrompt("s2")).thenThrow(new RuntimeException("redis down"));
        doThrow(new RuntimeException("redis down")).when(sessionService).addUserMessage(anyString(), anyString());
        when(queryPipeline.run(any(), anyString())).thenReturn(answer("الجواب"));

        QueryResponse response = service.ask(QueryRequest.builder().question("سؤال قانوني").sessionId("s2").build());

        assertEquals("الجواب", response.getAnswer());
        ArgumentCaptor<QueryInput> input = ArgumentCaptor.forClass(QueryInput.class);
        verify(queryPipeline).run(input.capture(), anyString());
        assertNull(input.getValue().history());
    }
}
