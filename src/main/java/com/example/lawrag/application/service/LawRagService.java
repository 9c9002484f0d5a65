package com.example.lawrag.application.service;

import com.example.lawrag.application.ingest.IngestionOutput;
import com.example.lawrag.application.ingest.IngestionPipeline;
import com.example.lawrag.application.query.QueryInput;
import com.example.lawrag.application.query.QueryOutput;
import com.example.lawrag.application.query.QueryPipeline;
import com.example.lawrag.controller.exception.BusinessException;
import com.example.lawrag.domain.dto.IngestResponse;
import com.example.lawrag.domain.dto.QueryRequest;
import com.example.lawrag.domain.dto.QueryResponse;
import com.example.lawrag.domain.model.ArticleMetadata;
import com.example.lawrag.domain.model.LawType;
import com.example.lawrag.domain.model.SupportedCountry;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;

@Service
public class LawRagService {

    private static final Logger log = LoggerFactory.getLogger(LawRagService.class);

    private final IngestionPipeline ingestionPipeline;
    private final QueryPipeline queryPipeline;
    private final CollectionService collectionService;
    private final SessionService sessionService;

    public LawRagService(
            IngestionPipeline ingestionPipeline,
            QueryPipeline queryPipeline,
            CollectionService collectionService,
            SessionService sessionService
    ) {
        this.ingestionPipeline = ingestionPipeline;
        this.queryPipeline = queryPipeline;
        this.collectionService = collectionService;
        this.sessionService = sessionService;
    }

    public record LawDescriptor(
            String country,
            String lawType,
            String lawName,
            String lawNameEn,
            String lawNumber,
            Integer lawYear
    ) {
    }

    public IngestResponse ingest(byte[] pdfBytes, String filename, LawDescriptor law) {
        SupportedCountry country = CollectionService.requireCountry(law.country());
        LawType lawType = requireLawType(law.lawType());

        ArticleMetadata metadata = new ArticleMetadata(
                country.code(),
                lawType.code(),
                law.lawName(),
                law.lawNameEn(),
                law.lawNumber(),
                law.lawYear(),
                filename
        );

        String collection = collectionService.ensureCountryCollection(country);
        IngestionOutput output = ingestionPipeline.run(pdfBytes, metadata, collection);

        if (!output.success()) {
            throw new BusinessException(HttpStatus.INTERNAL_SERVER_ERROR,
                    "Ingestion failed: " + String.join("; ", output.errors()));
        }

        return IngestResponse.builder()
                .success(true)
                .collectionName(collection)
                .lawName(law.lawName())
                .articlesCount(output.articlesCount())
                .chunksCount(output.chunksCount())
                .pagesProcessed(output.pagesProcessed())
                .durationMs(output.durationMs())
                .message("Ingested " + output.articlesCount() + " articles into " + output.chunksCount() + " chunks")
                .build();
    }

    public QueryResponse ask(QueryRequest request) {
        SupportedCountry country = CollectionService.requireCountry(request.getCountry());
        List<String> lawTypes = request.getLawTypes() == null
                ? List.of()
                : request.getLawTypes().stream().map(t -> requireLawType(t).code()).distinct().toList();

        if (!collectionService.hasPoints(country)) {
            throw new BusinessException(HttpStatus.NOT_FOUND,
                    "No laws have been ingested for country: " + country.code());
        }

        String sessionId = request.getSessionId();
        String history = loadHistory(sessionId);
        int topK = request.getTopK() == null ? 0 : request.getTopK();

        QueryOutput output = queryPipeline.run(
                new QueryInput(request.getQuestion(), country.code(), lawTypes, sessionId, topK, history),
                CollectionService.collectionName(country.code()));

        saveTurn(sessionId, request.getQuestion(), output);

        return QueryResponse.builder()
                .answer(output.answer())
                .sources(output.sources())
                .sessionId(sessionId)
                .country(country.code())
                .queryTimeMs(output.queryTimeMs())
                .chunksRetrieved(output.chunksRetrieved())
                .chunksAfterRerank(output.chunksAfterRerank())
                .stageTimingsMs(output.stageTimingsMs())
                .embeddingModel(output.embeddingModel())
                .rerankerModel(output.rerankerModel())
                .llmModel(output.llmModel())
                .build();
    }

    private String loadHistory(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            return null;
        }
        try {
            String history = sessionService.contextForPrompt(sessionId);
            return history.isBlank() ? null : history;
        } catch (RuntimeException e) {
            log.warn("event=session_history_failed id={} err={}", sessionId, e.toString());
            return null;
        }
    }

    private void saveTurn(String sessionId, String question, QueryOutput output) {
        if (sessionId == null || sessionId.isBlank()) {
            return;
        }
        try {
            sessionService.addUserMessage(sessionId, question);
            sessionService.addAssistantMessage(sessionId, output.answer(), output.sources());
        } catch (RuntimeException e) {
            log.warn("event=session_save_failed id={} err={}", sessionId, e.toString());
        }
    }

    private static LawType requireLawType(String code) {
        return LawType.fromCode(code)
                .orElseThrow(() -> new BusinessException(HttpStatus.BAD_REQUEST, "Unsupported law type: " + code));
    }
}
