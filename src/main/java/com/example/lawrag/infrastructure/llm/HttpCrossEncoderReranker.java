package com.example.lawrag.infrastructure.llm;

import com.example.lawrag.domain.port.Reranker;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;

/**
 * Cross-encoder served over HTTP with the text-embeddings-inference {@code /rerank} contract:
 * {@code {"query", "texts"}} in, {@code [{"index", "score"}]} out, in any order.
 */
@Service
public class HttpCrossEncoderReranker implements Reranker {

    private static final Logger log = LoggerFactory.getLogger(HttpCrossEncoderReranker.class);

    private static final TypeReference<List<Map<String, Object>>> RESPONSE_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;
    private final HttpClient httpClient;
    private final String baseUrl;
    private final String model;
    private final int readTimeoutMs;

    public HttpCrossEncoderReranker(
            ObjectMapper objectMapper,
            @Value("${lawrag.reranker.base-url}") String baseUrl,
            @Value("${lawrag.reranker.model:bge-reranker-v2-m3}") String model,
            @Value("${lawrag.reranker.connect-timeout-ms:5000}") int connectTimeoutMs,
            @Value("${lawrag.reranker.read-timeout-ms:60000}") int readTimeoutMs
    ) {
        this.objectMapper = objectMapper;
        this.baseUrl = baseUrl;
        this.model = model;
        this.readTimeoutMs = readTimeoutMs;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(connectTimeoutMs))
                .version(HttpClient.Version.HTTP_1_1)
                .build();
        log.info("event=reranker_client_config baseUrl={} model={}", baseUrl, model);
    }

    @Override
    public double score(String query, String document) {
        return scoreAll(query, List.of(document)).get(0);
    }

    @Override
    @Retryable(
            retryFor = {RuntimeException.class},
            maxAttemptsExpression = "#{${lawrag.reranker.retries:2} + 1}",
            backoff = @Backoff(delay = 200, multiplier = 2.0)
    )
    public List<Double> scoreAll(String query, List<String> documents) {
        if (documents == null || documents.isEmpty()) {
            return List.of();
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("query", query);
        payload.put("texts", documents);
        payload.put("raw_scores", false);
        payload.put("truncate", true);

        String body;
        try {
            body = objectMapper.writeValueAsString(payload);
        } catch (Exception e) {
            throw new RuntimeException("Failed to serialize rerank request", e);
        }

        URI uri = URI.create(baseUrl.endsWith("/") ? baseUrl + "rerank" : baseUrl + "/rerank");
        HttpRequest req = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(Duration.ofMillis(readTimeoutMs))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();

        long t0 = System.nanoTime();
        try {
            HttpResponse<String> resp = httpClient.send(req, HttpResponse.BodyHandlers.ofString());
            long ms = (System.nanoTime() - t0) / 1_000_000;
            if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
                log.warn("event=rerank_http_error status={} ms={}", resp.statusCode(), ms);
                throw new RuntimeException("Reranker HTTP error: " + resp.statusCode());
            }

            List<Double> scores = toOrderedScores(objectMapper.readValue(resp.body(), RESPONSE_TYPE), documents.size());
            log.info("event=rerank_ok model={} docs={} ms={}", model, documents.size(), ms);
            return scores;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException("Rerank request interrupted", e);
        } catch (Exception e) {
            throw new RuntimeException("Rerank request failed", e);
        }
    }

    static List<Double> toOrderedScores(List<Map<String, Object>> results, int expected) {
        List<Double> scores = new ArrayList<>(Collections.nCopies(expected, (Double) null));
        for (Map<String, Object> r : results) {
            int index = ((Number) r.get("index")).intValue();
            if (index < 0 || index >= expected) {
                throw new IllegalStateException("Reranker returned out-of-range index " + index);
            }
            scores.set(index, ((Number) r.get("score")).doubleValue());
        }
        if (scores.contains(null)) {
            throw new IllegalStateException("Reranker returned " + results.size() + " scores for " + expected + " texts");
        }
        return scores;
    }

    @Override
    public String modelName() {
        return model;
    }
}
