package com.example.lawrag.infrastructure.search;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.Refresh;
import co.elastic.clients.elasticsearch.core.BulkRequest;
import co.elastic.clients.elasticsearch.core.BulkResponse;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import co.elastic.clients.elasticsearch.core.SearchResponse;
import co.elastic.clients.elasticsearch.core.bulk.BulkOperation;
import co.elastic.clients.elasticsearch.core.search.Hit;
import co.elastic.clients.elasticsearch.indices.CreateIndexRequest;
import com.example.lawrag.application.query.ReciprocalRankFusion;
import com.example.lawrag.domain.model.SparseVector;
import com.example.lawrag.domain.port.VectorStore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Elasticsearch as a hybrid vector store. One index per collection holds the dense vector
 * ({@code dense_vector}, cosine), the sparse vector ({@code rank_features}) and the payload fields.
 *
 * <p>Hybrid search runs a filtered kNN query and a filtered rank-feature query (a dot product over
 * the query's sparse dimensions), then fuses both rankings by reciprocal rank.
 */
@Service
public class ElasticsearchVectorStore implements VectorStore {

    private static final Logger log = LoggerFactory.getLogger(ElasticsearchVectorStore.class);

    static final String DENSE_FIELD = "dense_vector";
    static final String SPARSE_FIELD = "sparse_vector";
    private static final int MAX_NUM_CANDIDATES = 10_000;

    private final ElasticsearchClient client;
    private final ObjectMapper objectMapper;
    private final ReciprocalRankFusion fusion;
    private final Executor executor;
    private final int numCandidatesFactor;

    public ElasticsearchVectorStore(
            ElasticsearchClient client,
            ObjectMapper objectMapper,
            @Qualifier("hybridSearchExecutor") Executor executor,
            HybridSearchSettings settings
    ) {
        this.client = client;
        this.objectMapper = objectMapper;
        this.fusion = new ReciprocalRankFusion(settings.rrfK());
        this.executor = executor;
        this.numCandidatesFactor = settings.numCandidatesFactor();
    }

    @Override
    public boolean collectionExists(String collection) {
        try {
            return client.indices().exists(e -> e.index(collection)).value();
        } catch (IOException e) {
            throw new RuntimeException("Failed to check Elasticsearch index: " + collection, e);
        }
    }

    @Override
    public boolean createCollection(String collection, int denseDimension) {
        if (collectionExists(collection)) {
            return false;
        }
        String body = toJson(indexDefinition(denseDimension));
        try {
            client.indices().create(CreateIndexRequest.of(c -> c
                    .index(collection)
                    .withJson(new StringReader(body))));
            log.info("event=es_index_created index={} dims={}", collection, denseDimension);
            return true;
        } catch (IOException e) {
            throw new RuntimeException("Failed to create Elasticsearch index: " + collection, e);
        }
    }

    @Override
    public boolean deleteCollection(String collection) {
        if (!collectionExists(collection)) {
            return false;
        }
        try {
            boolean ack = client.indices().delete(d -> d.index(collection)).acknowledged();
            log.info("event=es_index_deleted index={} ack={}", collection, ack);
            return ack;
        } catch (IOException e) {
            throw new RuntimeException("Failed to delete Elasticsearch index: " + collection, e);
        }
    }

    @Override
    public int upsert(String collection, List<VectorPoint> points) {
        if (points == null || points.isEmpty()) {
            return 0;
        }

        List<BulkOperation> ops = new ArrayList<>(points.size());
        for (VectorPoint point : points) {
            if (point.id() == null) {
                throw new IllegalArgumentException("Vector point missing id");
            }
            Map<String, Object> doc = toDocument(point);
            ops.add(BulkOperation.of(b -> b
                    .index(i -> i
                            .index(collection)
                            .id(point.id())
                            .document(doc)
                    )));
        }

        try {
            BulkRequest request = BulkRequest.of(b -> b.operations(ops).refresh(Refresh.WaitFor));
            BulkResponse resp = client.bulk(request);

            if (resp.errors()) {
                long failed = resp.items().stream().filter(item -> item.error() != null).count();
                resp.items().forEach(item -> {
                    if (item.error() != null) {
                        log.error("event=es_bulk_item_error id={} reason={}",
                                item.id(),
                                item.error().reason());
                    }
                });
                log.warn("event=es_bulk_index_errors index={} failed={} total={} took={}ms",
                        collection, failed, points.size(), resp.took());
                throw new IllegalStateException("Elasticsearch bulk upsert failed for " + failed
                        + " of " + points.size() + " points");
            }

            log.info("event=es_bulk_index_ok index={} count={} took={}ms",
                    collection, points.size(), resp.took());
            return points.size();
        } catch (IOException e) {
            throw new RuntimeException("Elasticsearch bulk index failed", e);
        }
    }

    @Override
    public List<ScoredPoint> hybridSearch(String collection, float[] dense, SparseVector sparse,
                                          SearchFilter filter, int limit) {
        SearchFilter f = filter == null ? SearchFilter.none() : filter;
        long t0 = System.nanoTime();

        CompletableFuture<List<ScoredPoint>> denseF = CompletableFuture.supplyAsync(
                () -> search(collection, denseQuery(dense, f, limit)),
                executor
        );
        CompletableFuture<List<ScoredPoint>> sparseF = sparse == null || sparse.isEmpty()
                ? CompletableFuture.completedFuture(List.of())
                : CompletableFuture.supplyAsync(() -> search(collection, sparseQuery(sparse, f, limit)), executor);

        List<ScoredPoint> denseHits = join(denseF);
        List<ScoredPoint> sparseHits = join(sparseF);

        List<ScoredPoint> fused = fusion.fuse(List.of(denseHits, sparseHits), ScoredPoint::id, limit).stream()
                .map(r -> new ScoredPoint(r.id(), r.score(), r.item().payload()))
                .toList();

        log.info("event=es_hybrid_search index={} country={} lawTypes={} dense={} sparse={} fused={} ms={}",
                collection, f.country(), f.lawTypes(), denseHits.size(), sparseHits.size(), fused.size(),
                (System.nanoTime() - t0) / 1_000_000);
        return fused;
    }

    @Override
    public long countPoints(String collection) {
        try {
            return client.count(c -> c.index(collection)).count();
        } catch (IOException e) {
            throw new RuntimeException("Failed to count documents in index: " + collection, e);
        }
    }

    @Override
    public boolean isHealthy() {
        try {
            return client.ping().value();
        } catch (IOException e) {
            log.warn("event=es_ping_failed err={}", e.toString());
            return false;
        }
    }

    private static <T> T join(CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException re) {
                throw re;
            }
            throw e;
        }
    }

    private List<ScoredPoint> search(String collection, Map<String, Object> body) {
        String json = toJson(body);
        try {
            SearchRequest request = SearchRequest.of(b -> b
                    .withJson(new StringReader(json))
                    .index(collection));
            SearchResponse<Map> response = client.search(request, Map.class);

            List<ScoredPoint> hits = new ArrayList<>();
            for (Hit<Map> hit : response.hits().hits()) {
                Map<String, Object> src = hit.source();
                if (src == null) {
                    continue;
                }
                double score = hit.score() == null ? 0.0 : hit.score();
                hits.add(new ScoredPoint(hit.id(), score, src));
            }
            return hits;
        } catch (IOException e) {
            throw new RuntimeException("Elasticsearch search failed on index: " + collection, e);
        }
    }

    Map<String, Object> denseQuery(float[] dense, SearchFilter filter, int limit) {
        Map<String, Object> knn = new LinkedHashMap<>();
        knn.put("field", DENSE_FIELD);
        knn.put("query_vector", dense);
        knn.put("k", limit);
        knn.put("num_candidates", Math.min(MAX_NUM_CANDIDATES, Math.max(100, limit * numCandidatesFactor)));
        List<Map<String, Object>> filters = filterClauses(filter);
        if (!filters.isEmpty()) {
            knn.put("filter", Map.of("bool", Map.of("filter", filters)));
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("size", limit);
        body.put("_source", sourceFilter());
        body.put("knn", knn);
        return body;
    }

    Map<String, Object> sparseQuery(SparseVector sparse, SearchFilter filter, int limit) {
        List<Map<String, Object>> should = new ArrayList<>(sparse.nonZeroCount());
        for (int i = 0; i < sparse.indices().length; i++) {
            if (sparse.values()[i] <= 0f) {
                continue;
            }
            Map<String, Object> feature = new LinkedHashMap<>();
            feature.put("field", SPARSE_FIELD + "." + sparse.indices()[i]);
            feature.put("boost", sparse.values()[i]);
            feature.put("linear", Map.of());
            should.add(Map.of("rank_feature", feature));
        }

        Map<String, Object> bool = new LinkedHashMap<>();
        bool.put("filter", filterClauses(filter));
        bool.put("should", should);
        bool.put("minimum_should_match", 1);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("size", limit);
        body.put("_source", sourceFilter());
        body.put("query", Map.of("bool", bool));
        return body;
    }

    static List<Map<String, Object>> filterClauses(SearchFilter filter) {
        List<Map<String, Object>> clauses = new ArrayList<>(2);
        if (filter.hasCountry()) {
            clauses.add(Map.of("term", Map.of("country", filter.country())));
        }
        if (filter.hasLawTypes()) {
            clauses.add(Map.of("terms", Map.of("law_type", filter.lawTypes())));
        }
        return clauses;
    }

    static Map<String, Object> indexDefinition(int denseDimension) {
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put(DENSE_FIELD, Map.of(
                "type", "dense_vector",
                "dims", denseDimension,
                "index", true,
                "similarity", "cosine"));
        properties.put(SPARSE_FIELD, Map.of("type", "rank_features"));
        properties.put("chunk_id", Map.of("type", "keyword"));
        properties.put("content", Map.of("type", "text"));
        properties.put("article_number", Map.of("type", "integer"));
        properties.put("article_text", Map.of("type", "keyword"));
        properties.put("page_number", Map.of("type", "integer"));
        properties.put("country", Map.of("type", "keyword"));
        properties.put("law_type", Map.of("type", "keyword"));
        properties.put("law_name", Map.of("type", "keyword"));
        properties.put("law_name_en", Map.of("type", "keyword"));
        properties.put("law_number", Map.of("type", "keyword"));
        properties.put("law_year", Map.of("type", "integer"));
        properties.put("source_file", Map.of("type", "keyword"));
        properties.put("chapter", Map.of("type", "keyword"));
        properties.put("chunk_part", Map.of("type", "integer"));
        properties.put("total_parts", Map.of("type", "integer"));

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("settings", Map.of("number_of_shards", 1, "number_of_replicas", 0));
        body.put("mappings", Map.of("properties", properties));
        return body;
    }

    private static Map<String, Object> sourceFilter() {
        return Map.of("excludes", List.of(DENSE_FIELD, SPARSE_FIELD));
    }

    static Map<String, Object> toDocument(VectorPoint point) {
        Map<String, Object> doc = new LinkedHashMap<>(point.payload());
        doc.put(DENSE_FIELD, point.dense());
        // rank_features rejects zero and negative weights
        Map<String, Float> features = new LinkedHashMap<>();
        point.sparse().toFeatureMap().forEach((k, v) -> {
            if (v > 0f) {
                features.put(k, v);
            }
        });
        doc.put(SPARSE_FIELD, features);
        return doc;
    }

    private String toJson(Map<String, Object> body) {
        try {
            return objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to serialize Elasticsearch request", e);
        }
    }
}
