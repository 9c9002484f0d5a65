package com.example.lawrag.infrastructure.search;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import com.example.lawrag.domain.model.SparseVector;
import com.example.lawrag.domain.port.VectorStore.SearchFilter;
import com.example.lawrag.domain.port.VectorStore.VectorPoint;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ElasticsearchVectorStoreTest {

    private final ElasticsearchVectorStore store =
            new ElasticsearchVectorStore(mock(ElasticsearchClient.class), new ObjectMapper(), Runnable::run,
                    new HybridSearchSettings(60, 4));

    @Test
    void filterClausesCombineCountryAndLawTypes() {
        List<Map<String, Object>> clauses = ElasticsearchVectorStore.filterClauses(
                new SearchFilter("egypt", List.of("civil", "criminal")));

        assertEquals(List.of(
                Map.of("term", Map.of("country", "egypt")),
                Map.of("terms", Map.of("law_type", List.of("civil", "criminal")))), clauses);
        assertTrue(ElasticsearchVectorStore.filterClauses(SearchFilter.none()).isEmpty());
    }

    @Test
    @SuppressWarnings("unchecked")
    void denseQueryIsFilteredKnn() {
        Map<String, Object> body = store.denseQuery(new float[]{0.1f, 0.2f}, new SearchFilter("jordan", List.of()), 25);

        Map<String, Object> knn = (Map<String, Object>) body.get("knn");
        assertEquals(ElasticsearchVectorStore.DENSE_FIELD, knn.get("field"));
        assertEquals(25, knn.get("k"));
        assertEquals(100, knn.get("num_candidates"));
        assertTrue(knn.containsKey("filter"));
        assertEquals(25, body.get("size"));
    }

    @Test
    @SuppressWarnings("unchecked")
    void sparseQueryBoostsRankFeaturesByQueryWeight() {
        SparseVector sparse = new SparseVector(new int[]{11, 42}, new float[]{1f, 0f});

        Map<String, Object> body = store.sparseQuery(sparse, SearchFilter.none(), 10);

        Map<String, Object> bool = (Map<String, Object>) ((Map<String, Object>) body.get("query")).get("bool");
        List<Map<String, Object>> should = (List<Map<String, Object>>) bool.get("should");
        assertEquals(1, should.size());
        Map<String, Object> feature = (Map<String, Object>) should.get(0).get("rank_feature");
        assertEquals("sparse_vector.11", feature.get("field"));
        assertEquals(1f, feature.get("boost"));
        assertEquals(1, bool.get("minimum_should_match"));
    }

    @Test
    @SuppressWarnings("unchecked")
    void documentDropsNonPositiveSparseWeights() {
        VectorPoint point = new VectorPoint("id-1", new float[]{0.5f},
                new SparseVector(new int[]{1, 2, 3}, new float[]{0.7f, 0f, -0.2f}),
                Map.of("chunk_id", "id-1", "country", "egypt"));

        Map<String, Object> doc = ElasticsearchVectorStore.toDocument(point);

        Map<String, Float> features = (Map<String, Float>) doc.get(ElasticsearchVectorStore.SPARSE_FIELD);
        assertEquals(Map.of("1", 0.7f), features);
        assertEquals("egypt", doc.get("country"));
        assertTrue(doc.containsKey(ElasticsearchVectorStore.DENSE_FIELD));
    }

    @Test
    @SuppressWarnings("unchecked")
    void indexDefinitionFixesDenseDimension() {
        Map<String, Object> definition = ElasticsearchVectorStore.indexDefinition(1024);

        Map<String, Object> properties = (Map<String, Object>) ((Map<String, Object>) definition.get("mappings"))
                .get("properties");
        Map<String, Object> dense = (Map<String, Object>) properties.get(ElasticsearchVectorStore.DENSE_FIELD);
        assertEquals(1024, dense.get("dims"));
        assertEquals("cosine", dense.get("similarity"));
        assertEquals(Map.of("type", "rank_features"), properties.get(ElasticsearchVectorStore.SPARSE_FIELD));
        assertEquals(Map.of("type", "keyword"), properties.get("law_type"));
        assertFalse(properties.containsKey("embedding"));
    }
}
