package com.example.lawrag.domain.port;

import com.example.lawrag.domain.model.SparseVector;
import java.util.List;
import java.util.Map;

/**
 * Collection-scoped store holding a dense vector, a sparse vector and a payload per point.
 */
public interface VectorStore {

    boolean collectionExists(String collection);

    /**
     * @return false when the collection already existed
     */
    boolean createCollection(String collection, int denseDimension);

    boolean deleteCollection(String collection);

    /**
     * Inserts or replaces points by id.
     *
     * @return number of points written
     */
    int upsert(String collection, List<VectorPoint> points);

    /**
     * Prefetches {@code limit} candidates from each of the dense and sparse indexes under the same
     * filter and returns them fused by reciprocal rank, best first.
     */
    List<ScoredPoint> hybridSearch(String collection, float[] dense, SparseVector sparse,
                                   SearchFilter filter, int limit);

    long countPoints(String collection);

    boolean isHealthy();

    record VectorPoint(String id, float[] dense, SparseVector sparse, Map<String, Object> payload) {
    }

    record ScoredPoint(String id, double score, Map<String, Object> payload) {
    }

    /**
     * Exact country match plus match-any on law types. Null or empty parts do not filter.
     */
    record SearchFilter(String country, List<String> lawTypes) {

        public static SearchFilter none() {
            return new SearchFilter(null, List.of());
        }

        public boolean hasCountry() {
            return country != null && !country.isBlank();
        }

        public boolean hasLawTypes() {
            return lawTypes != null && !lawTypes.isEmpty();
        }
    }
}
