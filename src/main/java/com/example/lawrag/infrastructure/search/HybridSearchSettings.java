package com.example.lawrag.infrastructure.search;

/**
 * Tuning for {@link ElasticsearchVectorStore#hybridSearch}.
 *
 * @param rrfK                rank-fusion constant added to every rank
 * @param numCandidatesFactor kNN candidates gathered per requested hit, at least 1
 */
public record HybridSearchSettings(int rrfK, int numCandidatesFactor) {

    public HybridSearchSettings {
        if (rrfK < 1) {
            throw new IllegalArgumentException("rrfK must be >= 1");
        }
        numCandidatesFactor = Math.max(1, numCandidatesFactor);
    }
}
