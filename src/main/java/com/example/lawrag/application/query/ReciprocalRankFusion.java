package com.example.lawrag.application.query;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Rank-based fusion of several result lists: an item scores {@code sum(1 / (k + rank))} over the
 * lists it appears in, with 1-based ranks. Raw scores of the input lists are ignored, so lists on
 * incomparable scales (cosine, BM25) fuse cleanly.
 */
public class ReciprocalRankFusion {

    public static final int DEFAULT_K = 60;

    private final int k;

    public ReciprocalRankFusion() {
        this(DEFAULT_K);
    }

    public ReciprocalRankFusion(int k) {
        if (k < 0) {
            throw new IllegalArgumentException("k must be >= 0");
        }
        this.k = k;
    }

    public record Fused<T>(String id, T item, double score) {
    }

    /**
     * Ties keep first-appearance order: earlier lists first, then by position within a list.
     */
    public <T> List<Fused<T>> fuse(List<List<T>> rankings, Function<T, String> idOf, int limit) {
        Map<String, T> items = new LinkedHashMap<>();
        Map<String, Double> scores = new LinkedHashMap<>();

        for (List<T> ranking : rankings) {
            if (ranking == null) {
                continue;
            }
            for (int i = 0; i < ranking.size(); i++) {
                T item = ranking.get(i);
                String id = idOf.apply(item);
                items.putIfAbsent(id, item);
                scores.merge(id, 1.0 / (k + i + 1), Double::sum);
            }
        }

        List<Fused<T>> fused = new ArrayList<>(scores.size());
        for (Map.Entry<String, Double> e : scores.entrySet()) {
            fused.add(new Fused<>(e.getKey(), items.get(e.getKey()), e.getValue()));
        }
        fused.sort(Comparator.comparingDouble((Fused<T> f) -> f.score()).reversed());
        return limit > 0 && fused.size() > limit ? new ArrayList<>(fused.subList(0, limit)) : fused;
    }
}
