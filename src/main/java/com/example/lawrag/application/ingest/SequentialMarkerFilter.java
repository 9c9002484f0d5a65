package com.example.lawrag.application.ingest;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Picks the article headers that form the document's running article sequence and drops inline
 * references ("see Article 10") that would otherwise split an article in two.
 *
 * <p>Candidates must be ordered by offset. The accepted run is the longest one in which every header
 * sits at most {@code maxGap} numbers past the one expected after its predecessor, so an inline
 * reference that jumps ahead cannot displace the real headers behind it. A value one below the
 * seed is tolerated only as the first header of a run.
 */
public class SequentialMarkerFilter {

    public static final int DEFAULT_MAX_GAP = 3;

    private final int maxGap;

    public SequentialMarkerFilter() {
        this(DEFAULT_MAX_GAP);
    }

    public SequentialMarkerFilter(int maxGap) {
        if (maxGap < 0) {
            throw new IllegalArgumentException("maxGap must be >= 0");
        }
        this.maxGap = maxGap;
    }

    public List<ArticleMatch> filter(List<ArticleMatch> candidates) {
        if (candidates == null || candidates.isEmpty()) {
            return List.of();
        }

        List<ArticleMatch> best = run(candidates, 1);

        int min = candidates.stream().mapToInt(ArticleMatch::number).min().orElse(1);
        if (min > 0 && min != 1) {
            List<ArticleMatch> fromMin = run(candidates, min);
            if (fromMin.size() > best.size()) {
                best = fromMin;
            }
        }
        return Collections.unmodifiableList(best);
    }

    /**
     * Longest chain of offset-ordered candidates whose numbers rise by 1 to {@code maxGap + 1} at each
     * step and whose first number lies in {@code [seed - 1, seed + maxGap]}. Ties keep the earliest
     * candidates.
     */
    private List<ArticleMatch> run(List<ArticleMatch> candidates, int seed) {
        int size = candidates.size();
        int[] length = new int[size];
        int[] previous = new int[size];
        int bestEnd = -1;

        for (int i = 0; i < size; i++) {
            ArticleMatch m = candidates.get(i);
            int n = m.number();
            previous[i] = -1;
            length[i] = n >= seed - 1 && n <= seed + maxGap ? 1 : 0;

            for (int j = 0; j < i; j++) {
                ArticleMatch p = candidates.get(j);
                if (length[j] == 0 || p.start() >= m.start()) {
                    continue;
                }
                int step = n - p.number();
                if (step >= 1 && step <= maxGap + 1 && length[j] + 1 > length[i]) {
                    length[i] = length[j] + 1;
                    previous[i] = j;
                }
            }
            if (length[i] > 0 && (bestEnd < 0 || length[i] > length[bestEnd])) {
                bestEnd = i;
            }
        }

        List<ArticleMatch> accepted = new ArrayList<>();
        for (int i = bestEnd; i >= 0; i = previous[i]) {
            accepted.add(candidates.get(i));
        }
        Collections.reverse(accepted);
        return accepted;
    }
}
