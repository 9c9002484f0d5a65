package com.example.lawrag.infrastructure.embedding;

import com.example.lawrag.domain.model.SparseVector;
import com.example.lawrag.domain.port.SparseEncoder;
import com.example.lawrag.util.ArabicNormalizer;
import com.example.lawrag.util.ArabicNumerals;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Pattern;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * BM25-style sparse encoder with hashed vocabulary.
 *
 * <p>Documents get the BM25 term-frequency saturation {@code tf*(k1+1) / (tf + k1*(1-b+b*len/avgLen))};
 * queries get weight 1 per distinct term, so the store's dot product sums the document weights of
 * matching terms. Tokens are folded aggressively (search normalization, ASCII digits, lower case).
 */
@Component
public class Bm25SparseEncoder implements SparseEncoder {

    private static final Pattern TOKEN_SPLIT = Pattern.compile("[^\\p{L}\\p{N}]+");

    // already in search-normalized form
    private static final Set<String> STOP_WORDS = Set.of(
            "في", "من", "علي", "الي", "عن", "مع", "او", "ثم", "ان", "التي", "الذي", "الذين", "هذا", "هذه",
            "ذلك", "تلك", "هو", "هي", "كل", "بين", "قد", "لا", "ما", "لم", "لن", "كان", "كانت", "يكون", "وفقا",
            "حيث", "اذا", "به", "بها", "له", "لها",
            "the", "of", "and", "or", "to", "in", "an", "is", "be", "by", "for", "on", "with", "as", "at");

    private final double k1;
    private final double b;
    private final double avgDocLength;

    public Bm25SparseEncoder(
            @Value("${lawrag.sparse.k1:1.2}") double k1,
            @Value("${lawrag.sparse.b:0.75}") double b,
            @Value("${lawrag.sparse.avg-doc-length:256}") double avgDocLength
    ) {
        if (k1 <= 0 || b < 0 || b > 1 || avgDocLength <= 0) {
            throw new IllegalArgumentException("Invalid BM25 parameters k1=" + k1 + " b=" + b + " avgLen=" + avgDocLength);
        }
        this.k1 = k1;
        this.b = b;
        this.avgDocLength = avgDocLength;
    }

    @Override
    public SparseVector encode(String document) {
        List<String> tokens = tokenize(document);
        if (tokens.isEmpty()) {
            return SparseVector.empty();
        }
        Map<Integer, Integer> termFrequencies = new TreeMap<>();
        for (String token : tokens) {
            termFrequencies.merge(indexOf(token), 1, Integer::sum);
        }

        double lengthNorm = 1 - b + b * tokens.size() / avgDocLength;
        int[] indices = new int[termFrequencies.size()];
        float[] values = new float[termFrequencies.size()];
        int i = 0;
        for (Map.Entry<Integer, Integer> e : termFrequencies.entrySet()) {
            int tf = e.getValue();
            indices[i] = e.getKey();
            values[i] = (float) (tf * (k1 + 1) / (tf + k1 * lengthNorm));
            i++;
        }
        return new SparseVector(indices, values);
    }

    @Override
    public List<SparseVector> encodeBatch(List<String> documents) {
        List<SparseVector> out = new ArrayList<>(documents.size());
        for (String document : documents) {
            out.add(encode(document));
        }
        return out;
    }

    @Override
    public SparseVector encodeQuery(String query) {
        TreeMap<Integer, Float> weights = new TreeMap<>();
        for (String token : tokenize(query)) {
            weights.put(indexOf(token), 1.0f);
        }
        int[] indices = new int[weights.size()];
        float[] values = new float[weights.size()];
        int i = 0;
        for (Map.Entry<Integer, Float> e : weights.entrySet()) {
            indices[i] = e.getKey();
            values[i] = e.getValue();
            i++;
        }
        return new SparseVector(indices, values);
    }

    @Override
    public String modelName() {
        return "bm25";
    }

    List<String> tokenize(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        String folded = ArabicNormalizer.normalizeForSearch(ArabicNumerals.toWestern(text)).toLowerCase(Locale.ROOT);
        List<String> tokens = new ArrayList<>();
        for (String token : TOKEN_SPLIT.split(folded)) {
            if (token.length() < 2 || STOP_WORDS.contains(token)) {
                continue;
            }
            tokens.add(token);
        }
        return tokens;
    }

    static int indexOf(String token) {
        return Math.floorMod(token.hashCode(), Integer.MAX_VALUE);
    }
}
