package com.example.lawrag.application.ingest;

import com.example.lawrag.domain.model.ArticleMetadata;
import com.example.lawrag.domain.model.DocumentChunk;
import com.example.lawrag.domain.model.RawArticle;
import com.example.lawrag.util.ArabicNumerals;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.regex.Pattern;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Turns articles into indexable chunks, one per article unless the article exceeds the token budget.
 *
 * <p>Token counts are estimated from character length. Oversized articles are split greedily on
 * paragraph boundaries (blank lines), or on line boundaries when the article has no blank lines.
 * A single unit larger than the budget is kept whole.
 */
@Component
public class ChunkBuilder {

    private static final Pattern PARAGRAPH_BREAK = Pattern.compile("\\n\\s*\\n");
    private static final String PARAGRAPH_SEPARATOR = "\n\n";
    private static final String LINE_SEPARATOR = "\n";

    private final int maxChunkTokens;
    private final double charsPerToken;
    private final String partMarkerTemplate;

    public ChunkBuilder(
            @Value("${lawrag.chunking.max-tokens:1000}") int maxChunkTokens,
            @Value("${lawrag.chunking.chars-per-token:1.5}") double charsPerToken,
            @Value("${lawrag.chunking.part-marker:[مادة %s - جزء %s من %s]}") String partMarkerTemplate
    ) {
        if (maxChunkTokens <= 0) {
            throw new IllegalArgumentException("maxChunkTokens must be > 0");
        }
        if (charsPerToken <= 0) {
            throw new IllegalArgumentException("charsPerToken must be > 0");
        }
        this.maxChunkTokens = maxChunkTokens;
        this.charsPerToken = charsPerToken;
        this.partMarkerTemplate = partMarkerTemplate;
    }

    public int estimateTokens(String text) {
        return text == null ? 0 : (int) (text.length() / charsPerToken);
    }

    public List<DocumentChunk> build(List<RawArticle> articles, ArticleMetadata metadata) {
        if (metadata == null) {
            throw new IllegalArgumentException("metadata is required");
        }
        List<DocumentChunk> chunks = new ArrayList<>();
        for (RawArticle article : articles) {
            chunks.addAll(build(article, metadata));
        }
        return chunks;
    }

    public List<DocumentChunk> build(RawArticle article, ArticleMetadata metadata) {
        List<String> parts = split(article.content());
        int total = parts.size();

        List<DocumentChunk> out = new ArrayList<>(total);
        for (int i = 0; i < total; i++) {
            int part = i + 1;
            String content = part == 1 ? parts.get(i) : partMarker(article.articleNumber(), part, total) + parts.get(i);
            out.add(DocumentChunk.builder()
                    .chunkId(chunkId(metadata.country(), metadata.lawType(), article.articleNumber(), part))
                    .content(content)
                    .articleNumber(article.articleNumber())
                    .articleText(article.markerText())
                    .pageNumber(article.pageNumber())
                    .chapter(article.chapter())
                    .chunkPart(part)
                    .totalParts(total)
                    .metadata(metadata)
                    .build());
        }
        return out;
    }

    List<String> split(String content) {
        String text = content == null ? "" : content.trim();
        if (estimateTokens(text) <= maxChunkTokens) {
            return List.of(text);
        }

        boolean hasParagraphs = PARAGRAPH_BREAK.matcher(text).find();
        String separator = hasParagraphs ? PARAGRAPH_SEPARATOR : LINE_SEPARATOR;
        String[] units = hasParagraphs ? PARAGRAPH_BREAK.split(text) : text.split("\\n");

        List<String> parts = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        for (String raw : units) {
            String unit = raw.trim();
            if (unit.isEmpty()) {
                continue;
            }
            if (current.length() > 0) {
                int candidateChars = current.length() + separator.length() + unit.length();
                if (candidateChars / charsPerToken > maxChunkTokens) {
                    parts.add(current.toString());
                    current.setLength(0);
                } else {
                    current.append(separator);
                }
            }
            current.append(unit);
        }
        if (current.length() > 0) {
            parts.add(current.toString());
        }
        return parts;
    }

    String partMarker(int articleNumber, int part, int total) {
        return String.format(partMarkerTemplate, articleNumber,
                ArabicNumerals.toArabicIndic(part), ArabicNumerals.toArabicIndic(total)) + PARAGRAPH_SEPARATOR;
    }

    /**
     * Name-based UUID of (country, law type, article, part): re-ingesting the same law overwrites its points.
     */
    public static String chunkId(String country, String lawType, int articleNumber, int part) {
        String key = country + "_" + lawType + "_art" + articleNumber + "_p" + part;
        return UUID.nameUUIDFromBytes(key.getBytes(StandardCharsets.UTF_8)).toString();
    }
}
