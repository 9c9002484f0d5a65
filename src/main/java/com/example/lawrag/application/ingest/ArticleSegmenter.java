package com.example.lawrag.application.ingest;

import com.example.lawrag.domain.model.PageContent;
import com.example.lawrag.domain.model.RawArticle;
import com.example.lawrag.util.ArabicNumerals;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Cuts the concatenated page text of a statute into numbered articles.
 *
 * <p>Works in two passes. The first collects every header-looking match, together with the
 * digit-reversed reading of multi-digit numbers (right-to-left PDFs often store "12" as "21").
 * The second keeps only the headers that continue the running article sequence, see
 * {@link SequentialMarkerFilter}.
 */
@Component
public class ArticleSegmenter {

    private static final Logger log = LoggerFactory.getLogger(ArticleSegmenter.class);

    public static final String PREAMBLE_MARKER = "مقدمة";

    static final Pattern ARTICLE_HEADER = Pattern.compile(
            "(?:المادة|مادة|اﻟﻤﺎدة|ﻣﺎدة|Article|ARTICLE|Art\\.)"
                    + "\\s*[-–—]?\\s*"
                    + "(?:[\\[(]\\s*)?"
                    + "([٠-٩0-9]+)"
                    + "(?:\\s*[\\])])?"
                    + "(?:[ \\t]*[-–—:])?");

    private static final Pattern CHAPTER = Pattern.compile(
            "(?:الباب|الفصل|القسم)\\s*"
                    + "(?:الأول|الثاني|الثالث|الرابع|الخامس|السادس|السابع|الثامن|التاسع|العاشر|[٠-٩0-9]+)"
                    + "|(?:Chapter|CHAPTER|Part|PART)\\s+(?:[0-9]+|[IVXLC]+)\\b");

    private static final int CHAPTER_WINDOW = 500;

    private final int preambleMinChars;
    private final SequentialMarkerFilter markerFilter;

    public ArticleSegmenter(
            @Value("${lawrag.chunking.preamble-min-chars:100}") int preambleMinChars,
            @Value("${lawrag.chunking.max-article-gap:3}") int maxArticleGap
    ) {
        if (preambleMinChars < 0) {
            throw new IllegalArgumentException("preambleMinChars must be >= 0");
        }
        this.preambleMinChars = preambleMinChars;
        this.markerFilter = new SequentialMarkerFilter(maxArticleGap);
    }

    public List<RawArticle> segment(List<PageContent> pages) {
        if (pages == null || pages.isEmpty()) {
            return List.of();
        }

        TreeMap<Integer, Integer> pageStarts = new TreeMap<>();
        StringBuilder buffer = new StringBuilder();
        for (int i = 0; i < pages.size(); i++) {
            PageContent page = pages.get(i);
            pageStarts.put(buffer.length(), page.pageNumber());
            buffer.append(page.text() == null ? "" : page.text());
            if (i < pages.size() - 1) {
                buffer.append('\n');
            }
        }
        String text = buffer.toString();

        List<ArticleMatch> accepted = markerFilter.filter(findCandidates(text));
        if (accepted.isEmpty()) {
            String whole = text.trim();
            if (whole.isEmpty()) {
                return List.of();
            }
            log.info("event=segment_no_headers chars={}", whole.length());
            return List.of(new RawArticle(0, PREAMBLE_MARKER, whole, pages.get(0).pageNumber(), detectChapter(whole)));
        }

        List<RawArticle> articles = new ArrayList<>(accepted.size() + 1);
        ArticleMatch first = accepted.get(0);
        boolean foldPreamble = first.number() == 0;

        String preamble = text.substring(0, first.start()).trim();
        if (!foldPreamble && preamble.length() > preambleMinChars) {
            articles.add(new RawArticle(0, PREAMBLE_MARKER, preamble, pageAt(pageStarts, 0), detectChapter(preamble)));
        }

        for (int i = 0; i < accepted.size(); i++) {
            ArticleMatch m = accepted.get(i);
            int start = (i == 0 && foldPreamble) ? 0 : m.start();
            int end = i + 1 < accepted.size() ? accepted.get(i + 1).start() : text.length();
            String content = text.substring(start, end).trim();
            if (content.isEmpty()) {
                continue;
            }
            articles.add(new RawArticle(m.number(), m.markerText(), content, pageAt(pageStarts, m.start()),
                    detectChapter(content)));
        }

        log.info("event=segment_done candidates_accepted={} articles={} first={} last={}",
                accepted.size(), articles.size(), first.number(), accepted.get(accepted.size() - 1).number());
        return articles;
    }

    /**
     * All header matches in offset order. Multi-digit numbers yield a second, reversed candidate
     * right after the literal one.
     */
    List<ArticleMatch> findCandidates(String text) {
        List<ArticleMatch> out = new ArrayList<>();
        Matcher m = ARTICLE_HEADER.matcher(text);
        while (m.find()) {
            String digits = m.group(1);
            OptionalInt number = ArabicNumerals.parse(digits);
            if (number.isEmpty()) {
                continue;
            }
            String marker = m.group().trim();
            out.add(new ArticleMatch(number.getAsInt(), marker, m.start(), m.end(), false));

            OptionalInt reversed = ArabicNumerals.reversed(digits);
            if (reversed.isPresent()) {
                out.add(new ArticleMatch(reversed.getAsInt(), marker, m.start(), m.end(), true));
            }
        }
        out.sort(Comparator.comparingInt(ArticleMatch::start));
        return out;
    }

    static String detectChapter(String content) {
        if (content == null || content.isEmpty()) {
            return null;
        }
        String window = content.length() > CHAPTER_WINDOW ? content.substring(0, CHAPTER_WINDOW) : content;
        Matcher m = CHAPTER.matcher(window);
        return m.find() ? m.group().trim() : null;
    }

    private static int pageAt(TreeMap<Integer, Integer> pageStarts, int offset) {
        Map.Entry<Integer, Integer> e = pageStarts.floorEntry(offset);
        return e == null ? pageStarts.firstEntry().getValue() : e.getValue();
    }
}
