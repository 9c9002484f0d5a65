package com.example.lawrag.domain.model;

/**
 * One article as cut out of the page buffer, before chunking. Article 0 is the preamble.
 */
public record RawArticle(
        int articleNumber,
        String markerText,
        String content,
        int pageNumber,
        String chapter
) {
}
