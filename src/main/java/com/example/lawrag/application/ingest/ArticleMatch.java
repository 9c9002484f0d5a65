package com.example.lawrag.application.ingest;

/**
 * A candidate article header found in the page buffer. A reversed-digit reading of the same
 * header is a second candidate with the same offsets.
 */
public record ArticleMatch(int number, String markerText, int start, int end, boolean reversedReading) {
}
