package com.example.lawrag.domain.model;

/**
 * Text of one PDF page. Page numbers are 1-based.
 */
public record PageContent(int pageNumber, String text) {
}
