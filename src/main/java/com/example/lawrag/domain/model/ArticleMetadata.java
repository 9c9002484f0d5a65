package com.example.lawrag.domain.model;

/**
 * Document-level metadata copied onto every chunk of an ingested law.
 */
public record ArticleMetadata(
        String country,
        String lawType,
        String lawName,
        String lawNameEn,
        String lawNumber,
        Integer lawYear,
        String sourceFile
) {
}
