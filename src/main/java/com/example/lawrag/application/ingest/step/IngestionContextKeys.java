package com.example.lawrag.application.ingest.step;

/**
 * Counters the ingestion steps publish into the run context.
 */
public final class IngestionContextKeys {

    public static final String PAGE_COUNT = "page_count";
    public static final String PDF_TITLE = "pdf_title";
    public static final String PDF_AUTHOR = "pdf_author";
    public static final String PAGES_WITH_TEXT = "pages_with_text";
    public static final String TOTAL_CHARS = "total_chars";
    public static final String ARTICLES_FOUND = "articles_found";
    public static final String CHUNKS_CREATED = "chunks_created";
    public static final String DENSE_EMBEDDINGS = "dense_embeddings_generated";
    public static final String SPARSE_VECTORS = "sparse_vectors_generated";
    public static final String AVG_SPARSE_NONZERO = "avg_sparse_nonzero";
    public static final String POINTS_STORED = "points_stored";

    private IngestionContextKeys() {
    }
}
