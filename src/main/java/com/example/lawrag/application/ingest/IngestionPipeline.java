package com.example.lawrag.application.ingest;

import com.example.lawrag.application.ingest.step.ArticleSplitterStep;
import com.example.lawrag.application.ingest.step.DenseEmbedderStep;
import com.example.lawrag.application.ingest.step.IngestionContextKeys;
import com.example.lawrag.application.ingest.step.MetadataEnricherStep;
import com.example.lawrag.application.ingest.step.PdfLoaderStep;
import com.example.lawrag.application.ingest.step.SparseEncoderStep;
import com.example.lawrag.application.ingest.step.TextExtractorStep;
import com.example.lawrag.application.ingest.step.VectorStoreWriterStep;
import com.example.lawrag.application.pipeline.Pipeline;
import com.example.lawrag.application.pipeline.PipelineResult;
import com.example.lawrag.domain.model.ArticleMetadata;
import com.example.lawrag.domain.port.DenseEncoder;
import com.example.lawrag.domain.port.SparseEncoder;
import com.example.lawrag.domain.port.VectorStore;
import com.example.lawrag.infrastructure.ingest.PdfExtractor;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * PDF bytes to stored chunks: load, extract pages, split articles, build chunks, dense-embed,
 * sparse-encode, upsert. Stops at the first failing step.
 */
@Service
public class IngestionPipeline {

    private static final Logger log = LoggerFactory.getLogger(IngestionPipeline.class);

    public static final String PIPELINE_NAME = "ingestion";

    private final PdfExtractor pdfExtractor;
    private final ArticleSegmenter segmenter;
    private final ChunkBuilder chunkBuilder;
    private final DenseEncoder denseEncoder;
    private final SparseEncoder sparseEncoder;
    private final VectorStore vectorStore;

    public IngestionPipeline(
            PdfExtractor pdfExtractor,
            ArticleSegmenter segmenter,
            ChunkBuilder chunkBuilder,
            DenseEncoder denseEncoder,
            SparseEncoder sparseEncoder,
            VectorStore vectorStore
    ) {
        this.pdfExtractor = pdfExtractor;
        this.segmenter = segmenter;
        this.chunkBuilder = chunkBuilder;
        this.denseEncoder = denseEncoder;
        this.sparseEncoder = sparseEncoder;
        this.vectorStore = vectorStore;
    }

    public Pipeline assemble(ArticleMetadata metadata, String collectionName) {
        return new Pipeline(PIPELINE_NAME)
                .addStep(new PdfLoaderStep(pdfExtractor))
                .addStep(new TextExtractorStep(pdfExtractor))
                .addStep(new ArticleSplitterStep(segmenter))
                .addStep(new MetadataEnricherStep(chunkBuilder, metadata))
                .addStep(new DenseEmbedderStep(denseEncoder))
                .addStep(new SparseEncoderStep(sparseEncoder))
                .addStep(new VectorStoreWriterStep(vectorStore, collectionName));
    }

    public IngestionOutput run(byte[] pdfBytes, ArticleMetadata metadata, String collectionName) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("collection_name", collectionName);
        context.put("filename", metadata.sourceFile());

        log.info("event=ingest_start collection={} file={} law={} bytes={}",
                collectionName, metadata.sourceFile(), metadata.lawName(), pdfBytes == null ? 0 : pdfBytes.length);

        PipelineResult result = assemble(metadata, collectionName).run(pdfBytes, context, true);

        IngestionOutput output = new IngestionOutput(
                result.success(),
                collectionName,
                intValue(context, IngestionContextKeys.ARTICLES_FOUND),
                intValue(context, IngestionContextKeys.CHUNKS_CREATED),
                intValue(context, IngestionContextKeys.PAGES_WITH_TEXT),
                intValue(context, IngestionContextKeys.POINTS_STORED),
                result.totalDurationMs(),
                result.errors(),
                result.steps()
        );

        log.info("event=ingest_done collection={} success={} articles={} chunks={} pages={} stored={} ms={}",
                collectionName, output.success(), output.articlesCount(), output.chunksCount(),
                output.pagesProcessed(), output.pointsStored(), output.durationMs());
        return output;
    }

    private static int intValue(Map<String, Object> context, String key) {
        Object v = context.get(key);
        return v instanceof Number n ? n.intValue() : 0;
    }
}
