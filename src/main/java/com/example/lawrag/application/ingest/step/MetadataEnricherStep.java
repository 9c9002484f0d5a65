package com.example.lawrag.application.ingest.step;

import com.example.lawrag.application.ingest.ChunkBuilder;
import com.example.lawrag.application.pipeline.PipelineStep;
import com.example.lawrag.domain.model.ArticleMetadata;
import com.example.lawrag.domain.model.DocumentChunk;
import com.example.lawrag.domain.model.RawArticle;
import java.util.List;
import java.util.Map;

/**
 * Builds chunks for one law. The metadata belongs to a single run, so a new step is created per run.
 */
public class MetadataEnricherStep implements PipelineStep<List<RawArticle>, List<DocumentChunk>> {

    private final ChunkBuilder chunkBuilder;
    private final ArticleMetadata metadata;

    public MetadataEnricherStep(ChunkBuilder chunkBuilder, ArticleMetadata metadata) {
        this.chunkBuilder = chunkBuilder;
        this.metadata = metadata;
    }

    @Override
    public String name() {
        return "metadata_enricher";
    }

    @Override
    public boolean validate(List<RawArticle> input) {
        return input != null && !input.isEmpty();
    }

    @Override
    public List<DocumentChunk> process(List<RawArticle> input, Map<String, Object> context) {
        List<DocumentChunk> chunks = chunkBuilder.build(input, metadata);
        context.put(IngestionContextKeys.CHUNKS_CREATED, chunks.size());
        return chunks;
    }
}
