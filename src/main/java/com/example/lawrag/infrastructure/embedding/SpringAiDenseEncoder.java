package com.example.lawrag.infrastructure.embedding;

import com.example.lawrag.domain.port.DenseEncoder;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Dense encoder backed by the Spring AI embedding model (Ollama in the default configuration).
 * Vectors of the wrong size are rejected, since the index schema fixes the dimension.
 */
@Component
public class SpringAiDenseEncoder implements DenseEncoder {

    private static final Logger log = LoggerFactory.getLogger(SpringAiDenseEncoder.class);

    private final EmbeddingModel embeddingModel;
    private final int dimension;
    private final String modelName;

    public SpringAiDenseEncoder(
            EmbeddingModel embeddingModel,
            @Value("${lawrag.embedding.dimensions:1024}") int dimension,
            @Value("${lawrag.embedding.model:bge-m3}") String modelName
    ) {
        this.embeddingModel = embeddingModel;
        this.dimension = dimension;
        this.modelName = modelName;
        log.info("event=dense_encoder_config model={} dims={}", modelName, dimension);
    }

    @Override
    public float[] embed(String text) {
        float[] vector = embeddingModel.embed(text);
        checkDimension(vector);
        return vector;
    }

    @Override
    public List<float[]> embedBatch(List<String> texts) {
        if (texts == null || texts.isEmpty()) {
            return List.of();
        }
        long t0 = System.nanoTime();
        List<float[]> vectors = embeddingModel.embed(texts);
        vectors.forEach(this::checkDimension);
        log.info("event=dense_embed_batch count={} ms={}", vectors.size(), (System.nanoTime() - t0) / 1_000_000);
        return vectors;
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public String modelName() {
        return modelName;
    }

    private void checkDimension(float[] vector) {
        if (vector == null || vector.length != dimension) {
            throw new IllegalStateException("Embedding model returned dimension "
                    + (vector == null ? 0 : vector.length) + ", expected " + dimension);
        }
    }
}
