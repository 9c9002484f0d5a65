package com.example.lawrag.application.query.step;

import com.example.lawrag.application.pipeline.PipelineStep;
import com.example.lawrag.application.query.FormatRequest;
import com.example.lawrag.application.query.QueryOutput;
import com.example.lawrag.domain.model.RetrievedChunk;
import com.example.lawrag.domain.model.Source;
import java.util.List;
import java.util.Map;

public class ResponseFormatterStep implements PipelineStep<FormatRequest, QueryOutput> {

    static final int PREVIEW_CHARS = 200;

    private final String embeddingModel;
    private final String rerankerModel;
    private final String llmModel;

    public ResponseFormatterStep(String embeddingModel, String rerankerModel, String llmModel) {
        this.embeddingModel = embeddingModel;
        this.rerankerModel = rerankerModel;
        this.llmModel = llmModel;
    }

    @Override
    public String name() {
        return "response_formatter";
    }

    @Override
    public boolean validate(FormatRequest input) {
        return input != null && input.answer() != null && input.chunks() != null;
    }

    @Override
    public QueryOutput process(FormatRequest input, Map<String, Object> context) {
        List<Source> sources = input.chunks().stream().map(ResponseFormatterStep::toSource).toList();
        return new QueryOutput(
                true,
                input.answer(),
                sources,
                input.elapsedMs(),
                input.chunksRetrieved(),
                input.chunks().size(),
                input.stageCount(),
                input.stageTimingsMs(),
                embeddingModel,
                rerankerModel,
                llmModel,
                List.of()
        );
    }

    static Source toSource(RetrievedChunk chunk) {
        return new Source(
                chunk.lawName(),
                chunk.articleNumber(),
                chunk.markerText(),
                chunk.pageNumber(),
                preview(chunk.content()),
                round4(chunk.effectiveScore())
        );
    }

    static String preview(String content) {
        if (content == null) {
            return "";
        }
        return content.length() > PREVIEW_CHARS ? content.substring(0, PREVIEW_CHARS) + "..." : content;
    }

    static double round4(double value) {
        return Math.round(value * 10_000d) / 10_000d;
    }
}
