package com.example.lawrag.application.ingest.step;

import com.example.lawrag.application.ingest.ArticleSegmenter;
import com.example.lawrag.application.pipeline.PipelineStep;
import com.example.lawrag.domain.model.PageContent;
import com.example.lawrag.domain.model.RawArticle;
import java.util.List;
import java.util.Map;

public class ArticleSplitterStep implements PipelineStep<List<PageContent>, List<RawArticle>> {

    private final ArticleSegmenter segmenter;

    public ArticleSplitterStep(ArticleSegmenter segmenter) {
        this.segmenter = segmenter;
    }

    @Override
    public String name() {
        return "article_splitter";
    }

    @Override
    public boolean validate(List<PageContent> input) {
        return input != null && !input.isEmpty();
    }

    @Override
    public List<RawArticle> process(List<PageContent> input, Map<String, Object> context) {
        List<RawArticle> articles = segmenter.segment(input);
        context.put(IngestionContextKeys.ARTICLES_FOUND, articles.size());
        return articles;
    }
}
