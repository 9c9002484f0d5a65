package com.example.lawrag.application.ingest.step;

import com.example.lawrag.application.pipeline.PipelineStep;
import com.example.lawrag.domain.model.PageContent;
import com.example.lawrag.infrastructure.ingest.PdfExtractor;
import java.util.List;
import java.util.Map;
import org.apache.pdfbox.pdmodel.PDDocument;

/**
 * Extracts page texts and releases the document, whether or not extraction succeeds.
 */
public class TextExtractorStep implements PipelineStep<PDDocument, List<PageContent>> {

    private final PdfExtractor pdfExtractor;

    public TextExtractorStep(PdfExtractor pdfExtractor) {
        this.pdfExtractor = pdfExtractor;
    }

    @Override
    public String name() {
        return "text_extractor";
    }

    @Override
    public List<PageContent> process(PDDocument input, Map<String, Object> context) throws Exception {
        try (PDDocument document = input) {
            List<PageContent> pages = pdfExtractor.extractPages(document);
            context.put(IngestionContextKeys.PAGES_WITH_TEXT, pages.size());
            context.put(IngestionContextKeys.TOTAL_CHARS, pages.stream().mapToInt(p -> p.text().length()).sum());
            return pages;
        }
    }
}
