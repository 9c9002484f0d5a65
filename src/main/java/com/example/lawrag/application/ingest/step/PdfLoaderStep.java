package com.example.lawrag.application.ingest.step;

import com.example.lawrag.application.pipeline.PipelineStep;
import com.example.lawrag.infrastructure.ingest.PdfExtractor;
import java.util.Map;
import org.apache.pdfbox.pdmodel.PDDocument;

public class PdfLoaderStep implements PipelineStep<byte[], PDDocument> {

    static final int MIN_PDF_BYTES = 100;

    private final PdfExtractor pdfExtractor;

    public PdfLoaderStep(PdfExtractor pdfExtractor) {
        this.pdfExtractor = pdfExtractor;
    }

    @Override
    public String name() {
        return "pdf_loader";
    }

    @Override
    public boolean validate(byte[] input) {
        return input != null && input.length >= MIN_PDF_BYTES;
    }

    @Override
    public PDDocument process(byte[] input, Map<String, Object> context) throws Exception {
        PDDocument document = pdfExtractor.load(input);
        context.put(IngestionContextKeys.PAGE_COUNT, document.getNumberOfPages());
        putIfPresent(context, IngestionContextKeys.PDF_TITLE, pdfExtractor.title(document));
        putIfPresent(context, IngestionContextKeys.PDF_AUTHOR, pdfExtractor.author(document));
        return document;
    }

    private static void putIfPresent(Map<String, Object> context, String key, String value) {
        if (value != null && !value.isBlank()) {
            context.put(key, value);
        }
    }
}
