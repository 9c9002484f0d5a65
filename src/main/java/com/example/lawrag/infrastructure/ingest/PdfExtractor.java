package com.example.lawrag.infrastructure.ingest;

import com.example.lawrag.domain.model.PageContent;
import com.example.lawrag.util.ArabicNormalizer;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDDocumentInformation;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.stereotype.Component;

@Component
public class PdfExtractor {

    public PDDocument load(byte[] pdfBytes) throws IOException {
        return PDDocument.load(pdfBytes);
    }

    public String title(PDDocument document) {
        PDDocumentInformation info = document.getDocumentInformation();
        return info == null ? null : info.getTitle();
    }

    public String author(PDDocument document) {
        PDDocumentInformation info = document.getDocumentInformation();
        return info == null ? null : info.getAuthor();
    }

    /**
     * Extracts the document one page at a time. Lines are trimmed and normalized, blank lines are
     * dropped and pages without text are skipped.
     */
    public List<PageContent> extractPages(PDDocument document) throws IOException {
        PDFTextStripper stripper = new PDFTextStripper();
        stripper.setLineSeparator("\n");
        stripper.setSortByPosition(true);

        int pageCount = document.getNumberOfPages();
        List<PageContent> pages = new ArrayList<>(pageCount);
        for (int page = 1; page <= pageCount; page++) {
            stripper.setStartPage(page);
            stripper.setEndPage(page);
            String text = clean(stripper.getText(document));
            if (!text.isEmpty()) {
                pages.add(new PageContent(page, text));
            }
        }
        return pages;
    }

    static String clean(String raw) {
        if (raw == null) {
            return "";
        }
        StringBuilder sb = new StringBuilder(raw.length());
        for (String line : raw.replace("\u0000", "").split("\\r?\\n")) {
            String cleaned = ArabicNormalizer.normalizeExtractedLine(line);
            if (cleaned.isEmpty()) {
                continue;
            }
            if (sb.length() > 0) {
                sb.append('\n');
            }
            sb.append(cleaned);
        }
        return sb.toString();
    }
}
