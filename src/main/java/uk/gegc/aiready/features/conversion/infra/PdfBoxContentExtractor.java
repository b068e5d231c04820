package uk.gegc.aiready.features.conversion.infra;

import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.stereotype.Component;
import uk.gegc.aiready.features.conversion.domain.ContentExtractor;
import uk.gegc.aiready.features.conversion.domain.ExtractionException;
import uk.gegc.aiready.features.conversion.domain.SourceKind;
import uk.gegc.aiready.features.conversion.domain.model.ContentBlock;
import uk.gegc.aiready.features.conversion.domain.model.DocumentContent;
import uk.gegc.aiready.features.conversion.domain.model.StructuredContent;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * PDF extractor using Apache PDFBox.
 * Extracts text page by page, splitting each page into paragraphs with PDFBox paragraph detection.
 */
@Component
@Slf4j
public class PdfBoxContentExtractor implements ContentExtractor {

    private static final String PARAGRAPH_END = "\n\n";

    @Override
    public boolean supports(String filenameOrMime) {
        if (filenameOrMime == null) return false;
        String lower = filenameOrMime.toLowerCase();
        return lower.endsWith(".pdf") || lower.equals("application/pdf");
    }

    @Override
    public StructuredContent extract(byte[] bytes, String filename) throws ExtractionException {
        try (PDDocument document = PDDocument.load(new ByteArrayInputStream(bytes))) {
            PDFTextStripper stripper = new PDFTextStripper();
            stripper.setSortByPosition(true);
            stripper.setLineSeparator("\n");
            stripper.setParagraphEnd(PARAGRAPH_END);

            List<ContentBlock> blocks = new ArrayList<>();
            int pageCount = document.getNumberOfPages();
            for (int page = 1; page <= pageCount; page++) {
                stripper.setStartPage(page);
                stripper.setEndPage(page);
                blocks.add(ContentBlock.page(page));
                for (String paragraph : splitParagraphs(stripper.getText(document))) {
                    blocks.add(ContentBlock.paragraph(paragraph));
                }
            }

            log.debug("Extracted PDF document {}: {} pages, {} blocks", filename, pageCount, blocks.size());
            return new DocumentContent(SourceKind.PDF_DOCUMENT, blocks);
        } catch (IOException | RuntimeException e) {
            throw new ExtractionException("Failed to read PDF document: " + e.getMessage(), e);
        }
    }

    /**
     * Splits page text on blank lines; lines inside a paragraph are joined with single spaces.
     */
    static List<String> splitParagraphs(String pageText) {
        List<String> paragraphs = new ArrayList<>();
        for (String chunk : pageText.replace("\r", "").split("\n\\s*\n")) {
            String paragraph = String.join(" ", chunk.trim().split("\\s*\n\\s*")).trim();
            if (!paragraph.isEmpty()) {
                paragraphs.add(paragraph);
            }
        }
        return paragraphs;
    }
}
