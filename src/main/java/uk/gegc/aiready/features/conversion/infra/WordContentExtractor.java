package uk.gegc.aiready.features.conversion.infra;

import lombok.extern.slf4j.Slf4j;
import org.apache.poi.hwpf.extractor.WordExtractor;
import org.apache.poi.poifs.filesystem.FileMagic;
import org.apache.poi.xwpf.usermodel.IBodyElement;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFStyle;
import org.apache.poi.xwpf.usermodel.XWPFTable;
import org.apache.poi.xwpf.usermodel.XWPFTableCell;
import org.apache.poi.xwpf.usermodel.XWPFTableRow;
import org.springframework.stereotype.Component;
import uk.gegc.aiready.features.conversion.domain.ContentExtractor;
import uk.gegc.aiready.features.conversion.domain.ExtractionException;
import uk.gegc.aiready.features.conversion.domain.SourceKind;
import uk.gegc.aiready.features.conversion.domain.model.ContentBlock;
import uk.gegc.aiready.features.conversion.domain.model.DocumentContent;
import uk.gegc.aiready.features.conversion.domain.model.StructuredContent;
import uk.gegc.aiready.features.conversion.domain.model.TableData;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Word extractor using Apache POI.
 * {@code .docx} keeps headings, paragraphs and tables in body order; legacy {@code .doc} yields paragraphs only.
 */
@Component
@Slf4j
public class WordContentExtractor implements ContentExtractor {

    private static final Pattern HEADING_STYLE = Pattern.compile("heading\\s*(\\d)");
    private static final List<String> SUPPORTED = List.of(
            ".docx",
            ".doc",
            "application/vnd.openxmlformats-officedocument.wordprocessingml.document",
            "application/msword"
    );

    @Override
    public boolean supports(String filenameOrMime) {
        if (filenameOrMime == null) return false;
        String lower = filenameOrMime.toLowerCase(Locale.ROOT);
        return SUPPORTED.stream().anyMatch(suffix -> suffix.startsWith(".") ? lower.endsWith(suffix) : lower.equals(suffix));
    }

    @Override
    public StructuredContent extract(byte[] bytes, String filename) throws ExtractionException {
        FileMagic magic = OfficeFiles.magicOf(bytes);
        if (magic == FileMagic.OLE2) {
            return extractLegacy(bytes, filename);
        }
        if (magic != FileMagic.OOXML) {
            throw new ExtractionException("Failed to read Word document: not a Word file");
        }
        return extractOoxml(bytes, filename);
    }

    private StructuredContent extractOoxml(byte[] bytes, String filename) throws ExtractionException {
        try (XWPFDocument document = new XWPFDocument(new ByteArrayInputStream(bytes))) {
            List<ContentBlock> blocks = new ArrayList<>();
            for (IBodyElement element : document.getBodyElements()) {
                if (element instanceof XWPFParagraph paragraph) {
                    String text = paragraph.getText().trim();
                    if (text.isEmpty()) {
                        continue;
                    }
                    int level = headingLevel(paragraph, document);
                    blocks.add(level > 0 ? ContentBlock.heading(level, text) : ContentBlock.paragraph(text));
                } else if (element instanceof XWPFTable table) {
                    TableData data = readTable(table);
                    if (!data.isEmpty()) {
                        blocks.add(ContentBlock.table(data));
                    }
                }
            }
            log.debug("Extracted Word document {}: {} blocks", filename, blocks.size());
            return new DocumentContent(SourceKind.WORD_DOCUMENT, blocks);
        } catch (IOException | RuntimeException e) {
            throw new ExtractionException("Failed to read Word document: " + e.getMessage(), e);
        }
    }

    private StructuredContent extractLegacy(byte[] bytes, String filename) throws ExtractionException {
        try (WordExtractor extractor = new WordExtractor(new ByteArrayInputStream(bytes))) {
            List<ContentBlock> blocks = new ArrayList<>();
            for (String paragraph : extractor.getParagraphText()) {
                String text = WordExtractor.stripFields(paragraph)
                        .replaceAll("[\\p{Cntrl}&&[^\\t]]", " ")
                        .trim();
                if (!text.isEmpty()) {
                    blocks.add(ContentBlock.paragraph(text));
                }
            }
            log.debug("Extracted legacy Word document {}: {} paragraphs", filename, blocks.size());
            return new DocumentContent(SourceKind.WORD_DOCUMENT, blocks);
        } catch (IOException | RuntimeException e) {
            throw new ExtractionException("Failed to read Word document: " + e.getMessage(), e);
        }
    }

    /**
     * Heading level from the paragraph style ("Heading2", "heading 2"); "Title" counts as level 1.
     * Returns 0 for body paragraphs.
     */
    private int headingLevel(XWPFParagraph paragraph, XWPFDocument document) {
        String styleId = paragraph.getStyleID();
        if (styleId == null) {
            return 0;
        }
        String styleName = styleId;
        if (document.getStyles() != null) {
            XWPFStyle style = document.getStyles().getStyle(styleId);
            if (style != null && style.getName() != null) {
                styleName = style.getName();
            }
        }
        for (String candidate : List.of(styleName, styleId)) {
            String lower = candidate.toLowerCase(Locale.ROOT);
            if (lower.equals("title")) {
                return 1;
            }
            Matcher matcher = HEADING_STYLE.matcher(lower);
            if (matcher.find()) {
                return Integer.parseInt(matcher.group(1));
            }
        }
        return 0;
    }

    private TableData readTable(XWPFTable table) {
        List<List<String>> rows = new ArrayList<>();
        for (XWPFTableRow row : table.getRows()) {
            List<String> cells = new ArrayList<>();
            for (XWPFTableCell cell : row.getTableCells()) {
                cells.add(cell.getText().replaceAll("\\s+", " ").trim());
            }
            if (cells.stream().anyMatch(cell -> !cell.isEmpty())) {
                rows.add(cells);
            }
        }
        return TableData.fromRows(rows);
    }
}
