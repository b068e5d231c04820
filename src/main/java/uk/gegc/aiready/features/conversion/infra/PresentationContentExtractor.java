package uk.gegc.aiready.features.conversion.infra;

import lombok.extern.slf4j.Slf4j;
import org.apache.poi.hslf.usermodel.HSLFGroupShape;
import org.apache.poi.hslf.usermodel.HSLFNotes;
import org.apache.poi.hslf.usermodel.HSLFShape;
import org.apache.poi.hslf.usermodel.HSLFSlide;
import org.apache.poi.hslf.usermodel.HSLFSlideShow;
import org.apache.poi.hslf.usermodel.HSLFTable;
import org.apache.poi.hslf.usermodel.HSLFTableCell;
import org.apache.poi.hslf.usermodel.HSLFTextParagraph;
import org.apache.poi.hslf.usermodel.HSLFTextShape;
import org.apache.poi.poifs.filesystem.FileMagic;
import org.apache.poi.sl.usermodel.Placeholder;
import org.apache.poi.xslf.usermodel.XMLSlideShow;
import org.apache.poi.xslf.usermodel.XSLFGroupShape;
import org.apache.poi.xslf.usermodel.XSLFNotes;
import org.apache.poi.xslf.usermodel.XSLFShape;
import org.apache.poi.xslf.usermodel.XSLFSlide;
import org.apache.poi.xslf.usermodel.XSLFTable;
import org.apache.poi.xslf.usermodel.XSLFTableCell;
import org.apache.poi.xslf.usermodel.XSLFTableRow;
import org.apache.poi.xslf.usermodel.XSLFTextParagraph;
import org.apache.poi.xslf.usermodel.XSLFTextShape;
import org.springframework.stereotype.Component;
import uk.gegc.aiready.features.conversion.domain.ContentExtractor;
import uk.gegc.aiready.features.conversion.domain.ExtractionException;
import uk.gegc.aiready.features.conversion.domain.SourceKind;
import uk.gegc.aiready.features.conversion.domain.model.PresentationContent;
import uk.gegc.aiready.features.conversion.domain.model.SlideData;
import uk.gegc.aiready.features.conversion.domain.model.StructuredContent;
import uk.gegc.aiready.features.conversion.domain.model.TableData;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * PowerPoint extractor using Apache POI ({@code .pptx} via XSLF, {@code .ppt} via HSLF).
 * Each slide yields its title, body text lines (title placeholders excluded), tables and speaker notes.
 */
@Component
@Slf4j
public class PresentationContentExtractor implements ContentExtractor {

    private static final List<String> SUPPORTED = List.of(
            ".pptx",
            ".ppt",
            "application/vnd.openxmlformats-officedocument.presentationml.presentation",
            "application/vnd.ms-powerpoint"
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
        try {
            List<SlideData> slides;
            if (magic == FileMagic.OOXML) {
                slides = readOoxml(bytes);
            } else if (magic == FileMagic.OLE2) {
                slides = readLegacy(bytes);
            } else {
                throw new ExtractionException("Failed to read presentation: not a PowerPoint file");
            }
            log.debug("Extracted presentation {}: {} slides", filename, slides.size());
            return new PresentationContent(SourceKind.POWERPOINT_PRESENTATION, slides);
        } catch (IOException | RuntimeException e) {
            throw new ExtractionException("Failed to read presentation: " + e.getMessage(), e);
        }
    }

    private List<SlideData> readOoxml(byte[] bytes) throws IOException {
        try (XMLSlideShow show = new XMLSlideShow(new ByteArrayInputStream(bytes))) {
            List<SlideData> slides = new ArrayList<>();
            int number = 0;
            for (XSLFSlide slide : show.getSlides()) {
                number++;
                List<String> content = new ArrayList<>();
                List<TableData> tables = new ArrayList<>();
                collectOoxmlShapes(slide.getShapes(), content, tables);
                slides.add(new SlideData(number, clean(slide.getTitle()), content, tables, ooxmlNotes(slide.getNotes())));
            }
            return slides;
        }
    }

    private void collectOoxmlShapes(List<XSLFShape> shapes, List<String> content, List<TableData> tables) {
        for (XSLFShape shape : shapes) {
            if (shape instanceof XSLFGroupShape group) {
                collectOoxmlShapes(group.getShapes(), content, tables);
            } else if (shape instanceof XSLFTable table) {
                List<List<String>> rows = new ArrayList<>();
                for (XSLFTableRow row : table.getRows()) {
                    List<String> cells = new ArrayList<>();
                    for (XSLFTableCell cell : row.getCells()) {
                        cells.add(singleLine(cell.getText()));
                    }
                    rows.add(cells);
                }
                TableData data = TableData.fromRows(rows);
                if (!data.isEmpty()) {
                    tables.add(data);
                }
            } else if (shape instanceof XSLFTextShape text && !isTitle(text.getPlaceholder())) {
                for (XSLFTextParagraph paragraph : text.getTextParagraphs()) {
                    String line = clean(paragraph.getText());
                    if (line != null) {
                        content.add(line);
                    }
                }
            }
        }
    }

    private String ooxmlNotes(XSLFNotes notes) {
        if (notes == null) {
            return null;
        }
        List<String> parts = new ArrayList<>();
        for (XSLFShape shape : notes.getShapes()) {
            if (shape instanceof XSLFTextShape text && text.getPlaceholder() == Placeholder.BODY) {
                String value = clean(text.getText());
                if (value != null) {
                    parts.add(value);
                }
            }
        }
        return parts.isEmpty() ? null : String.join("\n", parts);
    }

    private List<SlideData> readLegacy(byte[] bytes) throws IOException {
        try (HSLFSlideShow show = new HSLFSlideShow(new ByteArrayInputStream(bytes))) {
            List<SlideData> slides = new ArrayList<>();
            int number = 0;
            for (HSLFSlide slide : show.getSlides()) {
                number++;
                String title = clean(slide.getTitle());
                List<String> content = new ArrayList<>();
                List<TableData> tables = new ArrayList<>();
                collectLegacyShapes(slide.getShapes(), title, content, tables);
                slides.add(new SlideData(number, title, content, tables, legacyNotes(slide.getNotes())));
            }
            return slides;
        }
    }

    private void collectLegacyShapes(List<HSLFShape> shapes, String title, List<String> content, List<TableData> tables) {
        for (HSLFShape shape : shapes) {
            if (shape instanceof HSLFTable table) {
                List<List<String>> rows = new ArrayList<>();
                for (int r = 0; r < table.getNumberOfRows(); r++) {
                    List<String> cells = new ArrayList<>();
                    for (int c = 0; c < table.getNumberOfColumns(); c++) {
                        HSLFTableCell cell = table.getCell(r, c);
                        cells.add(cell == null ? "" : singleLine(cell.getText()));
                    }
                    rows.add(cells);
                }
                TableData data = TableData.fromRows(rows);
                if (!data.isEmpty()) {
                    tables.add(data);
                }
            } else if (shape instanceof HSLFGroupShape group) {
                collectLegacyShapes(group.getShapes(), title, content, tables);
            } else if (shape instanceof HSLFTextShape text && !isTitle(text.getPlaceholder())) {
                for (String line : text.getText().split("[\\r\\n\\u000B]+")) {
                    String value = clean(line);
                    if (value != null && !value.equals(title)) {
                        content.add(value);
                    }
                }
            }
        }
    }

    private String legacyNotes(HSLFNotes notes) {
        if (notes == null) {
            return null;
        }
        List<String> parts = new ArrayList<>();
        for (List<HSLFTextParagraph> paragraphs : notes.getTextParagraphs()) {
            String value = clean(HSLFTextParagraph.getText(paragraphs));
            if (value != null) {
                parts.add(value);
            }
        }
        return parts.isEmpty() ? null : String.join("\n", parts);
    }

    private static boolean isTitle(Placeholder placeholder) {
        return placeholder == Placeholder.TITLE || placeholder == Placeholder.CENTERED_TITLE;
    }

    private static String singleLine(String text) {
        return text == null ? "" : text.replaceAll("\\s+", " ").trim();
    }

    private static String clean(String text) {
        if (text == null) {
            return null;
        }
        String trimmed = text.replace("\r", "\n").replace("\u000B", "\n").trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
