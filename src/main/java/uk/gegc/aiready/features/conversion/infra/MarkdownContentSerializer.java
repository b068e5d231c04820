package uk.gegc.aiready.features.conversion.infra;

import org.springframework.stereotype.Component;
import uk.gegc.aiready.features.conversion.domain.ContentSerializer;
import uk.gegc.aiready.features.conversion.domain.OutputFormat;
import uk.gegc.aiready.features.conversion.domain.UnsupportedFormatException;
import uk.gegc.aiready.features.conversion.domain.model.ContentBlock;
import uk.gegc.aiready.features.conversion.domain.model.DocumentContent;
import uk.gegc.aiready.features.conversion.domain.model.ImageContent;
import uk.gegc.aiready.features.conversion.domain.model.PresentationContent;
import uk.gegc.aiready.features.conversion.domain.model.SheetData;
import uk.gegc.aiready.features.conversion.domain.model.SlideData;
import uk.gegc.aiready.features.conversion.domain.model.SpreadsheetContent;
import uk.gegc.aiready.features.conversion.domain.model.StructuredContent;
import uk.gegc.aiready.features.conversion.domain.model.TableData;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Renders structured content as Markdown. Output starts with a {@code # <filename>} title, a
 * {@code > Converted from ...} line and a horizontal rule; blocks are separated by blank lines.
 */
@Component
public class MarkdownContentSerializer implements ContentSerializer {

    private static final String RULE = "---";
    private static final int MAX_HEADING_LEVEL = 6;

    @Override
    public OutputFormat format() {
        return OutputFormat.MARKDOWN;
    }

    @Override
    public String serialize(String filename, StructuredContent content) {
        List<String> parts = new ArrayList<>();
        parts.add("# " + filename);
        parts.add("> Converted from " + content.kind().getLabel());
        parts.add(RULE);

        if (content instanceof DocumentContent document) {
            renderDocument(document, parts);
        } else if (content instanceof SpreadsheetContent spreadsheet) {
            renderSpreadsheet(spreadsheet, parts);
        } else if (content instanceof PresentationContent presentation) {
            renderPresentation(presentation, parts);
        } else if (content instanceof ImageContent image) {
            renderImage(filename, image, parts);
        } else {
            throw new UnsupportedFormatException("Cannot render " + content.kind().getLabel() + " as Markdown");
        }
        return String.join("\n\n", parts) + "\n";
    }

    private void renderDocument(DocumentContent document, List<String> parts) {
        boolean firstPage = true;
        for (ContentBlock block : document.blocks()) {
            switch (block.type()) {
                case PAGE -> {
                    if (!firstPage) {
                        parts.add(RULE);
                    }
                    firstPage = false;
                    parts.add("## Page " + block.number());
                }
                case HEADING -> parts.add("#".repeat(Math.min(block.number(), MAX_HEADING_LEVEL)) + " " + block.text());
                case PARAGRAPH -> parts.add(block.text());
                case TABLE -> parts.add(table(block.table()));
            }
        }
    }

    private void renderSpreadsheet(SpreadsheetContent spreadsheet, List<String> parts) {
        boolean first = true;
        for (SheetData sheet : spreadsheet.sheets()) {
            if (!first) {
                parts.add(RULE);
            }
            first = false;
            parts.add("## " + sheet.name());
            parts.add(sheet.isEmpty() ? "*Empty sheet*" : table(sheet.table()));
        }
    }

    private void renderPresentation(PresentationContent presentation, List<String> parts) {
        boolean first = true;
        for (SlideData slide : presentation.slides()) {
            if (!first) {
                parts.add(RULE);
            }
            first = false;
            parts.add("## Slide " + slide.number());
            if (slide.hasTitle()) {
                parts.add("### " + slide.title());
            }
            if (!slide.content().isEmpty()) {
                List<String> bullets = new ArrayList<>();
                for (String line : slide.content()) {
                    bullets.add("- " + line.replace("\n", " "));
                }
                parts.add(String.join("\n", bullets));
            }
            for (TableData table : slide.tables()) {
                parts.add(table(table));
            }
            if (slide.hasNotes()) {
                parts.add("**Speaker Notes:** " + slide.notes());
            }
        }
    }

    private void renderImage(String filename, ImageContent image, List<String> parts) {
        parts.add("## Image Information");
        parts.add(String.join("\n",
                "- **Format:** " + image.format(),
                "- **Dimensions:** " + image.width() + " x " + image.height() + " pixels",
                "- **MIME Type:** `" + image.mimeType() + "`"));
        parts.add("## Extracted Text (OCR)");
        parts.add(image.ocrText().isBlank()
                ? "*No text detected*"
                : "```\n" + image.ocrText() + "\n```");
        parts.add("## Image");
        parts.add("![" + filename + "](" + image.dataUri() + ")");
    }

    /**
     * Pipe table with a {@code ---} separator row. Rows are padded to the widest row.
     */
    private String table(TableData table) {
        int width = table.width();
        List<String> lines = new ArrayList<>();
        lines.add(row(table.headers(), width));
        lines.add(row(Collections.nCopies(width, RULE), width));
        for (List<String> row : table.rows()) {
            lines.add(row(row, width));
        }
        return String.join("\n", lines);
    }

    private String row(List<String> cells, int width) {
        StringBuilder line = new StringBuilder("|");
        for (int i = 0; i < width; i++) {
            String cell = i < cells.size() && cells.get(i) != null ? cells.get(i) : "";
            line.append(' ').append(cell.replace("|", "\\|").replace("\n", " ")).append(" |");
        }
        return line.toString();
    }
}
