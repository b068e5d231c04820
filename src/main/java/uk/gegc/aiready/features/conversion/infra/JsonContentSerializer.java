package uk.gegc.aiready.features.conversion.infra;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.core.util.Separators;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
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
import java.util.List;

/**
 * Renders structured content as pretty-printed JSON with keys in insertion order.
 * Spreadsheets become one array of row objects keyed by header; every other type is an object with
 * {@code source}, a type-specific body and {@code metadata}.
 */
@Component
public class JsonContentSerializer implements ContentSerializer {

    static final String SHEET_KEY = "sheet";

    private final ObjectMapper objectMapper;
    private final ObjectWriter writer;

    public JsonContentSerializer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        DefaultIndenter indenter = new DefaultIndenter("  ", "\n");
        DefaultPrettyPrinter printer = new DefaultPrettyPrinter()
                .withSeparators(Separators.createDefaultInstance()
                        .withObjectFieldValueSpacing(Separators.Spacing.AFTER))
                .withObjectIndenter(indenter)
                .withArrayIndenter(indenter);
        this.writer = objectMapper.writer(printer);
    }

    @Override
    public OutputFormat format() {
        return OutputFormat.JSON;
    }

    @Override
    public String serialize(String filename, StructuredContent content) {
        JsonNode root;
        if (content instanceof SpreadsheetContent spreadsheet) {
            root = spreadsheet(spreadsheet);
        } else if (content instanceof DocumentContent document) {
            ObjectNode node = source(filename, content);
            ArrayNode blocks = node.putArray("blocks");
            document.blocks().forEach(block -> blocks.add(block(block)));
            root = withMetadata(node, content);
        } else if (content instanceof PresentationContent presentation) {
            ObjectNode node = source(filename, content);
            ArrayNode slides = node.putArray("slides");
            presentation.slides().forEach(slide -> slides.add(slide(slide)));
            root = withMetadata(node, content);
        } else if (content instanceof ImageContent image) {
            ObjectNode node = source(filename, content);
            node.put("ocrText", image.ocrText());
            ObjectNode imageNode = node.putObject("image");
            imageNode.put("mimeType", image.mimeType());
            imageNode.put("width", image.width());
            imageNode.put("height", image.height());
            imageNode.put("base64", image.base64Data());
            imageNode.put("dataUri", image.dataUri());
            root = withMetadata(node, content);
        } else {
            throw new UnsupportedFormatException("Cannot render " + content.kind().getLabel() + " as JSON");
        }

        try {
            return writer.writeValueAsString(root) + "\n";
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + filename + " to JSON", e);
        }
    }

    /**
     * Always a top-level array. Sheets without data rows are skipped; when rows come from more than one
     * sheet every record starts with a {@value #SHEET_KEY} key naming its sheet.
     */
    private ArrayNode spreadsheet(SpreadsheetContent spreadsheet) {
        List<SheetData> sheets = spreadsheet.sheets().stream()
                .filter(sheet -> !sheet.table().rows().isEmpty())
                .toList();
        boolean tagSheet = sheets.size() > 1;
        ArrayNode records = objectMapper.createArrayNode();
        for (SheetData sheet : sheets) {
            List<String> keys = tagSheet ? withoutSheetKey(sheet.recordKeys()) : sheet.recordKeys();
            for (List<String> row : sheet.table().rows()) {
                ObjectNode record = records.addObject();
                if (tagSheet) {
                    record.put(SHEET_KEY, sheet.name());
                }
                for (int i = 0; i < keys.size(); i++) {
                    record.put(keys.get(i), i < row.size() && row.get(i) != null ? row.get(i) : "");
                }
            }
        }
        return records;
    }

    // A column literally named "sheet" moves to the next free "sheet_<k>"
    private static List<String> withoutSheetKey(List<String> keys) {
        if (!keys.contains(SHEET_KEY)) {
            return keys;
        }
        List<String> renamed = new ArrayList<>(keys);
        int suffix = 2;
        while (keys.contains(SHEET_KEY + "_" + suffix)) {
            suffix++;
        }
        renamed.set(keys.indexOf(SHEET_KEY), SHEET_KEY + "_" + suffix);
        return renamed;
    }

    private ObjectNode block(ContentBlock block) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("type", block.type().getValue());
        switch (block.type()) {
            case PAGE -> node.put("number", block.number());
            case HEADING -> {
                node.put("level", block.number());
                node.put("text", block.text());
            }
            case PARAGRAPH -> node.put("text", block.text());
            case TABLE -> table(node, block.table());
        }
        return node;
    }

    private ObjectNode slide(SlideData slide) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("number", slide.number());
        node.put("title", slide.title());
        ArrayNode content = node.putArray("content");
        slide.content().forEach(content::add);
        ArrayNode tables = node.putArray("tables");
        slide.tables().forEach(table -> table(tables.addObject(), table));
        node.put("notes", slide.notes());
        return node;
    }

    private void table(ObjectNode node, TableData table) {
        ArrayNode headers = node.putArray("headers");
        table.headers().forEach(headers::add);
        ArrayNode rows = node.putArray("rows");
        for (List<String> row : table.rows()) {
            ArrayNode rowNode = rows.addArray();
            row.forEach(rowNode::add);
        }
    }

    private ObjectNode source(String filename, StructuredContent content) {
        ObjectNode node = objectMapper.createObjectNode();
        ObjectNode source = node.putObject("source");
        source.put("filename", filename);
        source.put("type", content.kind().getLabel());
        source.put("category", content.category().getValue());
        return node;
    }

    private ObjectNode withMetadata(ObjectNode node, StructuredContent content) {
        node.set("metadata", objectMapper.valueToTree(content.metadata()));
        return node;
    }
}
