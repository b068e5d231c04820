package uk.gegc.aiready.features.conversion.domain.model;

import uk.gegc.aiready.features.conversion.domain.SourceKind;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Workbook or CSV file as an ordered list of sheets. CSV files always have exactly one sheet.
 */
public record SpreadsheetContent(SourceKind kind, List<SheetData> sheets) implements StructuredContent {

    public SpreadsheetContent {
        sheets = List.copyOf(sheets);
    }

    @Override
    public Map<String, Object> metadata() {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("sheetCount", sheets.size());
        metadata.put("totalRows", sheets.stream().mapToInt(sheet -> sheet.table().rows().size()).sum());
        metadata.put("totalColumns", sheets.stream().mapToInt(sheet -> sheet.table().width()).max().orElse(0));
        return metadata;
    }
}
