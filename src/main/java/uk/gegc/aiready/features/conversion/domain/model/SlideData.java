package uk.gegc.aiready.features.conversion.domain.model;

import java.util.List;

/**
 * One slide: 1-based number, optional title, body text lines, tables and speaker notes.
 */
public record SlideData(int number, String title, List<String> content, List<TableData> tables, String notes) {

    public SlideData {
        content = List.copyOf(content);
        tables = List.copyOf(tables);
    }

    public boolean hasTitle() {
        return title != null && !title.isBlank();
    }

    public boolean hasNotes() {
        return notes != null && !notes.isBlank();
    }
}
