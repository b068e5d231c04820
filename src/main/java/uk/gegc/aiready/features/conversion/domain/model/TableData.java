package uk.gegc.aiready.features.conversion.domain.model;

import java.util.ArrayList;
import java.util.List;

/**
 * A rectangular-ish table: a header row plus data rows. Rows may be shorter than the header.
 */
public record TableData(List<String> headers, List<List<String>> rows) {

    public TableData {
        headers = List.copyOf(headers);
        rows = rows.stream().map(List::copyOf).toList();
    }

    /**
     * Treats the first row as the header row.
     */
    public static TableData fromRows(List<List<String>> rawRows) {
        if (rawRows.isEmpty()) {
            return new TableData(List.of(), List.of());
        }
        return new TableData(rawRows.get(0), new ArrayList<>(rawRows.subList(1, rawRows.size())));
    }

    public boolean isEmpty() {
        return headers.isEmpty() && rows.isEmpty();
    }

    public int width() {
        int width = headers.size();
        for (List<String> row : rows) {
            width = Math.max(width, row.size());
        }
        return width;
    }

    String allText() {
        StringBuilder text = new StringBuilder(String.join(" ", headers));
        rows.forEach(row -> text.append(' ').append(String.join(" ", row)));
        return text.toString();
    }
}
