package uk.gegc.aiready.features.conversion.domain.model;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * A named worksheet. The first non-empty row is the header row; empty rows are never stored.
 */
public record SheetData(String name, TableData table) {

    public boolean isEmpty() {
        return table.isEmpty();
    }

    /**
     * Record keys for the sheet's columns: the header text, {@code column_<n>} (1-based) for blank
     * headers and for cells beyond the header row, and a {@code _<k>} suffix for repeated headers.
     */
    public List<String> recordKeys() {
        List<String> headers = table.headers();
        int width = table.width();
        List<String> keys = new ArrayList<>(width);
        Set<String> used = new HashSet<>();
        for (int i = 0; i < width; i++) {
            String header = i < headers.size() ? headers.get(i) : null;
            String key = header == null || header.isBlank() ? "column_" + (i + 1) : header.trim();
            if (used.contains(key)) {
                int suffix = 2;
                while (used.contains(key + "_" + suffix)) {
                    suffix++;
                }
                key = key + "_" + suffix;
            }
            used.add(key);
            keys.add(key);
        }
        return keys;
    }
}
