package uk.gegc.aiready.features.conversion.domain;

import lombok.Getter;

/**
 * Concrete source format an extractor produced content from. The label is the human-readable
 * name shown in rendered output.
 */
@Getter
public enum SourceKind {
    PDF_DOCUMENT("PDF Document", InputCategory.DOCUMENT),
    WORD_DOCUMENT("Word Document", InputCategory.DOCUMENT),
    EXCEL_SPREADSHEET("Excel Spreadsheet", InputCategory.SPREADSHEET),
    CSV_SPREADSHEET("CSV File", InputCategory.SPREADSHEET),
    POWERPOINT_PRESENTATION("PowerPoint Presentation", InputCategory.PRESENTATION),
    IMAGE("Image", InputCategory.IMAGE);

    private final String label;
    private final InputCategory category;

    SourceKind(String label, InputCategory category) {
        this.label = label;
        this.category = category;
    }
}
