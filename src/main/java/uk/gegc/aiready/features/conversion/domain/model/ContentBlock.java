package uk.gegc.aiready.features.conversion.domain.model;

/**
 * One element of a document body, in reading order.
 * {@code number} is the page number for {@link BlockType#PAGE} and the level (1-6) for
 * {@link BlockType#HEADING}; it is 0 otherwise.
 */
public record ContentBlock(BlockType type, int number, String text, TableData table) {

    public enum BlockType {
        PAGE("page"),
        HEADING("heading"),
        PARAGRAPH("paragraph"),
        TABLE("table");

        private final String value;

        BlockType(String value) {
            this.value = value;
        }

        public String getValue() {
            return value;
        }
    }

    public static ContentBlock page(int pageNumber) {
        return new ContentBlock(BlockType.PAGE, pageNumber, null, null);
    }

    public static ContentBlock heading(int level, String text) {
        return new ContentBlock(BlockType.HEADING, Math.max(1, Math.min(6, level)), text, null);
    }

    public static ContentBlock paragraph(String text) {
        return new ContentBlock(BlockType.PARAGRAPH, 0, text, null);
    }

    public static ContentBlock table(TableData table) {
        return new ContentBlock(BlockType.TABLE, 0, null, table);
    }
}
