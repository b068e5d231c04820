package uk.gegc.aiready.features.conversion.domain.model;

import uk.gegc.aiready.features.conversion.domain.SourceKind;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Text document (PDF or Word) as an ordered list of blocks. PDF content is split into pages by
 * {@link ContentBlock.BlockType#PAGE} markers.
 */
public record DocumentContent(SourceKind kind, List<ContentBlock> blocks) implements StructuredContent {

    public DocumentContent {
        blocks = List.copyOf(blocks);
    }

    public long count(ContentBlock.BlockType type) {
        return blocks.stream().filter(block -> block.type() == type).count();
    }

    @Override
    public Map<String, Object> metadata() {
        Map<String, Object> metadata = new LinkedHashMap<>();
        if (kind == SourceKind.PDF_DOCUMENT) {
            metadata.put("pageCount", count(ContentBlock.BlockType.PAGE));
        }
        metadata.put("headingCount", count(ContentBlock.BlockType.HEADING));
        metadata.put("paragraphCount", count(ContentBlock.BlockType.PARAGRAPH));
        metadata.put("tableCount", count(ContentBlock.BlockType.TABLE));
        int words = 0;
        for (ContentBlock block : blocks) {
            if (block.text() != null) {
                words += StructuredContent.countWords(block.text());
            } else if (block.table() != null) {
                words += StructuredContent.countWords(block.table().allText());
            }
        }
        metadata.put("wordCount", words);
        return metadata;
    }
}
