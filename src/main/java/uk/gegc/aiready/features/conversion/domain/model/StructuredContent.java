package uk.gegc.aiready.features.conversion.domain.model;

import uk.gegc.aiready.features.conversion.domain.InputCategory;
import uk.gegc.aiready.features.conversion.domain.SourceKind;

import java.util.Map;

/**
 * Format-neutral content produced by an extractor and consumed by serializers.
 */
public interface StructuredContent {

    SourceKind kind();

    default InputCategory category() {
        return kind().getCategory();
    }

    /**
     * Summary figures about the content, in a stable key order.
     */
    Map<String, Object> metadata();

    static int countWords(String text) {
        if (text == null || text.isBlank()) {
            return 0;
        }
        return text.trim().split("\\s+").length;
    }
}
