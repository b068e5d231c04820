package uk.gegc.aiready.features.conversion.domain.model;

import uk.gegc.aiready.features.conversion.domain.SourceKind;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Raster image: decoded dimensions, OCR text and the original bytes as base64 under their MIME type.
 */
public record ImageContent(
        String format,
        String mimeType,
        int width,
        int height,
        String ocrText,
        String base64Data
) implements StructuredContent {

    @Override
    public SourceKind kind() {
        return SourceKind.IMAGE;
    }

    public String dataUri() {
        return "data:" + mimeType + ";base64," + base64Data;
    }

    @Override
    public Map<String, Object> metadata() {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("format", format);
        metadata.put("ocrWordCount", StructuredContent.countWords(ocrText));
        metadata.put("base64Length", base64Data.length());
        return metadata;
    }
}
