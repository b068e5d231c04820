package uk.gegc.aiready.features.conversion.domain.model;

import uk.gegc.aiready.features.conversion.domain.SourceKind;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record PresentationContent(SourceKind kind, List<SlideData> slides) implements StructuredContent {

    public PresentationContent {
        slides = List.copyOf(slides);
    }

    @Override
    public Map<String, Object> metadata() {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("slideCount", slides.size());
        int words = 0;
        for (SlideData slide : slides) {
            words += StructuredContent.countWords(slide.title());
            for (String line : slide.content()) {
                words += StructuredContent.countWords(line);
            }
            for (TableData table : slide.tables()) {
                words += StructuredContent.countWords(table.allText());
            }
        }
        metadata.put("wordCount", words);
        return metadata;
    }
}
