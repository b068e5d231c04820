package uk.gegc.aiready.features.conversion.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.aiready.features.conversion.domain.ContentExtractor;
import uk.gegc.aiready.features.conversion.domain.ContentSerializer;
import uk.gegc.aiready.features.conversion.domain.ConversionSource;
import uk.gegc.aiready.features.conversion.domain.ExtractionException;
import uk.gegc.aiready.features.conversion.domain.OutputFilenames;
import uk.gegc.aiready.features.conversion.domain.OutputFormat;
import uk.gegc.aiready.features.conversion.domain.RenderedOutput;
import uk.gegc.aiready.features.conversion.domain.UnsupportedFormatException;
import uk.gegc.aiready.features.conversion.domain.model.StructuredContent;

import java.util.List;

/**
 * Converts a file to rendered text using the appropriate extractor and serializer.
 * Uses strategy pattern to delegate to the registered {@link ContentExtractor} and
 * {@link ContentSerializer} beans.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ConversionDispatcher {

    private final List<ContentExtractor> extractors;
    private final List<ContentSerializer> serializers;

    /**
     * Converts the source bytes to the requested format.
     *
     * @param source the file to convert
     * @return rendered text plus the base output filename
     * @throws UnsupportedFormatException if no extractor or serializer matches, before anything is invoked
     * @throws ExtractionException        if the bytes cannot be read
     */
    public RenderedOutput convert(ConversionSource source) throws ExtractionException {
        ContentExtractor extractor = findExtractor(source.filename());
        if (extractor == null && source.mimeType() != null) {
            extractor = findExtractor(source.mimeType());
        }
        if (extractor == null) {
            throw new UnsupportedFormatException("No suitable extractor found for: " + source.filename());
        }
        ContentSerializer serializer = findSerializer(source.format());

        log.debug("Converting {} ({} bytes) to {} using {}", source.filename(), source.bytes().length,
                source.format().getValue(), extractor.getClass().getSimpleName());

        StructuredContent content = extractor.extract(source.bytes(), source.filename());
        String text = serializer.serialize(source.filename(), content);
        return new RenderedOutput(OutputFilenames.forSource(source.filename(), source.format()), source.format(), text);
    }

    private ContentExtractor findExtractor(String filenameOrMime) {
        return extractors.stream()
                .filter(extractor -> extractor.supports(filenameOrMime))
                .findFirst()
                .orElse(null);
    }

    private ContentSerializer findSerializer(OutputFormat format) {
        return serializers.stream()
                .filter(serializer -> serializer.format() == format)
                .findFirst()
                .orElseThrow(() -> new UnsupportedFormatException("No serializer registered for format: " + format));
    }
}
