package uk.gegc.aiready.features.conversion.application;

import lombok.extern.slf4j.Slf4j;
import org.apache.tika.Tika;
import org.springframework.stereotype.Component;
import uk.gegc.aiready.features.conversion.domain.InputCategory;
import uk.gegc.aiready.features.conversion.domain.OutputFilenames;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * MIME type detector based on file extensions, with Apache Tika content sniffing for files
 * whose name carries no usable extension.
 */
@Component
@Slf4j
public class MimeTypeDetector {

    private static final Map<String, DetectedType> EXTENSION_TO_TYPE = new LinkedHashMap<>();

    static {
        register(".pdf", "application/pdf", InputCategory.DOCUMENT);
        register(".docx", "application/vnd.openxmlformats-officedocument.wordprocessingml.document", InputCategory.DOCUMENT);
        register(".doc", "application/msword", InputCategory.DOCUMENT);
        register(".xlsx", "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet", InputCategory.SPREADSHEET);
        register(".xls", "application/vnd.ms-excel", InputCategory.SPREADSHEET);
        register(".csv", "text/csv", InputCategory.SPREADSHEET);
        register(".pptx", "application/vnd.openxmlformats-officedocument.presentationml.presentation", InputCategory.PRESENTATION);
        register(".ppt", "application/vnd.ms-powerpoint", InputCategory.PRESENTATION);
        register(".png", "image/png", InputCategory.IMAGE);
        register(".jpg", "image/jpeg", InputCategory.IMAGE);
        register(".jpeg", "image/jpeg", InputCategory.IMAGE);
        register(".gif", "image/gif", InputCategory.IMAGE);
        register(".bmp", "image/bmp", InputCategory.IMAGE);
        register(".tif", "image/tiff", InputCategory.IMAGE);
        register(".tiff", "image/tiff", InputCategory.IMAGE);
    }

    // Sniffed types too generic to trust over the extension table
    private static final List<String> GENERIC_TYPES = List.of(
            "application/octet-stream",
            "application/zip",
            "application/x-tika-ooxml",
            "application/x-tika-msoffice",
            "text/plain"
    );

    private final Tika tika = new Tika();

    private static void register(String extension, String mimeType, InputCategory category) {
        EXTENSION_TO_TYPE.put(extension, new DetectedType(extension, mimeType, category));
    }

    /**
     * Resolves the type of an uploaded file. A recognised extension decides the category; the MIME type is
     * the sniffed one when Tika is more specific than the table. Files without a recognised extension are
     * accepted only when their content sniffs to a supported MIME type.
     *
     * @return the detected type, or empty when the file is not a supported input
     */
    public Optional<DetectedType> detect(String filename, byte[] bytes) {
        String extension = OutputFilenames.extensionOf(filename);
        DetectedType byExtension = EXTENSION_TO_TYPE.get(extension);
        String sniffed = sniff(filename, bytes);

        if (byExtension != null) {
            if (sniffed != null && !GENERIC_TYPES.contains(sniffed) && findByMimeType(sniffed).isPresent()) {
                return Optional.of(new DetectedType(byExtension.extension(), sniffed, byExtension.category()));
            }
            return Optional.of(byExtension);
        }

        if (!extension.isEmpty()) {
            log.debug("Unsupported extension {} for {}", extension, filename);
            return Optional.empty();
        }

        Optional<DetectedType> bySniff = sniffed == null ? Optional.empty() : findByMimeType(sniffed);
        log.debug("No extension on {}, sniffed {} -> {}", filename, sniffed, bySniff.map(DetectedType::category).orElse(null));
        return bySniff;
    }

    /**
     * Supported extensions, dot included, in a stable order.
     */
    public Set<String> supportedExtensions() {
        return Collections.unmodifiableSet(EXTENSION_TO_TYPE.keySet());
    }

    private Optional<DetectedType> findByMimeType(String mimeType) {
        return EXTENSION_TO_TYPE.values().stream()
                .filter(type -> type.mimeType().equals(mimeType))
                .findFirst();
    }

    private String sniff(String filename, byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            return null;
        }
        try {
            return tika.detect(bytes, filename);
        } catch (RuntimeException e) {
            log.warn("Content sniffing failed for {}: {}", filename, e.getMessage());
            return null;
        }
    }

    /**
     * A supported input type: canonical extension, MIME type and input category.
     */
    public record DetectedType(String extension, String mimeType, InputCategory category) {
    }
}
