package uk.gegc.aiready.features.conversion.domain;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;

import java.util.Locale;

/**
 * Text representations a file can be rendered to.
 */
@Getter
public enum OutputFormat {
    MARKDOWN("markdown", ".md", "text/markdown"),
    JSON("json", ".json", "application/json");

    private final String value;
    private final String extension;
    private final String mediaType;

    OutputFormat(String value, String extension, String mediaType) {
        this.value = value;
        this.extension = extension;
        this.mediaType = mediaType;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Parses a client-supplied format name. Accepts {@code markdown}, {@code md} and {@code json},
     * case-insensitively.
     *
     * @throws UnsupportedFormatException for anything else
     */
    public static OutputFormat fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new UnsupportedFormatException("Output format is required");
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "markdown", "md" -> MARKDOWN;
            case "json" -> JSON;
            default -> throw new UnsupportedFormatException("Unsupported output format: " + value);
        };
    }
}
