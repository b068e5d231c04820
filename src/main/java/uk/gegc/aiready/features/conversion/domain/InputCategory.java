package uk.gegc.aiready.features.conversion.domain;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;

/**
 * Input families recognised at upload time, each with the output format used when the
 * client does not pick one.
 */
@Getter
public enum InputCategory {
    DOCUMENT("document", OutputFormat.MARKDOWN),
    SPREADSHEET("spreadsheet", OutputFormat.JSON),
    PRESENTATION("presentation", OutputFormat.MARKDOWN),
    IMAGE("image", OutputFormat.JSON);

    private final String value;
    private final OutputFormat defaultFormat;

    InputCategory(String value, OutputFormat defaultFormat) {
        this.value = value;
        this.defaultFormat = defaultFormat;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
