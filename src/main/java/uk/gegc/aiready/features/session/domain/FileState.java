package uk.gegc.aiready.features.session.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum FileState {
    UPLOADED,
    CONVERTING,
    CONVERTED,
    ERROR;

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
