package com.switchboard.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Taxonomy axis: Where the operation output goes.
 */
public enum DestinationType {
    STREAM("stream"),
    FILE("file"),
    PROCESS("process");

    private final String value;

    DestinationType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * Parses a wire value, ignoring case and surrounding whitespace.
     *
     * @throws IllegalArgumentException when the value is not part of the taxonomy
     */
    @JsonCreator
    public static DestinationType fromValue(String raw) {
        if (raw == null) {
            throw new IllegalArgumentException("DestinationType must not be null");
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (DestinationType candidate : values()) {
            if (candidate.value.equals(normalized)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown DestinationType: '" + raw + "'");
    }
}
