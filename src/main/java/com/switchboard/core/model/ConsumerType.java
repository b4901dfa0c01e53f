package com.switchboard.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Taxonomy axis: Who consumes the operation result.
 */
public enum ConsumerType {
    HUMAN("human"),
    MACHINE("machine");

    private final String value;

    ConsumerType(String value) {
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
    public static ConsumerType fromValue(String raw) {
        if (raw == null) {
            throw new IllegalArgumentException("ConsumerType must not be null");
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (ConsumerType candidate : values()) {
            if (candidate.value.equals(normalized)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown ConsumerType: '" + raw + "'");
    }
}
