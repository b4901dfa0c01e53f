package com.switchboard.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Taxonomy axis: What the operation does with its inputs.
 */
public enum ExecutionSemantics {
    READ("read"),
    INTERPRET("interpret"),
    EXECUTE("execute");

    private final String value;

    ExecutionSemantics(String value) {
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
    public static ExecutionSemantics fromValue(String raw) {
        if (raw == null) {
            throw new IllegalArgumentException("ExecutionSemantics must not be null");
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (ExecutionSemantics candidate : values()) {
            if (candidate.value.equals(normalized)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown ExecutionSemantics: '" + raw + "'");
    }
}
