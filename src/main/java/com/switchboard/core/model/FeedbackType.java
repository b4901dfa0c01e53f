package com.switchboard.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum FeedbackType {
    CORRECTION,
    CONFIRMATION;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static FeedbackType fromValue(String raw) {
        if (raw == null) {
            throw new IllegalArgumentException("FeedbackType must not be null");
        }
        return valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
