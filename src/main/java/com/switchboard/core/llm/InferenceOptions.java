package com.switchboard.core.llm;

import java.time.Duration;

/**
 * @param timeout     hard limit for the call
 * @param jsonOutput  ask the model for a single JSON object
 * @param temperature sampling temperature, null keeps the backend default
 */
public record InferenceOptions(Duration timeout, boolean jsonOutput, Double temperature) {

    public InferenceOptions {
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
    }

    public static InferenceOptions json(Duration timeout) {
        return new InferenceOptions(timeout, true, null);
    }
}
