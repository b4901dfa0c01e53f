package com.switchboard.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * Audit row written for every classifier answer attached to an operation.
 */
public record ClassificationLogEntry(
        String operationId,
        Classification classification,
        String rationale,
        String model,
        Instant createdAt
) implements Serializable {}
