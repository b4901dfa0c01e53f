package com.switchboard.core.model;

/**
 * Lifecycle of an {@link AtomicOperation}.
 */
public enum OperationStatus {
    CREATED,
    CLASSIFIED,
    ROUTED,
    VERIFYING,
    APPROVED,
    REJECTED,
    ESCALATED;

    public boolean isTerminal() {
        return this == APPROVED || this == REJECTED;
    }
}
