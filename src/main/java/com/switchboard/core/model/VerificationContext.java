package com.switchboard.core.model;

/**
 * Everything a verifier may look at. Built per pipeline run and never stored.
 */
public record VerificationContext(
        AtomicOperation operation,
        ProposedAction action,
        EnvironmentFacts facts
) {

    public VerificationContext {
        if (facts == null) {
            facts = EnvironmentFacts.none();
        }
    }

    public Classification classification() {
        return operation.classification();
    }
}
