package com.switchboard.core.model;

import java.io.Serializable;

/**
 * @param error set only when the stage was skipped because its infrastructure failed
 */
public record StageResult(
        VerificationLayer layer,
        StageOutcome outcome,
        String message,
        String error,
        long durationMs
) implements Serializable {

    public static StageResult pass(VerificationLayer layer, String message) {
        return new StageResult(layer, StageOutcome.PASS, message, null, 0);
    }

    public static StageResult fail(VerificationLayer layer, String message) {
        return new StageResult(layer, StageOutcome.FAIL, message, null, 0);
    }

    public static StageResult skipped(VerificationLayer layer, String message) {
        return new StageResult(layer, StageOutcome.SKIPPED, message, null, 0);
    }

    public static StageResult infrastructureFailure(VerificationLayer layer, String error) {
        return new StageResult(layer, StageOutcome.SKIPPED, "verifier unavailable", error, 0);
    }

    public StageResult withDuration(long ms) {
        return new StageResult(layer, outcome, message, error, ms);
    }

    public boolean passed() {
        return outcome == StageOutcome.PASS;
    }

    public boolean failed() {
        return outcome == StageOutcome.FAIL;
    }
}
