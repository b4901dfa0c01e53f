package com.switchboard.core.model;

import java.io.Serializable;
import java.util.List;
import java.util.Optional;

/**
 * Outcome of one verification run.
 *
 * @param stages        one entry per layer, in execution order
 * @param haltedBy      the layer whose failure stopped the run, null when every stage ran
 * @param hardRejection true when Safety failed; such a rejection is never escalated
 */
public record PipelineResult(
        List<StageResult> stages,
        Verdict verdict,
        VerificationMode mode,
        VerificationLayer haltedBy,
        boolean hardRejection
) implements Serializable {

    public PipelineResult {
        stages = List.copyOf(stages);
    }

    public Optional<StageResult> stage(VerificationLayer layer) {
        return stages.stream().filter(s -> s.layer() == layer).findFirst();
    }

    public boolean approved() {
        return verdict == Verdict.APPROVED;
    }

    /** Rejected for a reason a human may overrule. */
    public boolean escalationRecommended() {
        return !approved() && !hardRejection;
    }
}
