package com.switchboard.core.verification;

import com.switchboard.core.model.ActionKind;
import com.switchboard.core.model.ExecutionSemantics;
import com.switchboard.core.model.ProposedAction;
import com.switchboard.core.model.StageResult;
import com.switchboard.core.model.VerificationContext;
import com.switchboard.core.model.VerificationLayer;
import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.TreeSet;

/**
 * Compares what a simulated run touched with what the action declared.
 * <p>
 * Responses and read-only requests must leave no effects; file actions may
 * only touch their target. A command without a declared target is not
 * constrained. Without a simulation the stage is skipped.
 */
@Component
public class BehavioralVerifier implements Verifier {

    static final String NOT_SIMULATED = "no simulated effects";

    @Override
    public VerificationLayer layer() {
        return VerificationLayer.BEHAVIORAL;
    }

    @Override
    public StageResult verify(VerificationContext context) {
        Set<String> effects = context.facts().observedEffects();
        if (effects.isEmpty()) {
            return StageResult.skipped(layer(), NOT_SIMULATED);
        }
        ProposedAction action = context.action();
        if (action == null || action.kind() == null) {
            return StageResult.fail(layer(), "effects observed without an action");
        }
        boolean readOnly = context.classification() != null
                && context.classification().semantics() == ExecutionSemantics.READ;
        if (action.kind() == ActionKind.RESPONSE || readOnly) {
            return StageResult.fail(layer(), "unexpected side effects: " + new TreeSet<>(effects));
        }
        if (action.targetPath() != null) {
            Set<String> undeclared = new TreeSet<>(effects);
            undeclared.remove(action.targetPath());
            if (!undeclared.isEmpty()) {
                return StageResult.fail(layer(), "undeclared effects: " + undeclared);
            }
        }
        return StageResult.pass(layer(), effects.size() + " observed effect(s) match the action");
    }
}
