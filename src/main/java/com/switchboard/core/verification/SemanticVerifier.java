package com.switchboard.core.verification;

import com.switchboard.core.model.ActionKind;
import com.switchboard.core.model.Classification;
import com.switchboard.core.model.DestinationType;
import com.switchboard.core.model.EnvironmentFacts;
import com.switchboard.core.model.ExecutionSemantics;
import com.switchboard.core.model.ProposedAction;
import com.switchboard.core.model.StageResult;
import com.switchboard.core.model.VerificationContext;
import com.switchboard.core.model.VerificationLayer;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.Set;

/**
 * Checks that the action fits the classification and refers to things that exist.
 * <p>
 * The destination check only applies to confident classifications; unconfident
 * ones were sent to the fallback agent, whose answer need not match the axes.
 * READ semantics never allow writes or deletes. Entity checks only run when the
 * environment reports the relevant facts.
 */
@Component
public class SemanticVerifier implements Verifier {

    @Override
    public VerificationLayer layer() {
        return VerificationLayer.SEMANTIC;
    }

    @Override
    public StageResult verify(VerificationContext context) {
        Classification classification = context.classification();
        ProposedAction action = context.action();
        if (classification == null) {
            return StageResult.fail(layer(), "operation has no classification");
        }
        if (action == null || action.kind() == null) {
            return StageResult.fail(layer(), "no action to compare with the classification");
        }
        if (classification.confident() && !allowedKinds(classification.destination()).contains(action.kind())) {
            return StageResult.fail(layer(), action.kind() + " does not fit destination "
                    + classification.destination().value());
        }
        if (classification.semantics() == ExecutionSemantics.READ && action.kind().touchesFiles()) {
            return StageResult.fail(layer(), "read-only request must not modify files");
        }

        EnvironmentFacts facts = context.facts();
        if (action.kind() == ActionKind.FILE_DELETE && !facts.existingPaths().isEmpty()
                && !facts.existingPaths().contains(action.targetPath())) {
            return StageResult.fail(layer(), "delete target does not exist: " + action.targetPath());
        }
        if (action.kind() == ActionKind.COMMAND && !facts.availableCommands().isEmpty()) {
            String executable = executable(action.command());
            if (!facts.availableCommands().contains(executable)) {
                return StageResult.fail(layer(), "unknown command: " + executable);
            }
        }
        return StageResult.pass(layer(), "action consistent with " + classification.key());
    }

    /** Stream output may come from a response or from a command whose output is shown. */
    static Set<ActionKind> allowedKinds(DestinationType destination) {
        return switch (destination) {
            case STREAM -> EnumSet.of(ActionKind.RESPONSE, ActionKind.COMMAND);
            case FILE -> EnumSet.of(ActionKind.FILE_WRITE, ActionKind.FILE_DELETE);
            case PROCESS -> EnumSet.of(ActionKind.COMMAND);
        };
    }

    static String executable(String command) {
        if (command == null) {
            return "";
        }
        String[] tokens = command.trim().split("\\s+");
        int i = 0;
        while (i < tokens.length - 1 && (tokens[i].equals("sudo") || tokens[i].contains("="))) {
            i++;
        }
        return tokens[i];
    }
}
