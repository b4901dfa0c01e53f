package com.switchboard.core.verification;

import com.switchboard.core.model.AtomicOperation;
import com.switchboard.core.model.Classification;
import com.switchboard.core.model.ConsumerType;
import com.switchboard.core.model.DestinationType;
import com.switchboard.core.model.EnvironmentFacts;
import com.switchboard.core.model.ExecutionSemantics;
import com.switchboard.core.model.OperationStatus;
import com.switchboard.core.model.ProposedAction;
import com.switchboard.core.model.StageOutcome;
import com.switchboard.core.model.StageResult;
import com.switchboard.core.model.VerificationContext;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class BehavioralVerifierTest {

    private final BehavioralVerifier verifier = new BehavioralVerifier();

    private StageResult verify(ExecutionSemantics semantics, ProposedAction action, Set<String> effects) {
        var classification = Classification.of(DestinationType.FILE, ConsumerType.HUMAN, semantics, true);
        var operation = new AtomicOperation("op-1", "request", "alice", classification, OperationStatus.VERIFYING,
                Instant.EPOCH, Instant.EPOCH, "files");
        return verifier.verify(new VerificationContext(operation, action,
                new EnvironmentFacts(Set.of(), Set.of(), effects, null)));
    }

    @Test
    @DisplayName("without a simulation the stage is skipped")
    void skippedWithoutSimulation() {
        StageResult result = verify(ExecutionSemantics.EXECUTE, ProposedAction.writeFile("a.txt", "x"), Set.of());
        assertEquals(StageOutcome.SKIPPED, result.outcome());
        assertEquals(BehavioralVerifier.NOT_SIMULATED, result.message());
    }

    @Test
    @DisplayName("a write that touches only its target passes")
    void targetOnlyPasses() {
        assertEquals(StageOutcome.PASS,
                verify(ExecutionSemantics.EXECUTE, ProposedAction.writeFile("a.txt", "x"), Set.of("a.txt")).outcome());
    }

    @Test
    @DisplayName("effects beyond the target fail")
    void undeclaredEffectsFail() {
        StageResult result = verify(ExecutionSemantics.EXECUTE, ProposedAction.writeFile("a.txt", "x"),
                Set.of("a.txt", "b.txt"));
        assertEquals(StageOutcome.FAIL, result.outcome());
        assertTrue(result.message().contains("b.txt"));
    }

    @Test
    @DisplayName("responses and read-only requests must not have effects")
    void readOnlyMustNotTouch() {
        assertEquals(StageOutcome.FAIL,
                verify(ExecutionSemantics.EXECUTE, ProposedAction.response("hi"), Set.of("x")).outcome());
        assertEquals(StageOutcome.FAIL,
                verify(ExecutionSemantics.READ, ProposedAction.command("cat x", false), Set.of("x")).outcome());
    }

    @Test
    @DisplayName("a command without a target is not constrained")
    void commandWithoutTarget() {
        assertEquals(StageOutcome.PASS,
                verify(ExecutionSemantics.EXECUTE, ProposedAction.command("make", false), Set.of("build/app")).outcome());
    }
}
