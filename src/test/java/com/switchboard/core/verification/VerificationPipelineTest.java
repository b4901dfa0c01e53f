package com.switchboard.core.verification;

import com.switchboard.core.metrics.SwitchboardMetrics;
import com.switchboard.core.model.AtomicOperation;
import com.switchboard.core.model.Classification;
import com.switchboard.core.model.ConsumerType;
import com.switchboard.core.model.DestinationType;
import com.switchboard.core.model.ExecutionSemantics;
import com.switchboard.core.model.OperationStatus;
import com.switchboard.core.model.PipelineResult;
import com.switchboard.core.model.ProposedAction;
import com.switchboard.core.model.StageOutcome;
import com.switchboard.core.model.StageResult;
import com.switchboard.core.model.Verdict;
import com.switchboard.core.model.VerificationContext;
import com.switchboard.core.model.VerificationLayer;
import com.switchboard.core.model.VerificationMode;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link VerificationPipeline} with scripted verifiers.
 */
class VerificationPipelineTest {

    private final Map<VerificationLayer, StageOutcome> script = new EnumMap<>(VerificationLayer.class);
    private final List<VerificationLayer> invoked = new ArrayList<>();
    private VerificationProperties properties;
    private SimpleMeterRegistry registry;
    private VerificationPipeline pipeline;
    private VerificationContext context;

    /** Returns whatever the script says for its layer, PASS by default. */
    private class ScriptedVerifier implements Verifier {
        private final VerificationLayer layer;

        ScriptedVerifier(VerificationLayer layer) {
            this.layer = layer;
        }

        @Override
        public VerificationLayer layer() {
            return layer;
        }

        @Override
        public boolean fatal() {
            return layer == VerificationLayer.SAFETY;
        }

        @Override
        public StageResult verify(VerificationContext ctx) {
            invoked.add(layer);
            StageOutcome outcome = script.getOrDefault(layer, StageOutcome.PASS);
            return switch (outcome) {
                case PASS -> StageResult.pass(layer, "ok");
                case FAIL -> StageResult.fail(layer, "scripted failure");
                case SKIPPED -> throw new VerifierInfrastructureException(layer, "backend down", null);
            };
        }
    }

    @BeforeEach
    void setUp() {
        properties = new VerificationProperties();
        registry = new SimpleMeterRegistry();
        List<Verifier> verifiers = new ArrayList<>();
        for (VerificationLayer layer : VerificationLayer.values()) {
            verifiers.add(new ScriptedVerifier(layer));
        }
        pipeline = new VerificationPipeline(verifiers, properties, new SwitchboardMetrics(registry));
        var operation = new AtomicOperation("op-1", "list files", "alice",
                Classification.of(DestinationType.STREAM, ConsumerType.HUMAN, ExecutionSemantics.READ, true),
                OperationStatus.VERIFYING, Instant.EPOCH, Instant.EPOCH, "assistant");
        context = new VerificationContext(operation, ProposedAction.command("ls", false), null);
    }

    @Test
    @DisplayName("all stages passing approves in both modes")
    void allPassApproves() {
        for (VerificationMode mode : VerificationMode.values()) {
            PipelineResult result = pipeline.run(context, mode);
            assertEquals(Verdict.APPROVED, result.verdict(), mode.name());
            assertEquals(5, result.stages().size());
            assertNull(result.haltedBy());
        }
    }

    @Test
    @DisplayName("stages run in layer order")
    void stagesInOrder() {
        PipelineResult result = pipeline.run(context, VerificationMode.STRICT);

        assertEquals(List.of(VerificationLayer.values()), invoked);
        assertEquals(List.of(VerificationLayer.values()),
                result.stages().stream().map(StageResult::layer).toList());
    }

    @Nested
    @DisplayName("Safety failure")
    class SafetyFailureTests {

        @ParameterizedTest
        @EnumSource(VerificationMode.class)
        @DisplayName("halts the run, skips later stages and hard-rejects")
        void safetyHalts(VerificationMode mode) {
            script.put(VerificationLayer.SAFETY, StageOutcome.FAIL);

            PipelineResult result = pipeline.run(context, mode);

            assertEquals(Verdict.REJECTED, result.verdict());
            assertTrue(result.hardRejection());
            assertFalse(result.escalationRecommended());
            assertEquals(VerificationLayer.SAFETY, result.haltedBy());
            assertEquals(StageOutcome.SKIPPED, result.stage(VerificationLayer.INTENT).orElseThrow().outcome());
            assertEquals(VerificationPipeline.NOT_RUN, result.stage(VerificationLayer.INTENT).orElseThrow().message());
            assertFalse(invoked.contains(VerificationLayer.INTENT));
        }

        @Test
        @DisplayName("a skipped safety stage never approves")
        void safetyUnavailableRejects() {
            script.put(VerificationLayer.SAFETY, StageOutcome.SKIPPED);

            PipelineResult result = pipeline.run(context, VerificationMode.LENIENT);

            assertEquals(Verdict.REJECTED, result.verdict());
            assertFalse(result.hardRejection());
        }
    }

    @Nested
    @DisplayName("Non-fatal failure")
    class NonFatalFailureTests {

        @Test
        @DisplayName("strict mode rejects on a single syntax failure and stops there")
        void strictRejects() {
            script.put(VerificationLayer.SYNTAX, StageOutcome.FAIL);

            PipelineResult result = pipeline.run(context, VerificationMode.STRICT);

            assertEquals(Verdict.REJECTED, result.verdict());
            assertFalse(result.hardRejection());
            assertTrue(result.escalationRecommended());
            assertEquals(VerificationLayer.SYNTAX, result.haltedBy());
            assertEquals(List.of(VerificationLayer.SYNTAX), invoked);
            assertEquals(StageOutcome.SKIPPED, result.stage(VerificationLayer.SAFETY).orElseThrow().outcome());
        }

        @Test
        @DisplayName("lenient mode approves a single syntax failure when the threshold is met")
        void lenientApproves() {
            script.put(VerificationLayer.SYNTAX, StageOutcome.FAIL);

            PipelineResult result = pipeline.run(context, VerificationMode.LENIENT);

            assertEquals(Verdict.APPROVED, result.verdict());
            assertEquals(StageOutcome.FAIL, result.stage(VerificationLayer.SYNTAX).orElseThrow().outcome());
            assertEquals(5, invoked.size());
        }

        @Test
        @DisplayName("lenient mode rejects when passing weight falls below the threshold")
        void lenientRejectsBelowThreshold() {
            script.put(VerificationLayer.SYNTAX, StageOutcome.FAIL);
            script.put(VerificationLayer.SEMANTIC, StageOutcome.FAIL);
            script.put(VerificationLayer.INTENT, StageOutcome.FAIL);

            assertEquals(Verdict.REJECTED, pipeline.run(context, VerificationMode.LENIENT).verdict());
        }

        @Test
        @DisplayName("layer weights change the lenient outcome")
        void weightsApply() {
            script.put(VerificationLayer.SYNTAX, StageOutcome.FAIL);
            script.put(VerificationLayer.SEMANTIC, StageOutcome.FAIL);
            script.put(VerificationLayer.INTENT, StageOutcome.FAIL);
            properties.getWeights().put(VerificationLayer.SAFETY, 2.0);

            assertEquals(Verdict.APPROVED, pipeline.run(context, VerificationMode.LENIENT).verdict());
        }
    }

    @Test
    @DisplayName("an unavailable verifier is recorded as skipped, not failed")
    void infrastructureFailureSkipped() {
        script.put(VerificationLayer.INTENT, StageOutcome.SKIPPED);

        PipelineResult result = pipeline.run(context, VerificationMode.STRICT);

        StageResult intent = result.stage(VerificationLayer.INTENT).orElseThrow();
        assertEquals(StageOutcome.SKIPPED, intent.outcome());
        assertEquals("backend down", intent.error());
        assertEquals(Verdict.APPROVED, result.verdict());
    }

    @Test
    @DisplayName("the default mode comes from configuration")
    void defaultModeFromProperties() {
        properties.setMode(VerificationMode.LENIENT);
        assertEquals(VerificationMode.LENIENT, pipeline.run(context).mode());
    }

    @Test
    @DisplayName("verdicts and stage outcomes are counted")
    void metricsRecorded() {
        pipeline.run(context, VerificationMode.STRICT);

        assertEquals(1, registry.get("switchboard.verifications.total")
                .tag("mode", "strict").tag("verdict", "approved").counter().count());
        assertEquals(1, registry.get("switchboard.verification.stages")
                .tag("layer", "safety").tag("outcome", "pass").counter().count());
    }

    @Test
    @DisplayName("verifiers out of layer order are rejected")
    void orderEnforced() {
        List<Verifier> reversed = new ArrayList<>();
        for (VerificationLayer layer : VerificationLayer.values()) {
            reversed.add(0, new ScriptedVerifier(layer));
        }
        assertThrows(IllegalArgumentException.class, () ->
                new VerificationPipeline(reversed, properties, new SwitchboardMetrics(registry)));
    }
}
