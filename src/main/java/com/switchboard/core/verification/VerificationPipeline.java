package com.switchboard.core.verification;

import com.switchboard.core.logging.MdcContext;
import com.switchboard.core.metrics.SwitchboardMetrics;
import com.switchboard.core.model.PipelineResult;
import com.switchboard.core.model.StageOutcome;
import com.switchboard.core.model.StageResult;
import com.switchboard.core.model.VerificationContext;
import com.switchboard.core.model.VerificationLayer;
import com.switchboard.core.model.VerificationMode;
import com.switchboard.core.model.Verdict;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs the five verifiers in a fixed order and turns their results into a verdict.
 * <p>
 * A failing fatal stage (Safety) stops the run in every mode; strict mode also
 * stops at the first failing stage. Stages after the stop are recorded as
 * SKIPPED. Safety must pass for any approval. Strict mode then approves when no
 * executed stage failed; lenient mode approves when the weights of the passing
 * stages reach {@code min-pass-weight}.
 */
@Service
public class VerificationPipeline {

    private static final Logger log = LoggerFactory.getLogger(VerificationPipeline.class);

    static final String NOT_RUN = "not run";

    private final List<Verifier> verifiers;
    private final VerificationProperties properties;
    private final SwitchboardMetrics metrics;

    @Autowired
    public VerificationPipeline(SyntaxVerifier syntax, SemanticVerifier semantic, BehavioralVerifier behavioral,
                                SafetyVerifier safety, IntentVerifier intent,
                                VerificationProperties properties, SwitchboardMetrics metrics) {
        this(List.of(syntax, semantic, behavioral, safety, intent), properties, metrics);
    }

    /**
     * @param verifiers exactly one verifier per {@link VerificationLayer}, in layer order
     */
    public VerificationPipeline(List<Verifier> verifiers, VerificationProperties properties,
                                SwitchboardMetrics metrics) {
        VerificationLayer[] layers = VerificationLayer.values();
        if (verifiers.size() != layers.length) {
            throw new IllegalArgumentException("Expected " + layers.length + " verifiers, got " + verifiers.size());
        }
        for (int i = 0; i < layers.length; i++) {
            if (verifiers.get(i).layer() != layers[i]) {
                throw new IllegalArgumentException("Verifier " + i + " must be " + layers[i]
                        + " but was " + verifiers.get(i).layer());
            }
        }
        this.verifiers = List.copyOf(verifiers);
        this.properties = properties;
        this.metrics = metrics;
    }

    public PipelineResult run(VerificationContext context) {
        return run(context, properties.getMode());
    }

    public PipelineResult run(VerificationContext context, VerificationMode mode) {
        long start = System.currentTimeMillis();
        List<StageResult> results = new ArrayList<>(verifiers.size());
        VerificationLayer haltedBy = null;
        boolean hardRejection = false;

        for (Verifier verifier : verifiers) {
            if (haltedBy != null) {
                results.add(StageResult.skipped(verifier.layer(), NOT_RUN));
                continue;
            }
            StageResult result = runStage(verifier, context);
            results.add(result);
            metrics.recordStage(result.layer().name(), result.outcome().name());
            if (result.failed()) {
                if (verifier.fatal()) {
                    haltedBy = verifier.layer();
                    hardRejection = true;
                } else if (mode == VerificationMode.STRICT) {
                    haltedBy = verifier.layer();
                }
            }
        }

        Verdict verdict = aggregate(results, mode) ? Verdict.APPROVED : Verdict.REJECTED;
        long elapsed = System.currentTimeMillis() - start;
        metrics.recordVerification(mode.name(), verdict.name(), elapsed);
        log.info("Verification {} in {} mode ({}ms){}", verdict, mode, elapsed,
                haltedBy != null ? ", halted by " + haltedBy : "");
        return new PipelineResult(results, verdict, mode, haltedBy, hardRejection);
    }

    private StageResult runStage(Verifier verifier, VerificationContext context) {
        MdcContext.setStage(verifier.layer().name());
        long start = System.currentTimeMillis();
        try {
            StageResult result = verifier.verify(context);
            log.debug("{} -> {}: {}", verifier.layer(), result.outcome(), result.message());
            return result.withDuration(System.currentTimeMillis() - start);
        } catch (VerifierInfrastructureException e) {
            log.warn("{} verifier unavailable, stage skipped: {}", verifier.layer(), e.getMessage());
            return StageResult.infrastructureFailure(verifier.layer(), e.getMessage())
                    .withDuration(System.currentTimeMillis() - start);
        } finally {
            MdcContext.clearStage();
        }
    }

    private boolean aggregate(List<StageResult> results, VerificationMode mode) {
        boolean safetyPassed = results.stream()
                .anyMatch(r -> r.layer() == VerificationLayer.SAFETY && r.outcome() == StageOutcome.PASS);
        if (!safetyPassed) {
            return false;
        }
        if (mode == VerificationMode.STRICT) {
            return results.stream().noneMatch(StageResult::failed);
        }
        double weight = results.stream()
                .filter(StageResult::passed)
                .mapToDouble(r -> properties.weightOf(r.layer()))
                .sum();
        return weight >= properties.getMinPassWeight();
    }
}
