package com.switchboard.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Locale;

/**
 * Centralised Micrometer metrics for the classify, route, verify and learn flow.
 */
@Service
public class SwitchboardMetrics {

    private final MeterRegistry registry;

    public SwitchboardMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * @param outcome "confident", "unconfident" or an error kind
     */
    public void recordClassification(String outcome) {
        Counter.builder("switchboard.classifications.total")
                .tag("outcome", outcome.toLowerCase(Locale.ROOT))
                .register(registry)
                .increment();
    }

    public void recordRoute(String agentId, boolean fallback) {
        Counter.builder("switchboard.routes.total")
                .tag("agent", agentId)
                .tag("fallback", String.valueOf(fallback))
                .register(registry)
                .increment();
    }

    public void recordVerification(String mode, String verdict, long ms) {
        Counter.builder("switchboard.verifications.total")
                .tag("mode", mode.toLowerCase(Locale.ROOT))
                .tag("verdict", verdict.toLowerCase(Locale.ROOT))
                .register(registry)
                .increment();
        Timer.builder("switchboard.verification.duration")
                .tag("mode", mode.toLowerCase(Locale.ROOT))
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordStage(String layer, String outcome) {
        Counter.builder("switchboard.verification.stages")
                .description("Verification stage outcomes per layer")
                .tag("layer", layer.toLowerCase(Locale.ROOT))
                .tag("outcome", outcome.toLowerCase(Locale.ROOT))
                .register(registry)
                .increment();
    }

    /**
     * @param outcome "success", "timeout" or "failure"
     */
    public void recordInferenceCall(String outcome, long ms) {
        Timer.builder("switchboard.inference.duration")
                .tag("outcome", outcome)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordFeedback(String feedbackType) {
        Counter.builder("switchboard.feedback.total")
                .tag("type", feedbackType.toLowerCase(Locale.ROOT))
                .register(registry)
                .increment();
    }

    public void recordOperationResult(String status) {
        Counter.builder("switchboard.operations.total")
                .tag("status", status.toLowerCase(Locale.ROOT))
                .register(registry)
                .increment();
    }
}
