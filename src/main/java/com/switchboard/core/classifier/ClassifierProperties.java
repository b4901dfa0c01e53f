package com.switchboard.core.classifier;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "switchboard.classifier")
public class ClassifierProperties {

    /**
     * Only used when a backend answers with a numeric {@code confidence} instead
     * of the boolean {@code confident}: scores at or above it count as confident.
     */
    private double confidenceThreshold = 0.7;

    /** Per-call timeout; falls back to {@code switchboard.llm.timeout} when unset. */
    private Duration timeout;

    private Double temperature = 0.1;

    public double getConfidenceThreshold() {
        return confidenceThreshold;
    }

    public void setConfidenceThreshold(double confidenceThreshold) {
        this.confidenceThreshold = confidenceThreshold;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public void setTimeout(Duration timeout) {
        this.timeout = timeout;
    }

    public Double getTemperature() {
        return temperature;
    }

    public void setTemperature(Double temperature) {
        this.temperature = temperature;
    }
}
