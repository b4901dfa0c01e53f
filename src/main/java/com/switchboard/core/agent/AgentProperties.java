package com.switchboard.core.agent;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "switchboard.agents")
public class AgentProperties {

    /** Inference-backed agents keyed by id, with the instruction each one follows. */
    private Map<String, String> instructions = new LinkedHashMap<>();

    /** Per-call timeout; falls back to {@code switchboard.llm.timeout} when unset. */
    private Duration timeout;

    public Map<String, String> getInstructions() {
        return instructions;
    }

    public void setInstructions(Map<String, String> instructions) {
        this.instructions = instructions;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public void setTimeout(Duration timeout) {
        this.timeout = timeout;
    }
}
