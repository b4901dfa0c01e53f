package com.switchboard.core.routing;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "switchboard.routing")
public class RoutingProperties {

    /** Agent that receives every classification with {@code confident = false}. */
    private String fallbackAgent = "human-review";

    /** Start from the built-in table; when false only {@link #table} entries exist. */
    private boolean useDefaults = true;

    /** Overrides keyed {@code destination.consumer.semantics}, e.g. {@code stream.human.interpret}. */
    private Map<String, String> table = new LinkedHashMap<>();

    public String getFallbackAgent() {
        return fallbackAgent;
    }

    public void setFallbackAgent(String fallbackAgent) {
        this.fallbackAgent = fallbackAgent;
    }

    public boolean isUseDefaults() {
        return useDefaults;
    }

    public void setUseDefaults(boolean useDefaults) {
        this.useDefaults = useDefaults;
    }

    public Map<String, String> getTable() {
        return table;
    }

    public void setTable(Map<String, String> table) {
        this.table = table;
    }
}
