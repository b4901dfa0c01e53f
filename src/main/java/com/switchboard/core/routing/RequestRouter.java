package com.switchboard.core.routing;

import com.switchboard.core.model.AgentRoute;
import com.switchboard.core.model.Classification;
import com.switchboard.core.model.ConsumerType;
import com.switchboard.core.model.DestinationType;
import com.switchboard.core.model.ExecutionSemantics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Maps a {@link Classification} to the agent that handles it.
 * <p>
 * The table is fixed at construction; {@link #route} is a pure lookup and safe
 * to call from any thread. The confidence gate comes first: an unconfident
 * classification always goes to the fallback agent, whatever its axes say.
 */
@Service
public class RequestRouter {

    private static final Logger log = LoggerFactory.getLogger(RequestRouter.class);

    public static final String ASSISTANT_AGENT = "assistant";
    public static final String FILES_AGENT = "files";
    public static final String SYSTEM_AGENT = "system";

    private final Map<String, String> table;
    private final String fallbackAgent;

    public RequestRouter(RoutingProperties properties) {
        if (properties.getFallbackAgent() == null || properties.getFallbackAgent().isBlank()) {
            throw new IllegalArgumentException("switchboard.routing.fallback-agent must be set");
        }
        this.fallbackAgent = properties.getFallbackAgent();
        var entries = new LinkedHashMap<String, String>();
        if (properties.isUseDefaults()) {
            entries.putAll(defaultTable());
        }
        properties.getTable().forEach((key, agent) -> entries.put(normalizeKey(key), agent));
        this.table = Map.copyOf(entries);
        log.info("Routing table loaded: {} entries, fallback agent '{}'", table.size(), fallbackAgent);
    }

    /**
     * @throws RoutingException when the classification is null or has no table entry
     */
    public AgentRoute route(Classification classification) {
        if (classification == null) {
            throw new RoutingException("Cannot route an unclassified operation");
        }
        if (!classification.confident()) {
            return new AgentRoute(fallbackAgent, true, "low confidence", classification);
        }
        String agent = table.get(classification.key());
        if (agent == null) {
            throw new RoutingException("No route for " + classification.key());
        }
        return new AgentRoute(agent, false, "table:" + classification.key(), classification);
    }

    public String fallbackAgent() {
        return fallbackAgent;
    }

    /** Every agent id the router can return, fallback included. */
    public Set<String> agentIds() {
        Set<String> ids = new HashSet<>(table.values());
        ids.add(fallbackAgent);
        return ids;
    }

    public Map<String, String> table() {
        return table;
    }

    /**
     * Built-in table: conversational output goes to the assistant, anything on
     * the filesystem to the files agent, processes and executed streams to the
     * system agent.
     */
    static Map<String, String> defaultTable() {
        var defaults = new LinkedHashMap<String, String>();
        for (DestinationType destination : DestinationType.values()) {
            for (ConsumerType consumer : ConsumerType.values()) {
                for (ExecutionSemantics semantics : ExecutionSemantics.values()) {
                    defaults.put(Classification.key(destination, consumer, semantics),
                            defaultAgent(destination, semantics));
                }
            }
        }
        return defaults;
    }

    private static String defaultAgent(DestinationType destination, ExecutionSemantics semantics) {
        return switch (destination) {
            case STREAM -> semantics == ExecutionSemantics.EXECUTE ? SYSTEM_AGENT : ASSISTANT_AGENT;
            case FILE -> FILES_AGENT;
            case PROCESS -> SYSTEM_AGENT;
        };
    }

    private static String normalizeKey(String key) {
        String[] parts = key.trim().toLowerCase(Locale.ROOT).split("\\.");
        if (parts.length != 3) {
            throw new IllegalArgumentException("Routing key must be destination.consumer.semantics: " + key);
        }
        return Classification.key(
                DestinationType.fromValue(parts[0]),
                ConsumerType.fromValue(parts[1]),
                ExecutionSemantics.fromValue(parts[2]));
    }
}
