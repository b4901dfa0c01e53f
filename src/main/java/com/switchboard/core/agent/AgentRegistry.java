package com.switchboard.core.agent;

import com.switchboard.core.llm.InferenceService;
import com.switchboard.core.llm.LlmProperties;
import com.switchboard.core.routing.RequestRouter;
import com.switchboard.core.routing.RoutingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Explicit id to {@link Agent} table, built once at startup.
 * <p>
 * Every id the router can return must be registered, otherwise the
 * application fails to start.
 */
@Component
public class AgentRegistry {

    private static final Logger log = LoggerFactory.getLogger(AgentRegistry.class);

    private final Map<String, Agent> agents;

    public AgentRegistry(AgentProperties properties, InferenceService inferenceService,
                         LlmProperties llmProperties, RequestRouter router) {
        Duration timeout = properties.getTimeout() != null ? properties.getTimeout() : llmProperties.getTimeout();
        var table = new LinkedHashMap<String, Agent>();
        properties.getInstructions().forEach((id, instruction) ->
                table.put(id, new PromptedAgent(id, instruction, inferenceService, timeout)));
        table.put(router.fallbackAgent(), new HumanReviewAgent(router.fallbackAgent()));
        this.agents = Map.copyOf(table);

        Set<String> missing = new HashSet<>(router.agentIds());
        missing.removeAll(agents.keySet());
        if (!missing.isEmpty()) {
            throw new IllegalStateException("Routing table references unregistered agents: " + missing);
        }
        log.info("Registered agents: {}", agents.keySet());
    }

    /**
     * @throws RoutingException when no agent has the id
     */
    public Agent get(String agentId) {
        Agent agent = agents.get(agentId);
        if (agent == null) {
            throw new RoutingException("No agent registered as '" + agentId + "'");
        }
        return agent;
    }

    public Set<String> ids() {
        return agents.keySet();
    }
}
