package com.switchboard.core.model;

import java.io.Serializable;

/**
 * @param fallback true when the confidence gate overrode the routing table
 */
public record AgentRoute(
        String agentId,
        boolean fallback,
        String reason,
        Classification classification
) implements Serializable {}
