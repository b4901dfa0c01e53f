package com.switchboard.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * The unit of work tracked from request to verdict. Instances are snapshots;
 * only the operation store produces new ones.
 *
 * @param classification null until the operation has been classified
 * @param agentId        null until the operation has been routed
 */
public record AtomicOperation(
        String id,
        String userRequest,
        String userId,
        Classification classification,
        OperationStatus status,
        Instant createdAt,
        Instant updatedAt,
        String agentId
) implements Serializable {

    public boolean isClassified() {
        return classification != null;
    }

    public AtomicOperation withClassification(Classification newClassification, Instant now) {
        return new AtomicOperation(id, userRequest, userId, newClassification,
                OperationStatus.CLASSIFIED, createdAt, now, agentId);
    }

    public AtomicOperation withStatus(OperationStatus newStatus, Instant now) {
        return new AtomicOperation(id, userRequest, userId, classification, newStatus, createdAt, now, agentId);
    }

    public AtomicOperation withAgent(String newAgentId, Instant now) {
        return new AtomicOperation(id, userRequest, userId, classification,
                OperationStatus.ROUTED, createdAt, now, newAgentId);
    }
}
