package com.switchboard.core.nodes;

import com.switchboard.core.agent.AgentRegistry;
import com.switchboard.core.model.AtomicOperation;
import com.switchboard.core.model.OperationStatus;
import com.switchboard.core.model.ProposedAction;
import com.switchboard.core.state.OperationState;
import com.switchboard.core.store.IllegalStateTransitionException;
import com.switchboard.core.store.OperationStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Lets the routed agent propose an action and moves the operation into verification.
 * <p>
 * When a correction sends the operation back to CLASSIFIED while the agent is
 * proposing, the proposal is dropped and the status found is reported.
 */
@Component
public class ProposeActionNode {

    private static final Logger log = LoggerFactory.getLogger(ProposeActionNode.class);

    private final AgentRegistry agents;
    private final OperationStore store;

    public ProposeActionNode(AgentRegistry agents, OperationStore store) {
        this.agents = agents;
        this.store = store;
    }

    public Map<String, Object> apply(OperationState state) {
        AtomicOperation operation = store.getOperation(state.operationId());
        ProposedAction action = agents.get(operation.agentId()).propose(operation);
        try {
            store.transition(operation.id(), OperationStatus.VERIFYING);
        } catch (IllegalStateTransitionException e) {
            log.info("Operation {} changed to {} while agent {} proposed; proposal dropped",
                    operation.id(), e.from(), operation.agentId());
            return Map.of("status", e.from().name());
        }
        return Map.of(
                "action", action,
                "status", OperationStatus.VERIFYING.name());
    }
}
