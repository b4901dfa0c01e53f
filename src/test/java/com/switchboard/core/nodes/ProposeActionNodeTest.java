package com.switchboard.core.nodes;

import com.switchboard.core.agent.Agent;
import com.switchboard.core.agent.AgentRegistry;
import com.switchboard.core.model.*;
import com.switchboard.core.state.OperationState;
import com.switchboard.core.store.InMemoryOperationStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class ProposeActionNodeTest {

    private static final Classification SYSTEM = Classification.of(DestinationType.FILE, ConsumerType.MACHINE,
            ExecutionSemantics.EXECUTE, true);

    private InMemoryOperationStore store;
    private Agent agent;
    private ProposeActionNode node;
    private AtomicOperation op;

    @BeforeEach
    void setUp() {
        store = new InMemoryOperationStore(Clock.systemUTC());
        agent = mock(Agent.class);
        AgentRegistry registry = mock(AgentRegistry.class);
        when(registry.get("files")).thenReturn(agent);
        node = new ProposeActionNode(registry, store);

        op = store.createOperation("save notes", "alice");
        store.updateClassification(op.id(), SYSTEM);
        store.assignAgent(op.id(), "files");
    }

    @Test
    @DisplayName("hands the proposal on and moves the operation to VERIFYING")
    void proposes() {
        ProposedAction action = ProposedAction.writeFile("notes.txt", "hello");
        when(agent.propose(any(AtomicOperation.class))).thenReturn(action);

        Map<String, Object> update = node.apply(new OperationState(Map.of("operationId", op.id())));

        assertEquals(OperationStatus.VERIFYING.name(), update.get("status"));
        assertEquals(action, update.get("action"));
        assertEquals(OperationStatus.VERIFYING, store.getOperation(op.id()).status());
    }

    @Test
    @DisplayName("a correction while the agent proposes drops the proposal")
    void correctionWhileProposing() {
        Classification corrected = Classification.of(DestinationType.STREAM, ConsumerType.HUMAN,
                ExecutionSemantics.INTERPRET, true);
        when(agent.propose(any(AtomicOperation.class))).thenAnswer(invocation -> {
            store.updateClassification(op.id(), corrected);
            return ProposedAction.writeFile("notes.txt", "hello");
        });

        Map<String, Object> update = node.apply(new OperationState(Map.of("operationId", op.id())));

        assertEquals(OperationStatus.CLASSIFIED.name(), update.get("status"));
        assertFalse(update.containsKey("action"));
        AtomicOperation stored = store.getOperation(op.id());
        assertEquals(OperationStatus.CLASSIFIED, stored.status());
        assertEquals(corrected, stored.classification());
    }
}
