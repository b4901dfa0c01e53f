package com.switchboard.core.nodes;

import com.switchboard.core.events.EventBus;
import com.switchboard.core.events.OperationEventType;
import com.switchboard.core.events.SwitchboardEvent;
import com.switchboard.core.model.AtomicOperation;
import com.switchboard.core.model.OperationStatus;
import com.switchboard.core.model.PipelineResult;
import com.switchboard.core.model.ProposedAction;
import com.switchboard.core.model.VerificationContext;
import com.switchboard.core.state.OperationState;
import com.switchboard.core.store.IllegalStateTransitionException;
import com.switchboard.core.store.OperationStore;
import com.switchboard.core.verification.EnvironmentInspector;
import com.switchboard.core.verification.VerificationPipeline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Verifies the proposed action and settles the operation.
 * <p>
 * A Safety failure rejects outright. Anything that went through the fallback
 * route is escalated even when approved, since a person has to confirm it.
 * Otherwise approval approves and any other rejection is escalated.
 */
@Component
public class VerifyActionNode {

    private static final Logger log = LoggerFactory.getLogger(VerifyActionNode.class);

    private final VerificationPipeline pipeline;
    private final EnvironmentInspector inspector;
    private final OperationStore store;
    private final EventBus eventBus;
    private final Clock clock;

    public VerifyActionNode(VerificationPipeline pipeline, EnvironmentInspector inspector, OperationStore store,
                            EventBus eventBus, Clock clock) {
        this.pipeline = pipeline;
        this.inspector = inspector;
        this.store = store;
        this.eventBus = eventBus;
        this.clock = clock;
    }

    public Map<String, Object> apply(OperationState state) {
        AtomicOperation operation = store.getOperation(state.operationId());
        ProposedAction action = state.action().orElse(null);
        var context = new VerificationContext(operation, action, inspector.inspect(operation, action));
        PipelineResult result = pipeline.run(context, state.mode());

        boolean fallback = state.route().map(r -> r.fallback()).orElse(false);
        OperationStatus outcome = settle(result, fallback);
        try {
            store.transition(operation.id(), outcome);
        } catch (IllegalStateTransitionException e) {
            log.info("Operation {} changed to {} during verification; verdict {} not applied",
                    operation.id(), e.from(), result.verdict());
            outcome = e.from();
        }

        var payload = new LinkedHashMap<String, Object>();
        payload.put("verdict", result.verdict().name());
        payload.put("mode", result.mode().name());
        payload.put("status", outcome.name());
        if (result.haltedBy() != null) {
            payload.put("haltedBy", result.haltedBy().name());
        }
        eventBus.publish(new SwitchboardEvent(OperationEventType.VERIFICATION_COMPLETED, operation.id(), payload, clock.instant()));
        if (outcome == OperationStatus.ESCALATED) {
            eventBus.publish(new SwitchboardEvent(OperationEventType.ESCALATED, operation.id(),
                    Map.of("reason", fallback ? "fallback route" : "verification rejected"), clock.instant()));
        }
        return Map.of(
                "pipelineResult", result,
                "status", outcome.name());
    }

    static OperationStatus settle(PipelineResult result, boolean fallback) {
        if (result.hardRejection()) {
            return OperationStatus.REJECTED;
        }
        if (fallback) {
            return OperationStatus.ESCALATED;
        }
        return result.approved() ? OperationStatus.APPROVED : OperationStatus.ESCALATED;
    }
}
