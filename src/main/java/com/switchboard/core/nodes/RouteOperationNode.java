package com.switchboard.core.nodes;

import com.switchboard.core.events.EventBus;
import com.switchboard.core.events.OperationEventType;
import com.switchboard.core.events.SwitchboardEvent;
import com.switchboard.core.metrics.SwitchboardMetrics;
import com.switchboard.core.model.AgentRoute;
import com.switchboard.core.model.AtomicOperation;
import com.switchboard.core.model.OperationStatus;
import com.switchboard.core.routing.RequestRouter;
import com.switchboard.core.state.OperationState;
import com.switchboard.core.store.OperationStore;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Map;

/**
 * Routes on the operation's current classification, which already reflects
 * any correction that arrived after classification.
 */
@Component
public class RouteOperationNode {

    private final RequestRouter router;
    private final OperationStore store;
    private final SwitchboardMetrics metrics;
    private final EventBus eventBus;
    private final Clock clock;

    public RouteOperationNode(RequestRouter router, OperationStore store, SwitchboardMetrics metrics,
                              EventBus eventBus, Clock clock) {
        this.router = router;
        this.store = store;
        this.metrics = metrics;
        this.eventBus = eventBus;
        this.clock = clock;
    }

    public Map<String, Object> apply(OperationState state) {
        AtomicOperation operation = store.getOperation(state.operationId());
        AgentRoute route = router.route(operation.classification());
        store.assignAgent(operation.id(), route.agentId());
        metrics.recordRoute(route.agentId(), route.fallback());
        eventBus.publish(new SwitchboardEvent(OperationEventType.ROUTED, operation.id(),
                Map.of("agent", route.agentId(), "fallback", route.fallback()),
                clock.instant()));
        return Map.of(
                "route", route,
                "status", OperationStatus.ROUTED.name());
    }
}
