package com.switchboard.core.nodes;

import com.switchboard.core.classifier.RequestClassifier;
import com.switchboard.core.context.ClassificationContext;
import com.switchboard.core.events.EventBus;
import com.switchboard.core.events.OperationEventType;
import com.switchboard.core.events.SwitchboardEvent;
import com.switchboard.core.model.ClassificationResult;
import com.switchboard.core.model.OperationStatus;
import com.switchboard.core.state.OperationState;
import com.switchboard.core.store.OperationStore;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Map;

/**
 * Classifies the operation's request with past corrections as exemplars and
 * stores the classification on the operation.
 */
@Component
public class ClassifyOperationNode {

    private final RequestClassifier classifier;
    private final ClassificationContext context;
    private final OperationStore store;
    private final EventBus eventBus;
    private final Clock clock;

    public ClassifyOperationNode(RequestClassifier classifier, ClassificationContext context,
                                 OperationStore store, EventBus eventBus, Clock clock) {
        this.classifier = classifier;
        this.context = context;
        this.store = store;
        this.eventBus = eventBus;
        this.clock = clock;
    }

    public Map<String, Object> apply(OperationState state) {
        String operationId = state.operationId();
        ClassificationResult result = classifier.classify(
                state.request(), state.userId(), context.defaultLimit(), operationId);
        store.updateClassification(operationId, result.classification());
        eventBus.publish(new SwitchboardEvent(OperationEventType.CLASSIFIED, operationId,
                Map.of("classification", result.classification().key(),
                        "confident", result.confident(),
                        "source", "classifier"),
                clock.instant()));
        return Map.of(
                "classificationResult", result,
                "status", OperationStatus.CLASSIFIED.name());
    }
}
