package com.switchboard.core.feedback;

import com.switchboard.core.events.EventBus;
import com.switchboard.core.events.OperationEventType;
import com.switchboard.core.events.SwitchboardEvent;
import com.switchboard.core.metrics.SwitchboardMetrics;
import com.switchboard.core.model.AtomicOperation;
import com.switchboard.core.model.Classification;
import com.switchboard.core.model.ConsumerType;
import com.switchboard.core.model.DestinationType;
import com.switchboard.core.model.ExecutionSemantics;
import com.switchboard.core.model.FeedbackType;
import com.switchboard.core.model.UserFeedback;
import com.switchboard.core.store.OperationStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Ingests user feedback and closes the learning loop.
 * <p>
 * Every accepted feedback is stored, so it is visible to the classification
 * context even if the operation cannot change anymore. A correction on a
 * non-terminal operation is stored together with the reclassification back to
 * CLASSIFIED; on an approved or rejected operation it is kept for learning
 * only. Confirmations never change the operation.
 */
@Service
public class FeedbackLoop {

    private static final Logger log = LoggerFactory.getLogger(FeedbackLoop.class);

    private final OperationStore store;
    private final EventBus eventBus;
    private final SwitchboardMetrics metrics;
    private final Clock clock;

    public FeedbackLoop(OperationStore store, EventBus eventBus, SwitchboardMetrics metrics, Clock clock) {
        this.store = store;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * @throws com.switchboard.core.store.OperationNotFoundException when the operation does not exist
     * @throws IllegalArgumentException when a correction leaves an axis unknown
     */
    public UserFeedback recordFeedback(String operationId, FeedbackRequest request) {
        Objects.requireNonNull(request, "feedback");
        Objects.requireNonNull(request.feedbackType(), "feedbackType");
        AtomicOperation operation = store.getOperation(operationId);
        Classification system = operation.classification();

        UserFeedback feedback;
        AtomicOperation after = null;
        if (request.feedbackType() == FeedbackType.CORRECTION) {
            feedback = correction(operation, system, request);
            after = store.applyCorrection(feedback);
        } else {
            feedback = store.appendFeedback(confirmation(operation, system, request));
        }
        metrics.recordFeedback(feedback.feedbackType().name());
        log.info("Recorded {} for operation {}", feedback.feedbackType().value(), operationId);

        if (after != null) {
            announceCorrection(after, feedback);
        }
        publish(feedback);
        return feedback;
    }

    private UserFeedback correction(AtomicOperation operation, Classification system, FeedbackRequest request) {
        DestinationType destination = request.correctedDestination() != null
                ? request.correctedDestination() : system != null ? system.destination() : null;
        ConsumerType consumer = request.correctedConsumer() != null
                ? request.correctedConsumer() : system != null ? system.consumer() : null;
        ExecutionSemantics semantics = request.correctedSemantics() != null
                ? request.correctedSemantics() : system != null ? system.semantics() : null;
        if (destination == null || consumer == null || semantics == null) {
            throw new IllegalArgumentException(
                    "Operation " + operation.id() + " is unclassified; a correction must give all three axes");
        }
        return new UserFeedback(UUID.randomUUID().toString(), operation.id(), request.userId(),
                FeedbackType.CORRECTION, system, destination, consumer, semantics, request.reasoning(),
                clock.instant().truncatedTo(ChronoUnit.MILLIS));
    }

    private UserFeedback confirmation(AtomicOperation operation, Classification system, FeedbackRequest request) {
        return new UserFeedback(UUID.randomUUID().toString(), operation.id(), request.userId(),
                FeedbackType.CONFIRMATION, system, null, null, null, request.reasoning(),
                clock.instant().truncatedTo(ChronoUnit.MILLIS));
    }

    private void announceCorrection(AtomicOperation after, UserFeedback feedback) {
        if (after.status().isTerminal()) {
            log.info("Operation {} is {}; correction kept for learning only", after.id(), after.status());
            return;
        }
        eventBus.publish(new SwitchboardEvent(OperationEventType.CLASSIFIED, after.id(),
                Map.of("classification", feedback.correctedClassification().key(), "source", "correction"),
                clock.instant()));
    }

    private void publish(UserFeedback feedback) {
        var payload = new LinkedHashMap<String, Object>();
        payload.put("feedbackType", feedback.feedbackType().value());
        if (feedback.isCorrection()) {
            payload.put("corrected", feedback.correctedClassification().key());
        }
        eventBus.publish(new SwitchboardEvent(OperationEventType.FEEDBACK_RECORDED, feedback.operationId(), payload, clock.instant()));
    }
}
