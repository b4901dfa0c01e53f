package com.switchboard.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * A past correction in the shape the classifier prompt consumes. Taxonomy
 * values are lower-case wire strings; the system axes are null when the
 * operation had not been classified before it was corrected.
 */
public record CorrectionExemplar(
        String request,
        String systemDestination,
        String systemConsumer,
        String systemSemantics,
        String correctedDestination,
        String correctedConsumer,
        String correctedSemantics,
        String reasoning,
        Instant createdAt
) implements Serializable {

    public static CorrectionExemplar from(String request, UserFeedback feedback) {
        Classification system = feedback.systemClassification();
        return new CorrectionExemplar(
                request,
                system != null ? system.destination().value() : null,
                system != null ? system.consumer().value() : null,
                system != null ? system.semantics().value() : null,
                feedback.correctedDestination().value(),
                feedback.correctedConsumer().value(),
                feedback.correctedSemantics().value(),
                feedback.correctionReasoning(),
                feedback.createdAt());
    }
}
