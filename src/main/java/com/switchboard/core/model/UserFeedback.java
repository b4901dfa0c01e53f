package com.switchboard.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * Append-only record of a user's verdict on a classification.
 * <p>
 * For corrections all three corrected axes are populated: axes the user left
 * out are copied from {@code systemClassification} before the record is stored.
 * For confirmations the corrected axes are null.
 *
 * @param systemClassification the operation's classification when the feedback was given, may be null
 */
public record UserFeedback(
        String id,
        String operationId,
        String userId,
        FeedbackType feedbackType,
        Classification systemClassification,
        DestinationType correctedDestination,
        ConsumerType correctedConsumer,
        ExecutionSemantics correctedSemantics,
        String correctionReasoning,
        Instant createdAt
) implements Serializable {

    public boolean isCorrection() {
        return feedbackType == FeedbackType.CORRECTION;
    }

    /** The classification the user asserted, or null for confirmations. */
    public Classification correctedClassification() {
        if (!isCorrection()) {
            return null;
        }
        return new Classification(correctedDestination, correctedConsumer, correctedSemantics,
                true, correctionReasoning);
    }
}
