package com.switchboard.core.feedback;

import com.switchboard.core.model.ConsumerType;
import com.switchboard.core.model.DestinationType;
import com.switchboard.core.model.ExecutionSemantics;
import com.switchboard.core.model.FeedbackType;

/**
 * What a user submits about an operation's classification. Any corrected axis
 * may be left null to keep the system's value.
 */
public record FeedbackRequest(
        String userId,
        FeedbackType feedbackType,
        DestinationType correctedDestination,
        ConsumerType correctedConsumer,
        ExecutionSemantics correctedSemantics,
        String reasoning
) {

    public static FeedbackRequest confirmation(String userId) {
        return new FeedbackRequest(userId, FeedbackType.CONFIRMATION, null, null, null, null);
    }

    public static FeedbackRequest correction(String userId, DestinationType destination, ConsumerType consumer,
                                             ExecutionSemantics semantics, String reasoning) {
        return new FeedbackRequest(userId, FeedbackType.CORRECTION, destination, consumer, semantics, reasoning);
    }
}
