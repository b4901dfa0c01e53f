package com.switchboard.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * A request labelled by its user, for offline classifier evaluation or tuning.
 *
 * @param systemLabel        what the classifier said, null when the operation was corrected before classification
 * @param trueLabel          what the user confirmed or corrected it to
 * @param feedbackConfidence how far the label can be trusted: corrections rank above confirmations
 */
public record TrainingPair(
        String operationId,
        String request,
        Classification systemLabel,
        Classification trueLabel,
        FeedbackType source,
        double feedbackConfidence,
        Instant labelledAt
) implements Serializable {

    public static final double CORRECTION_CONFIDENCE = 0.95;
    public static final double CONFIRMATION_CONFIDENCE = 0.9;

    /** True when the user disagreed with the classifier on at least one axis. */
    public boolean disagrees() {
        return systemLabel == null || !systemLabel.key().equals(trueLabel.key());
    }
}
