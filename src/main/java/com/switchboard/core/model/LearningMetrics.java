package com.switchboard.core.model;

import java.io.Serializable;
import java.util.Map;

/**
 * Aggregate view over stored feedback.
 *
 * @param userId                 null for all users
 * @param classificationAccuracy confirmations / (confirmations + corrections), 0 when no feedback
 * @param correctionRate         share of classified operations that were corrected at least once, 0 when none
 */
public record LearningMetrics(
        String userId,
        int operations,
        int corrections,
        int confirmations,
        double classificationAccuracy,
        double correctionRate,
        Map<String, Long> correctedDestinations,
        Map<String, Long> correctedConsumers,
        Map<String, Long> correctedSemantics
) implements Serializable {

    public int feedbackCount() {
        return corrections + confirmations;
    }
}
