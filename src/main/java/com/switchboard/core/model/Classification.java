package com.switchboard.core.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * A point in the destination x consumer x semantics space plus the confidence gate.
 *
 * @param destination where the output goes
 * @param consumer    who reads the output
 * @param semantics   what the operation does
 * @param confident   false sends the request to the fallback route regardless of the axes
 * @param reasoning   optional model or user explanation
 */
public record Classification(
        DestinationType destination,
        ConsumerType consumer,
        ExecutionSemantics semantics,
        boolean confident,
        String reasoning
) implements Serializable {

    public Classification {
        Objects.requireNonNull(destination, "destination");
        Objects.requireNonNull(consumer, "consumer");
        Objects.requireNonNull(semantics, "semantics");
    }

    public static Classification of(DestinationType destination, ConsumerType consumer,
                                    ExecutionSemantics semantics, boolean confident) {
        return new Classification(destination, consumer, semantics, confident, null);
    }

    /**
     * Applies a user correction. Absent axes keep their current value and the
     * result is always confident.
     */
    public Classification withCorrection(DestinationType correctedDestination,
                                         ConsumerType correctedConsumer,
                                         ExecutionSemantics correctedSemantics,
                                         String correctionReasoning) {
        return new Classification(
                correctedDestination != null ? correctedDestination : destination,
                correctedConsumer != null ? correctedConsumer : consumer,
                correctedSemantics != null ? correctedSemantics : semantics,
                true,
                correctionReasoning);
    }

    /** Routing table key, e.g. {@code stream.human.interpret}. */
    public String key() {
        return key(destination, consumer, semantics);
    }

    public static String key(DestinationType destination, ConsumerType consumer, ExecutionSemantics semantics) {
        return destination.value() + "." + consumer.value() + "." + semantics.value();
    }
}
