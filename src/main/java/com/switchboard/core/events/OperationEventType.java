package com.switchboard.core.events;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Points in an operation's lifecycle that are announced on the {@link EventBus}.
 * {@link #RESOLVED} and {@link #FEEDBACK_RECORDED} may arrive after the run itself ended.
 */
public enum OperationEventType {
    CREATED("operation.created"),
    RESUMED("operation.resumed"),
    CLASSIFIED("operation.classified"),
    ROUTED("operation.routed"),
    VERIFICATION_COMPLETED("verification.completed"),
    ESCALATED("operation.escalated"),
    RESOLVED("operation.resolved"),
    FEEDBACK_RECORDED("feedback.recorded");

    private final String value;

    OperationEventType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /** True for events that start a run of the pipeline. */
    public boolean startsRun() {
        return this == CREATED || this == RESUMED;
    }

    @JsonCreator
    public static OperationEventType fromValue(String raw) {
        if (raw == null) {
            throw new IllegalArgumentException("OperationEventType must not be null");
        }
        for (OperationEventType type : values()) {
            if (type.value.equals(raw.trim())) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown operation event type: " + raw);
    }
}
