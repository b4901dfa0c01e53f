package com.switchboard.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * An event emitted while an operation moves through the pipeline, used by the CLI watch output.
 *
 * @param type        lifecycle point this event announces
 * @param operationId the operation this event belongs to
 * @param payload     key-value data associated with the event
 * @param timestamp   when the event occurred
 */
public record SwitchboardEvent(
        OperationEventType type,
        String operationId,
        Map<String, Object> payload,
        Instant timestamp
) implements Serializable {

    public SwitchboardEvent {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(operationId, "operationId");
        payload = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }

    /** Wire name, e.g. "operation.classified". */
    public String eventType() {
        return type.value();
    }
}
