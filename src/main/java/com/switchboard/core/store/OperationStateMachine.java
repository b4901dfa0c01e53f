package com.switchboard.core.store;

import com.switchboard.core.model.OperationStatus;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

import static com.switchboard.core.model.OperationStatus.*;

/**
 * Allowed {@link OperationStatus} transitions.
 * <p>
 * The forward path is CREATED, CLASSIFIED, ROUTED, VERIFYING and then APPROVED,
 * REJECTED or ESCALATED; ESCALATED resolves to APPROVED or REJECTED. A correction
 * sends any non-terminal operation back to CLASSIFIED. APPROVED and REJECTED are final.
 */
public final class OperationStateMachine {

    private static final Map<OperationStatus, Set<OperationStatus>> ALLOWED;

    static {
        var table = new EnumMap<OperationStatus, Set<OperationStatus>>(OperationStatus.class);
        table.put(CREATED, EnumSet.of(CLASSIFIED));
        table.put(CLASSIFIED, EnumSet.of(ROUTED, CLASSIFIED));
        table.put(ROUTED, EnumSet.of(VERIFYING, CLASSIFIED));
        table.put(VERIFYING, EnumSet.of(APPROVED, REJECTED, ESCALATED, CLASSIFIED));
        table.put(ESCALATED, EnumSet.of(APPROVED, REJECTED, CLASSIFIED));
        table.put(APPROVED, EnumSet.noneOf(OperationStatus.class));
        table.put(REJECTED, EnumSet.noneOf(OperationStatus.class));
        table.replaceAll((k, v) -> Collections.unmodifiableSet(v));
        ALLOWED = Collections.unmodifiableMap(table);
    }

    private OperationStateMachine() {}

    public static boolean canTransition(OperationStatus from, OperationStatus to) {
        return ALLOWED.get(from).contains(to);
    }

    public static Set<OperationStatus> allowedFrom(OperationStatus from) {
        return ALLOWED.get(from);
    }

    /**
     * @throws IllegalStateTransitionException when {@code from -> to} is not allowed
     */
    public static void requireTransition(String operationId, OperationStatus from, OperationStatus to) {
        if (!canTransition(from, to)) {
            throw new IllegalStateTransitionException(operationId, from, to);
        }
    }
}
