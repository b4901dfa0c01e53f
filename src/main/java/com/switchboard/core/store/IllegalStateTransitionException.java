package com.switchboard.core.store;

import com.switchboard.core.error.ErrorKind;
import com.switchboard.core.error.SwitchboardException;
import com.switchboard.core.model.OperationStatus;

import java.util.Map;

public class IllegalStateTransitionException extends SwitchboardException {

    private final OperationStatus from;
    private final OperationStatus to;

    public IllegalStateTransitionException(String operationId, OperationStatus from, OperationStatus to) {
        super(ErrorKind.ILLEGAL_STATE,
                "Operation " + operationId + " cannot move from " + from + " to " + to,
                false,
                Map.of("operationId", String.valueOf(operationId), "from", from.name(), "to", to.name()),
                null);
        this.from = from;
        this.to = to;
    }

    public OperationStatus from() {
        return from;
    }

    public OperationStatus to() {
        return to;
    }
}
