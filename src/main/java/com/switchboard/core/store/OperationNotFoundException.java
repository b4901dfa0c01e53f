package com.switchboard.core.store;

import com.switchboard.core.error.ErrorKind;
import com.switchboard.core.error.SwitchboardException;

import java.util.Map;

public class OperationNotFoundException extends SwitchboardException {

    private final String operationId;

    public OperationNotFoundException(String operationId) {
        super(ErrorKind.NOT_FOUND, "Operation not found: " + operationId, false,
                Map.of("operationId", String.valueOf(operationId)), null);
        this.operationId = operationId;
    }

    public String operationId() {
        return operationId;
    }
}
