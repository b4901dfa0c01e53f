package com.switchboard.dispatch.method;

import com.switchboard.core.error.ErrorKind;
import com.switchboard.core.error.SwitchboardException;

import java.util.Map;

public class UnknownMethodException extends SwitchboardException {

    private final String method;

    public UnknownMethodException(String method) {
        super(ErrorKind.UNKNOWN_METHOD, "Unknown method: " + method, false,
                Map.of("method", String.valueOf(method)), null);
        this.method = method;
    }

    public String method() {
        return method;
    }
}
