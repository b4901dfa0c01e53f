package com.switchboard.core.llm;

import com.switchboard.core.error.ErrorKind;
import com.switchboard.core.error.SwitchboardException;

import java.util.Map;

/**
 * The inference backend failed or returned nothing usable.
 */
public class InferenceFailureException extends SwitchboardException {

    public InferenceFailureException(String message) {
        super(ErrorKind.INFERENCE_FAILURE, message, true);
    }

    public InferenceFailureException(String message, Throwable cause) {
        super(ErrorKind.INFERENCE_FAILURE, message, true, Map.of(), cause);
    }
}
