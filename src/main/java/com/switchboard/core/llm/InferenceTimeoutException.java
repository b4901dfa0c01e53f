package com.switchboard.core.llm;

import com.switchboard.core.error.ErrorKind;
import com.switchboard.core.error.SwitchboardException;

import java.time.Duration;
import java.util.Map;

/**
 * The inference service did not answer within the per-call timeout.
 */
public class InferenceTimeoutException extends SwitchboardException {

    private final Duration timeout;

    public InferenceTimeoutException(Duration timeout, Throwable cause) {
        super(ErrorKind.INFERENCE_TIMEOUT,
                "Inference call timed out after " + timeout.toMillis() + "ms",
                true, Map.of("timeoutMs", timeout.toMillis()), cause);
        this.timeout = timeout;
    }

    public Duration timeout() {
        return timeout;
    }
}
