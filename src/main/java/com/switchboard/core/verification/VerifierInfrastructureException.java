package com.switchboard.core.verification;

import com.switchboard.core.error.ErrorKind;
import com.switchboard.core.error.SwitchboardException;
import com.switchboard.core.model.VerificationLayer;

import java.util.Map;

/**
 * A verifier could not reach a verdict because something it depends on failed.
 * The pipeline records the stage as skipped rather than failed.
 */
public class VerifierInfrastructureException extends SwitchboardException {

    private final VerificationLayer layer;

    public VerifierInfrastructureException(VerificationLayer layer, String message, Throwable cause) {
        super(ErrorKind.VERIFIER_INFRASTRUCTURE, message, true, Map.of("layer", layer.name()), cause);
        this.layer = layer;
    }

    public VerificationLayer layer() {
        return layer;
    }
}
