package com.switchboard.core.verification;

import com.switchboard.core.model.StageResult;
import com.switchboard.core.model.VerificationContext;
import com.switchboard.core.model.VerificationLayer;

/**
 * One verification stage. Implementations only read the context.
 */
public interface Verifier {

    VerificationLayer layer();

    /** A failing fatal stage stops the pipeline in every mode. */
    default boolean fatal() {
        return false;
    }

    /**
     * @throws VerifierInfrastructureException when a dependency of the stage failed
     */
    StageResult verify(VerificationContext context);
}
