package com.switchboard.core.verification;

import com.switchboard.core.model.AtomicOperation;
import com.switchboard.core.model.EnvironmentFacts;
import com.switchboard.core.model.ProposedAction;

/**
 * Gathers the facts verifiers check an action against, for example by
 * running it in a sandbox. The default knows nothing.
 */
@FunctionalInterface
public interface EnvironmentInspector {

    EnvironmentFacts inspect(AtomicOperation operation, ProposedAction action);
}
