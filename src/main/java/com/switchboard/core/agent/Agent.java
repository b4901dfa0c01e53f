package com.switchboard.core.agent;

import com.switchboard.core.model.AtomicOperation;
import com.switchboard.core.model.ProposedAction;

/**
 * Turns a routed operation into a proposed action. Agents never execute anything.
 */
public interface Agent {

    String id();

    ProposedAction propose(AtomicOperation operation);
}
