package com.switchboard.core.agent;

import com.switchboard.core.model.AtomicOperation;
import com.switchboard.core.model.ProposedAction;

/**
 * Fallback agent for requests the classifier was unsure about. It proposes
 * nothing but a clarification request so a person decides what happens next.
 */
public class HumanReviewAgent implements Agent {

    private final String id;

    public HumanReviewAgent(String id) {
        this.id = id;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public ProposedAction propose(AtomicOperation operation) {
        return ProposedAction.response(
                "This request needs a human decision before anything runs: \"" + operation.userRequest() + "\"");
    }
}
