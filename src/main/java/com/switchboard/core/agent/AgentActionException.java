package com.switchboard.core.agent;

import com.switchboard.core.error.ErrorKind;
import com.switchboard.core.error.SwitchboardException;

import java.util.Map;

/**
 * An agent could not produce a proposed action.
 */
public class AgentActionException extends SwitchboardException {

    public AgentActionException(String agentId, String message, Throwable cause) {
        super(ErrorKind.AGENT_FAILURE, message, true, Map.of("agentId", agentId), cause);
    }
}
