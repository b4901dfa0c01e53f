package com.switchboard.core.routing;

import com.switchboard.core.error.ErrorKind;
import com.switchboard.core.error.SwitchboardException;

/**
 * No agent can be resolved for a classification.
 */
public class RoutingException extends SwitchboardException {

    public RoutingException(String message) {
        super(ErrorKind.ROUTING, message, false);
    }
}
