package com.switchboard.core.error;

/**
 * Why a core call failed. Callers branch on the kind, never on the message.
 */
public enum ErrorKind {
    INFERENCE_TIMEOUT,
    INFERENCE_FAILURE,
    CLASSIFICATION_PARSE,
    ROUTING,
    AGENT_FAILURE,
    VERIFIER_INFRASTRUCTURE,
    NOT_FOUND,
    RATE_LIMIT_EXCEEDED,
    ILLEGAL_STATE,
    STORAGE,
    UNKNOWN_METHOD
}
