package com.switchboard.core.model;

/**
 * STRICT halts at the first failing stage and needs every executed stage to pass.
 * LENIENT runs every stage and approves on weighted passes.
 */
public enum VerificationMode {
    STRICT,
    LENIENT
}
