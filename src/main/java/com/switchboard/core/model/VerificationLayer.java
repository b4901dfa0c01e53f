package com.switchboard.core.model;

/**
 * Verification stages in execution order.
 */
public enum VerificationLayer {
    SYNTAX,
    SEMANTIC,
    BEHAVIORAL,
    SAFETY,
    INTENT
}
