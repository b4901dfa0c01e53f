package com.switchboard.core.ratelimit;

/**
 * Admission check consumed before any inference call. Policy lives outside the core.
 */
@FunctionalInterface
public interface RateLimiter {

    /**
     * @param userId the caller, may be null for anonymous use
     * @param action category being rate limited, e.g. "classify"
     * @throws RateLimitExceededException when the call must be refused
     */
    void acquire(String userId, String action);
}
