package org.fielddispatch.engine.resilience;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;

/**
 * Breaker state as reported to callers.
 */
public enum BreakerStatus {
    CLOSED,
    OPEN,
    HALF_OPEN;

    /**
     * Forced-open counts as open; disabled and metrics-only breakers let calls through.
     */
    static BreakerStatus from(CircuitBreaker.State state) {
        switch (state) {
            case OPEN:
            case FORCED_OPEN:
                return OPEN;
            case HALF_OPEN:
                return HALF_OPEN;
            default:
                return CLOSED;
        }
    }
}
