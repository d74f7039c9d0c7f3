package org.fielddispatch.engine.resilience;

import java.time.Duration;
import java.time.Instant;

/**
 * Point-in-time view of one dependency's breaker.
 */
public final class CircuitBreakerState {

    private final Dependency dependency;
    private final BreakerStatus status;
    private final int consecutiveFailures;
    private final Instant lastFailureAt;
    private final int failureThreshold;
    private final Duration coolDown;
    private final long totalCalls;
    private final long failedCalls;
    private final long rejectedCalls;

    CircuitBreakerState(Dependency dependency, BreakerStatus status, int consecutiveFailures, Instant lastFailureAt,
                        BreakerSettings settings, long totalCalls, long failedCalls, long rejectedCalls) {
        this.dependency = dependency;
        this.status = status;
        this.consecutiveFailures = consecutiveFailures;
        this.lastFailureAt = lastFailureAt;
        this.failureThreshold = settings.getFailureThreshold();
        this.coolDown = settings.getCoolDown();
        this.totalCalls = totalCalls;
        this.failedCalls = failedCalls;
        this.rejectedCalls = rejectedCalls;
    }

    public Dependency getDependency() {
        return dependency;
    }

    public BreakerStatus getStatus() {
        return status;
    }

    public int getConsecutiveFailures() {
        return consecutiveFailures;
    }

    /**
     * Time of the most recent failure, or null if none since the last reset.
     */
    public Instant getLastFailureAt() {
        return lastFailureAt;
    }

    public int getFailureThreshold() {
        return failureThreshold;
    }

    public Duration getCoolDown() {
        return coolDown;
    }

    public long getTotalCalls() {
        return totalCalls;
    }

    public long getFailedCalls() {
        return failedCalls;
    }

    public long getRejectedCalls() {
        return rejectedCalls;
    }

    @Override
    public String toString() {
        return String.format("CircuitBreakerState{%s %s, failures=%d/%d, calls=%d, failed=%d, rejected=%d}",
                dependency.value(), status, consecutiveFailures, failureThreshold, totalCalls, failedCalls,
                rejectedCalls);
    }
}
