package org.fielddispatch.engine.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.fielddispatch.engine.resilience.CircuitBreakerState;

import java.time.Instant;
import java.util.Locale;

/**
 * DTO for one dependency's breaker as reported by GET /circuit-breakers.
 */
public final class CircuitBreakerDto {

    @JsonProperty("dependency")
    private final String dependency;

    @JsonProperty("status")
    private final String status;

    @JsonProperty("consecutive_failures")
    private final int consecutiveFailures;

    @JsonProperty("failure_threshold")
    private final int failureThreshold;

    @JsonProperty("cool_down_seconds")
    private final long coolDownSeconds;

    @JsonProperty("last_failure_at")
    private final Instant lastFailureAt;

    @JsonProperty("total_calls")
    private final long totalCalls;

    @JsonProperty("failed_calls")
    private final long failedCalls;

    @JsonProperty("rejected_calls")
    private final long rejectedCalls;

    private CircuitBreakerDto(CircuitBreakerState state) {
        this.dependency = state.getDependency().value();
        this.status = state.getStatus().name().toLowerCase(Locale.ROOT);
        this.consecutiveFailures = state.getConsecutiveFailures();
        this.failureThreshold = state.getFailureThreshold();
        this.coolDownSeconds = state.getCoolDown().getSeconds();
        this.lastFailureAt = state.getLastFailureAt();
        this.totalCalls = state.getTotalCalls();
        this.failedCalls = state.getFailedCalls();
        this.rejectedCalls = state.getRejectedCalls();
    }

    public static CircuitBreakerDto from(CircuitBreakerState state) {
        return new CircuitBreakerDto(state);
    }

    public String getDependency() {
        return dependency;
    }

    public String getStatus() {
        return status;
    }

    public int getConsecutiveFailures() {
        return consecutiveFailures;
    }

    public int getFailureThreshold() {
        return failureThreshold;
    }

    public long getCoolDownSeconds() {
        return coolDownSeconds;
    }

    public Instant getLastFailureAt() {
        return lastFailureAt;
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
}
