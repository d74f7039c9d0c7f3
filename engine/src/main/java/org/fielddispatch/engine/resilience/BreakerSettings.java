package org.fielddispatch.engine.resilience;

import org.fielddispatch.engine.exception.InvalidConfigurationException;

import java.time.Duration;
import java.util.Objects;

/**
 * Failure threshold and cool-down of one breaker.
 */
public final class BreakerSettings {

    public static final int DEFAULT_FAILURE_THRESHOLD = 5;
    public static final Duration DEFAULT_COOL_DOWN = Duration.ofSeconds(60);

    private final int failureThreshold;
    private final Duration coolDown;

    public BreakerSettings(int failureThreshold, Duration coolDown) {
        Objects.requireNonNull(coolDown, "coolDown must not be null");
        if (failureThreshold < 1) {
            throw new InvalidConfigurationException("Breaker failure threshold must be at least 1, got "
                    + failureThreshold);
        }
        if (coolDown.isNegative() || coolDown.isZero()) {
            throw new InvalidConfigurationException("Breaker cool-down must be positive, got " + coolDown);
        }
        this.failureThreshold = failureThreshold;
        this.coolDown = coolDown;
    }

    public static BreakerSettings defaults() {
        return new BreakerSettings(DEFAULT_FAILURE_THRESHOLD, DEFAULT_COOL_DOWN);
    }

    public int getFailureThreshold() {
        return failureThreshold;
    }

    public Duration getCoolDown() {
        return coolDown;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof BreakerSettings)) {
            return false;
        }
        BreakerSettings other = (BreakerSettings) o;
        return failureThreshold == other.failureThreshold && coolDown.equals(other.coolDown);
    }

    @Override
    public int hashCode() {
        return Objects.hash(failureThreshold, coolDown);
    }

    @Override
    public String toString() {
        return String.format("BreakerSettings{threshold=%d, coolDown=%ds}", failureThreshold, coolDown.getSeconds());
    }
}
