package org.fielddispatch.engine.optimizer;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Wall-clock limit checked by search loops between iterations.
 */
public final class Deadline {

    private final Clock clock;
    private final Instant expiresAt;

    private Deadline(Clock clock, Instant expiresAt) {
        this.clock = clock;
        this.expiresAt = expiresAt;
    }

    public static Deadline after(Duration budget, Clock clock) {
        Objects.requireNonNull(budget, "budget must not be null");
        Objects.requireNonNull(clock, "clock must not be null");
        return new Deadline(clock, clock.instant().plus(budget));
    }

    public boolean isExpired() {
        return !clock.instant().isBefore(expiresAt);
    }

    public Instant getExpiresAt() {
        return expiresAt;
    }
}
