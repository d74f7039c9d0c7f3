package org.fielddispatch.engine.resilience;

import org.fielddispatch.engine.domain.model.Executor;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Static executor table used whenever the live roster is not trusted or
 * cannot be reached. Bump {@link #VERSION} whenever the entries change.
 */
public final class FallbackRoster {

    public static final String VERSION = "2024.1";

    private static final List<Executor> EXECUTORS = Collections.unmodifiableList(Arrays.asList(
            Executor.builder()
                    .id("fallback-1")
                    .name("Standby plumber")
                    .skills("plumbing")
                    .homeZone("chilanzar")
                    .efficiencyRating(75)
                    .workloadCapacity(5)
                    .build(),
            Executor.builder()
                    .id("fallback-2")
                    .name("Standby electrician")
                    .skills("electrical")
                    .homeZone("yunusabad")
                    .efficiencyRating(75)
                    .workloadCapacity(5)
                    .build(),
            Executor.builder()
                    .id("fallback-3")
                    .name("Standby handyman")
                    .skills("general", "carpentry")
                    .homeZone("mirzo-ulugbek")
                    .efficiencyRating(70)
                    .workloadCapacity(5)
                    .build()));

    private final String version;
    private final List<Executor> executors;

    public FallbackRoster() {
        this(VERSION, EXECUTORS);
    }

    /**
     * Custom table, e.g. for tests or a site-specific standby list.
     */
    public FallbackRoster(String version, List<Executor> executors) {
        this.version = version;
        this.executors = Collections.unmodifiableList(List.copyOf(executors));
    }

    public String getVersion() {
        return version;
    }

    public List<Executor> executors() {
        return executors;
    }
}
