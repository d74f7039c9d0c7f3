package org.fielddispatch.engine.resilience;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import org.fielddispatch.engine.domain.model.ServiceMode;
import org.fielddispatch.engine.domain.service.RoundRobinCursor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Process-wide resilience state: one breaker per dependency, the operator's
 * mode override and the emergency round-robin cursor. Create one per engine
 * and pass it to whoever needs it; tests create their own.
 *
 * A breaker opens after exactly {@code failureThreshold} consecutive
 * failures and lets one trial call through once the cool-down has elapsed.
 */
public final class ResilienceState implements RoundRobinCursor {

    private static final Logger log = LoggerFactory.getLogger(ResilienceState.class);

    private final CircuitBreakerRegistry registry;
    private final Map<Dependency, CircuitBreaker> breakers = new EnumMap<>(Dependency.class);
    private final Map<Dependency, BreakerSettings> settings = new EnumMap<>(Dependency.class);
    private final Map<Dependency, Counters> counters = new EnumMap<>(Dependency.class);
    private final Clock clock;
    private final AtomicInteger roundRobin = new AtomicInteger();

    private volatile ServiceMode overrideMode;
    private volatile String overrideReason;

    public ResilienceState(Map<Dependency, BreakerSettings> breakerSettings, Clock clock) {
        Objects.requireNonNull(breakerSettings, "breakerSettings must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.registry = CircuitBreakerRegistry.ofDefaults();

        for (Dependency dependency : Dependency.values()) {
            BreakerSettings s = breakerSettings.getOrDefault(dependency, BreakerSettings.defaults());
            settings.put(dependency, s);
            counters.put(dependency, new Counters());
            CircuitBreaker breaker = registry.circuitBreaker(dependency.value(), breakerConfig(s));
            registerEvents(dependency, breaker);
            breakers.put(dependency, breaker);
        }
    }

    public static ResilienceState withDefaults(Clock clock) {
        return new ResilienceState(Collections.emptyMap(), clock);
    }

    static CircuitBreakerConfig breakerConfig(BreakerSettings s) {
        return CircuitBreakerConfig.custom()
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(s.getFailureThreshold())
                .minimumNumberOfCalls(s.getFailureThreshold())
                .failureRateThreshold(100.0f)
                .waitDurationInOpenState(s.getCoolDown())
                .permittedNumberOfCallsInHalfOpenState(1)
                .automaticTransitionFromOpenToHalfOpenEnabled(false)
                .build();
    }

    private void registerEvents(Dependency dependency, CircuitBreaker breaker) {
        Counters c = counters.get(dependency);
        breaker.getEventPublisher()
                .onSuccess(event -> {
                    synchronized (c) {
                        c.totalCalls++;
                        c.consecutiveFailures = 0;
                    }
                })
                .onError(event -> {
                    synchronized (c) {
                        c.totalCalls++;
                        c.failedCalls++;
                        c.consecutiveFailures++;
                        c.lastFailureAt = clock.instant();
                    }
                    log.warn("{} call failed ({} consecutive): {}", dependency.value(),
                            consecutiveFailures(dependency), event.getThrowable().toString());
                })
                .onCallNotPermitted(event -> {
                    synchronized (c) {
                        c.rejectedCalls++;
                    }
                })
                .onStateTransition(event -> log.info("Circuit breaker {} {} -> {}", dependency.value(),
                        event.getStateTransition().getFromState(), event.getStateTransition().getToState()));
    }

    CircuitBreaker circuitBreaker(Dependency dependency) {
        return breakers.get(dependency);
    }

    public CircuitBreakerRegistry getRegistry() {
        return registry;
    }

    public BreakerSettings settings(Dependency dependency) {
        return settings.get(dependency);
    }

    public BreakerStatus status(Dependency dependency) {
        return BreakerStatus.from(breakers.get(dependency).getState());
    }

    private int consecutiveFailures(Dependency dependency) {
        Counters c = counters.get(dependency);
        synchronized (c) {
            return c.consecutiveFailures;
        }
    }

    public CircuitBreakerState snapshot(Dependency dependency) {
        Counters c = counters.get(dependency);
        synchronized (c) {
            return new CircuitBreakerState(dependency, status(dependency), c.consecutiveFailures, c.lastFailureAt,
                    settings.get(dependency), c.totalCalls, c.failedCalls, c.rejectedCalls);
        }
    }

    public Map<Dependency, CircuitBreakerState> snapshotAll() {
        Map<Dependency, CircuitBreakerState> out = new EnumMap<>(Dependency.class);
        for (Dependency dependency : Dependency.values()) {
            out.put(dependency, snapshot(dependency));
        }
        return Collections.unmodifiableMap(out);
    }

    /**
     * Operator action: reject all calls to a dependency until reset.
     */
    public void forceOpen(Dependency dependency) {
        log.warn("Forcing circuit breaker {} open", dependency.value());
        breakers.get(dependency).transitionToForcedOpenState();
    }

    /**
     * Close the breaker and clear its failure history.
     */
    public void reset(Dependency dependency) {
        Counters c = counters.get(dependency);
        synchronized (c) {
            breakers.get(dependency).reset();
            c.consecutiveFailures = 0;
            c.lastFailureAt = null;
        }
        log.info("Circuit breaker {} reset", dependency.value());
    }

    public void resetAll() {
        for (Dependency dependency : Dependency.values()) {
            reset(dependency);
        }
    }

    public Set<Dependency> openDependencies() {
        Set<Dependency> open = EnumSet.noneOf(Dependency.class);
        for (Dependency dependency : Dependency.values()) {
            if (status(dependency) == BreakerStatus.OPEN) {
                open.add(dependency);
            }
        }
        return open;
    }

    /**
     * Mode implied by the open breakers alone. Notification never degrades
     * the service.
     */
    public ServiceMode derivedMode() {
        Set<Dependency> open = openDependencies();
        boolean tickets = open.contains(Dependency.TICKET_DATA);
        boolean roster = open.contains(Dependency.EXECUTOR_ROSTER);
        boolean permissions = open.contains(Dependency.PERMISSION_CHECK);
        if (tickets && roster && permissions) {
            return ServiceMode.EMERGENCY;
        }
        if (tickets && roster) {
            return ServiceMode.MINIMAL;
        }
        if (tickets || roster || permissions) {
            return ServiceMode.DEGRADED;
        }
        return ServiceMode.FULL;
    }

    /**
     * The operator override if one is set, otherwise the derived mode.
     */
    public ServiceMode currentMode() {
        ServiceMode override = overrideMode;
        return override != null ? override : derivedMode();
    }

    public void setOverride(ServiceMode mode, String reason) {
        Objects.requireNonNull(mode, "mode must not be null");
        this.overrideReason = reason;
        this.overrideMode = mode;
        log.warn("Service mode overridden to {} ({})", mode.value(), reason != null ? reason : "no reason given");
    }

    public void clearOverride() {
        if (overrideMode != null) {
            log.info("Service mode override {} cleared", overrideMode.value());
        }
        this.overrideMode = null;
        this.overrideReason = null;
    }

    public Optional<ServiceMode> getOverride() {
        return Optional.ofNullable(overrideMode);
    }

    public Optional<String> getOverrideReason() {
        return Optional.ofNullable(overrideReason);
    }

    @Override
    public int next(int size) {
        if (size <= 0) {
            throw new IllegalArgumentException("size must be positive");
        }
        return Math.floorMod(roundRobin.getAndIncrement(), size);
    }

    private static final class Counters {
        int consecutiveFailures;
        Instant lastFailureAt;
        long totalCalls;
        long failedCalls;
        long rejectedCalls;
    }
}
