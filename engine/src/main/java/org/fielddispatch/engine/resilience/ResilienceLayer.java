package org.fielddispatch.engine.resilience;

import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import org.fielddispatch.engine.api.ExecutorRosterClient;
import org.fielddispatch.engine.api.NotificationClient;
import org.fielddispatch.engine.api.NotificationPriority;
import org.fielddispatch.engine.api.PermissionClient;
import org.fielddispatch.engine.api.TicketDataClient;
import org.fielddispatch.engine.domain.model.Executor;
import org.fielddispatch.engine.domain.model.Ticket;
import org.fielddispatch.engine.exception.InvalidConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Wraps every outbound call in a timeout and the dependency's circuit
 * breaker. Failures never reach the caller: they resolve to a fallback and
 * are reported through {@link Guarded#isFallbackUsed()}.
 */
public final class ResilienceLayer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ResilienceLayer.class);

    public static final Duration DEFAULT_CALL_TIMEOUT = Duration.ofSeconds(3);
    public static final int DEFAULT_POOL_SIZE = 8;
    private static final int QUEUE_CAPACITY = 256;

    private final ResilienceState state;
    private final TicketDataClient ticketClient;
    private final ExecutorRosterClient rosterClient;
    private final PermissionClient permissionClient;
    private final NotificationClient notificationClient;
    private final FallbackRoster fallbackRoster;
    private final boolean allowOnPermissionFailure;
    private final TimeLimiter timeLimiter;
    private final ExecutorService callPool;
    private final ExecutorService notifier;

    private ResilienceLayer(Builder builder) {
        this.state = Objects.requireNonNull(builder.state, "state must not be null");
        this.ticketClient = Objects.requireNonNull(builder.ticketClient, "ticketClient must not be null");
        this.rosterClient = Objects.requireNonNull(builder.rosterClient, "rosterClient must not be null");
        this.permissionClient = Objects.requireNonNull(builder.permissionClient, "permissionClient must not be null");
        this.notificationClient = Objects.requireNonNull(builder.notificationClient,
                "notificationClient must not be null");
        this.fallbackRoster = builder.fallbackRoster != null ? builder.fallbackRoster : new FallbackRoster();
        this.allowOnPermissionFailure = builder.allowOnPermissionFailure;
        if (builder.callTimeout == null || builder.callTimeout.isNegative() || builder.callTimeout.isZero()) {
            throw new InvalidConfigurationException("Call timeout must be positive, got " + builder.callTimeout);
        }
        if (builder.poolSize < 1) {
            throw new InvalidConfigurationException("Call pool size must be at least 1, got " + builder.poolSize);
        }
        this.timeLimiter = TimeLimiter.of(TimeLimiterConfig.custom()
                .timeoutDuration(builder.callTimeout)
                .cancelRunningFuture(true)
                .build());
        this.callPool = new ThreadPoolExecutor(builder.poolSize, builder.poolSize, 60L, TimeUnit.SECONDS,
                new ArrayBlockingQueue<>(QUEUE_CAPACITY), daemonThreads("dependency-call"));
        this.notifier = new ThreadPoolExecutor(1, 1, 60L, TimeUnit.SECONDS,
                new ArrayBlockingQueue<>(QUEUE_CAPACITY), daemonThreads("notifier"));
    }

    public static Builder builder() {
        return new Builder();
    }

    public ResilienceState getState() {
        return state;
    }

    public FallbackRoster getFallbackRoster() {
        return fallbackRoster;
    }

    /**
     * Call a dependency through its timeout and breaker.
     *
     * @param dependency which breaker guards the call
     * @param call the live call; may throw
     * @param fallback value source when the call cannot be used; must not throw
     */
    public <T> Guarded<T> call(Dependency dependency, Supplier<T> call, Supplier<T> fallback) {
        CircuitBreaker breaker = state.circuitBreaker(dependency);
        Callable<T> task = call::get;
        Callable<T> timed = TimeLimiter.decorateFutureSupplier(timeLimiter, () -> callPool.submit(task));
        Callable<T> guarded = CircuitBreaker.decorateCallable(breaker, timed);
        try {
            return Guarded.live(guarded.call());
        } catch (CallNotPermittedException e) {
            log.warn("{} breaker is {}, using fallback", dependency.value(), breaker.getState());
        } catch (TimeoutException e) {
            log.warn("{} call timed out after {} ms, using fallback", dependency.value(),
                    timeLimiter.getTimeLimiterConfig().getTimeoutDuration().toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("{} call interrupted, using fallback", dependency.value());
        } catch (Exception e) {
            log.warn("{} call failed, using fallback: {}", dependency.value(), e.toString());
        }
        return Guarded.fallback(fallback.get());
    }

    /**
     * Refresh a ticket from the store; the caller's copy is the fallback.
     */
    public Guarded<Ticket> fetchTicket(Ticket provided) {
        return call(Dependency.TICKET_DATA, () -> {
            Ticket fresh = ticketClient.getTicket(provided.getId());
            return fresh != null ? fresh : provided;
        }, () -> provided);
    }

    /**
     * Live roster, or the static fallback roster when the call fails.
     */
    public Guarded<List<Executor>> listExecutors(String skillFilter) {
        return call(Dependency.EXECUTOR_ROSTER,
                () -> rosterClient.listAvailableExecutors(skillFilter),
                fallbackRoster::executors);
    }

    /**
     * Permission check; falls back to the configured policy (allow by default).
     */
    public Guarded<Boolean> canAssign(String userId, String ticketId) {
        return call(Dependency.PERMISSION_CHECK,
                () -> permissionClient.canAssign(userId, ticketId),
                () -> allowOnPermissionFailure);
    }

    /**
     * Record an assignment in the ticket store. The fallback value is false:
     * the decision stands but is reported as not committed.
     */
    public Guarded<Boolean> commit(String ticketId, String executorId, Map<String, Object> metadata) {
        return call(Dependency.TICKET_DATA, () -> {
            ticketClient.updateTicketAssignment(ticketId, executorId, metadata);
            return Boolean.TRUE;
        }, () -> Boolean.FALSE);
    }

    /**
     * Fire-and-forget notification. The returned future completes with whether
     * the notification was delivered; it never completes exceptionally.
     */
    public CompletableFuture<Boolean> notifyAsync(String userId, String message, NotificationPriority priority) {
        try {
            return CompletableFuture.supplyAsync(() -> {
                Guarded<Boolean> sent = call(Dependency.NOTIFICATION, () -> {
                    notificationClient.notify(userId, message, priority);
                    return Boolean.TRUE;
                }, () -> Boolean.FALSE);
                if (sent.isFallbackUsed()) {
                    log.warn("Notification to {} not delivered", userId);
                }
                return sent.get();
            }, notifier);
        } catch (RuntimeException e) {
            log.warn("Notification to {} not queued: {}", userId, e.toString());
            return CompletableFuture.completedFuture(Boolean.FALSE);
        }
    }

    @Override
    public void close() {
        notifier.shutdown();
        callPool.shutdown();
        try {
            if (!notifier.awaitTermination(5, TimeUnit.SECONDS)) {
                notifier.shutdownNow();
            }
            if (!callPool.awaitTermination(5, TimeUnit.SECONDS)) {
                callPool.shutdownNow();
            }
        } catch (InterruptedException e) {
            notifier.shutdownNow();
            callPool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    /**
     * Builder for ResilienceLayer.
     */
    public static final class Builder {
        private ResilienceState state;
        private TicketDataClient ticketClient;
        private ExecutorRosterClient rosterClient;
        private PermissionClient permissionClient;
        private NotificationClient notificationClient;
        private FallbackRoster fallbackRoster;
        private boolean allowOnPermissionFailure = true;
        private Duration callTimeout = DEFAULT_CALL_TIMEOUT;
        private int poolSize = DEFAULT_POOL_SIZE;

        public Builder state(ResilienceState state) {
            this.state = state;
            return this;
        }

        public Builder ticketClient(TicketDataClient ticketClient) {
            this.ticketClient = ticketClient;
            return this;
        }

        public Builder rosterClient(ExecutorRosterClient rosterClient) {
            this.rosterClient = rosterClient;
            return this;
        }

        public Builder permissionClient(PermissionClient permissionClient) {
            this.permissionClient = permissionClient;
            return this;
        }

        public Builder notificationClient(NotificationClient notificationClient) {
            this.notificationClient = notificationClient;
            return this;
        }

        /**
         * Sets all four clients from one object implementing them all.
         */
        public <C extends TicketDataClient & ExecutorRosterClient & PermissionClient & NotificationClient>
        Builder clients(C client) {
            return ticketClient(client).rosterClient(client).permissionClient(client).notificationClient(client);
        }

        public Builder fallbackRoster(FallbackRoster fallbackRoster) {
            this.fallbackRoster = fallbackRoster;
            return this;
        }

        public Builder allowOnPermissionFailure(boolean allowOnPermissionFailure) {
            this.allowOnPermissionFailure = allowOnPermissionFailure;
            return this;
        }

        public Builder callTimeout(Duration callTimeout) {
            this.callTimeout = callTimeout;
            return this;
        }

        public Builder poolSize(int poolSize) {
            this.poolSize = poolSize;
            return this;
        }

        public ResilienceLayer build() {
            return new ResilienceLayer(this);
        }
    }
}
