package org.fielddispatch.engine.facade;

import org.fielddispatch.engine.api.NotificationPriority;
import org.fielddispatch.engine.domain.model.AssignmentCandidateScore;
import org.fielddispatch.engine.domain.model.AssignmentDecision;
import org.fielddispatch.engine.domain.model.Executor;
import org.fielddispatch.engine.domain.model.ServiceMode;
import org.fielddispatch.engine.domain.model.Ticket;
import org.fielddispatch.engine.domain.model.UnassignedReason;
import org.fielddispatch.engine.domain.service.DispatchService;
import org.fielddispatch.engine.geo.CoverageReport;
import org.fielddispatch.engine.geo.GeoService;
import org.fielddispatch.engine.geo.RoutePlan;
import org.fielddispatch.engine.optimizer.AlgorithmComparison;
import org.fielddispatch.engine.optimizer.BatchOptimizer;
import org.fielddispatch.engine.optimizer.BatchResult;
import org.fielddispatch.engine.optimizer.OptimizationAlgorithm;
import org.fielddispatch.engine.resilience.CircuitBreakerState;
import org.fielddispatch.engine.resilience.Dependency;
import org.fielddispatch.engine.resilience.Guarded;
import org.fielddispatch.engine.resilience.ResilienceLayer;
import org.fielddispatch.engine.resilience.ResilienceState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Single entry point of the engine. Orchestrates permission check, ticket
 * refresh, roster lookup, dispatch or batch optimization, commit and
 * notification. Per-ticket problems always come back as a decision; only
 * configuration errors are thrown.
 */
public final class AssignmentFacade {

    private static final Logger log = LoggerFactory.getLogger(AssignmentFacade.class);

    static final int HIGH_PRIORITY_URGENCY = 4;

    private final ResilienceLayer resilience;
    private final ResilienceState state;
    private final DispatchService dispatchService;
    private final BatchOptimizer optimizer;
    private final GeoService geoService;
    private final StatisticsCollector statistics = new StatisticsCollector();

    public AssignmentFacade(ResilienceLayer resilience, DispatchService dispatchService, BatchOptimizer optimizer,
                            GeoService geoService) {
        this.resilience = Objects.requireNonNull(resilience, "resilience must not be null");
        this.state = resilience.getState();
        this.dispatchService = Objects.requireNonNull(dispatchService, "dispatchService must not be null");
        this.optimizer = Objects.requireNonNull(optimizer, "optimizer must not be null");
        this.geoService = Objects.requireNonNull(geoService, "geoService must not be null");
    }

    /**
     * Assign one ticket on behalf of a user.
     *
     * @param ticket the ticket as known to the caller; refreshed from the store when possible
     * @param requestingUser user asking for the assignment, or null for system requests
     */
    public AssignmentDecision assignOne(Ticket ticket, String requestingUser) {
        Objects.requireNonNull(ticket, "ticket must not be null");
        long start = System.nanoTime();
        ServiceMode mode = state.currentMode();
        boolean fallback = false;

        if (requestingUser != null) {
            Guarded<Boolean> permission = resilience.canAssign(requestingUser, ticket.getId());
            fallback = permission.isFallbackUsed();
            if (!Boolean.TRUE.equals(permission.get())) {
                log.info("User {} may not assign ticket {}", requestingUser, ticket.getId());
                AssignmentDecision denied = AssignmentDecision.unassigned(ticket.getId(),
                                DispatchService.ALGORITHM_BASIC, UnassignedReason.PERMISSION_DENIED,
                                effectiveMode(mode, fallback))
                        .toBuilder()
                        .fallbackUsed(fallback)
                        .processingTime(elapsedSince(start))
                        .build();
                statistics.record(denied);
                return denied;
            }
        }

        Guarded<Ticket> refreshed = resilience.fetchTicket(ticket);
        fallback |= refreshed.isFallbackUsed();
        Ticket current = refreshed.get();

        Guarded<List<Executor>> roster = roster(mode);
        fallback |= roster.isFallbackUsed();

        ServiceMode effective = effectiveMode(mode, fallback);
        AssignmentDecision decision = dispatchService.assign(current, roster.get(), effective);

        boolean committed = false;
        if (decision.isAssigned()) {
            committed = commit(decision, effective);
            notifyExecutor(current, decision.getExecutorId());
        }

        AssignmentDecision result = decision.toBuilder()
                .fallbackUsed(fallback)
                .serviceMode(effective)
                .committed(committed)
                .processingTime(elapsedSince(start))
                .build();
        statistics.record(result);
        if (fallback) {
            log.warn("Ticket {} decided with fallback data in {} mode: {}", current.getId(), effective.value(), result);
        }
        return result;
    }

    /**
     * Assign a batch jointly.
     *
     * @param algorithm pinned algorithm, or null to let the engine choose
     */
    public BatchResult assignBatch(List<Ticket> tickets, OptimizationAlgorithm algorithm) {
        Objects.requireNonNull(tickets, "tickets must not be null");
        ServiceMode mode = state.currentMode();
        boolean fallback = false;

        List<Ticket> current = new ArrayList<>(tickets.size());
        for (Ticket ticket : tickets) {
            Guarded<Ticket> refreshed = resilience.fetchTicket(ticket);
            fallback |= refreshed.isFallbackUsed();
            current.add(refreshed.get());
        }

        Guarded<List<Executor>> roster = roster(mode);
        fallback |= roster.isFallbackUsed();
        ServiceMode effective = effectiveMode(mode, fallback);

        BatchResult raw = optimizer.optimize(current, roster.get(), algorithm, effective);
        Map<String, Ticket> byId = current.stream()
                .collect(Collectors.toMap(Ticket::getId, Function.identity(), (a, b) -> a));

        List<AssignmentDecision> decisions = new ArrayList<>(raw.getDecisions().size());
        for (AssignmentDecision decision : raw.getDecisions()) {
            boolean committed = false;
            if (decision.isAssigned()) {
                committed = commit(decision, effective);
                notifyExecutor(byId.get(decision.getTicketId()), decision.getExecutorId());
            }
            AssignmentDecision result = decision.toBuilder()
                    .fallbackUsed(fallback)
                    .serviceMode(effective)
                    .committed(committed)
                    .build();
            statistics.record(result);
            decisions.add(result);
        }
        return raw.withDecisions(decisions);
    }

    /**
     * Same as {@link #assignBatch(List, OptimizationAlgorithm)} with the
     * algorithm given by name.
     *
     * @throws org.fielddispatch.engine.exception.InvalidConfigurationException for an unknown name
     */
    public BatchResult assignBatch(List<Ticket> tickets, String algorithmName) {
        OptimizationAlgorithm algorithm = algorithmName == null || algorithmName.isBlank()
                ? null
                : OptimizationAlgorithm.fromName(algorithmName);
        return assignBatch(tickets, algorithm);
    }

    /**
     * Ranked candidates for a ticket without committing anything.
     */
    public List<AssignmentCandidateScore> recommend(Ticket ticket, int topN) {
        Objects.requireNonNull(ticket, "ticket must not be null");
        if (topN < 1) {
            throw new IllegalArgumentException("topN must be at least 1, got " + topN);
        }
        ServiceMode mode = state.currentMode();
        Guarded<List<Executor>> roster = roster(mode);
        List<AssignmentCandidateScore> ranked =
                dispatchService.rank(ticket, roster.get(), effectiveMode(mode, roster.isFallbackUsed()));
        return ranked.size() > topN ? new ArrayList<>(ranked.subList(0, topN)) : ranked;
    }

    /**
     * Run every algorithm on the same batch for comparison; commits nothing.
     */
    public AlgorithmComparison compareAlgorithms(List<Ticket> tickets) {
        Objects.requireNonNull(tickets, "tickets must not be null");
        ServiceMode mode = state.currentMode();
        Guarded<List<Executor>> roster = roster(mode);
        return optimizer.compare(tickets, roster.get(), effectiveMode(mode, roster.isFallbackUsed()));
    }

    /**
     * Ticket demand per zone against the current roster's home zones, with
     * zones that have demand but no executor within
     * {@value GeoService#DEFAULT_COVERAGE_RADIUS_KM} km listed as gaps.
     */
    public CoverageReport analyzeCoverage(List<Ticket> tickets) {
        Objects.requireNonNull(tickets, "tickets must not be null");
        Guarded<List<Executor>> roster = roster(state.currentMode());
        List<String> demand = tickets.stream().map(Ticket::getZone).collect(Collectors.toList());
        List<String> homes = roster.get().stream().map(Executor::getHomeZone).collect(Collectors.toList());
        return geoService.analyzeCoverage(demand, homes, GeoService.DEFAULT_COVERAGE_RADIUS_KM);
    }

    /**
     * Visiting order per executor for the assigned tickets, starting from
     * each executor's home zone.
     *
     * @return route plans keyed by executor id, in first-assignment order
     */
    public Map<String, RoutePlan> planRoutes(List<Ticket> tickets, List<AssignmentDecision> decisions,
                                             List<Executor> executors) {
        Map<String, Ticket> ticketsById = new HashMap<>();
        for (Ticket ticket : tickets) {
            ticketsById.put(ticket.getId(), ticket);
        }
        Map<String, Executor> executorsById = new HashMap<>();
        for (Executor executor : executors) {
            executorsById.put(executor.getId(), executor);
        }

        Map<String, List<String>> stops = new LinkedHashMap<>();
        for (AssignmentDecision decision : decisions) {
            Ticket ticket = ticketsById.get(decision.getTicketId());
            if (!decision.isAssigned() || ticket == null) {
                continue;
            }
            stops.computeIfAbsent(decision.getExecutorId(), id -> new ArrayList<>()).add(ticket.getZone());
        }

        Map<String, RoutePlan> plans = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> entry : stops.entrySet()) {
            Executor executor = executorsById.get(entry.getKey());
            String home = executor != null ? executor.getHomeZone() : null;
            plans.put(entry.getKey(), geoService.orderRoute(home, entry.getValue()));
        }
        return plans;
    }

    public ServiceMode getServiceMode() {
        return state.currentMode();
    }

    /**
     * Operator override; wins over breaker-derived mode until cleared.
     */
    public void setServiceMode(ServiceMode mode, String reason) {
        state.setOverride(mode, reason);
    }

    public void clearServiceModeOverride() {
        state.clearOverride();
    }

    /**
     * Reason given with the active operator override, if any.
     */
    public Optional<String> getServiceModeOverrideReason() {
        return state.getOverride().isPresent() ? state.getOverrideReason() : Optional.empty();
    }

    public Map<Dependency, CircuitBreakerState> getCircuitBreakerStatus() {
        return state.snapshotAll();
    }

    /**
     * @throws IllegalArgumentException for an unknown dependency name
     */
    public CircuitBreakerState resetCircuitBreaker(String name) {
        Dependency dependency = Dependency.fromValue(name);
        state.reset(dependency);
        return state.snapshot(dependency);
    }

    public AssignmentStatistics getStatistics() {
        return statistics.snapshot();
    }

    private Guarded<List<Executor>> roster(ServiceMode mode) {
        if (mode.usesLiveRoster()) {
            return resilience.listExecutors(null);
        }
        log.debug("Using fallback roster {} in {} mode", resilience.getFallbackRoster().getVersion(), mode.value());
        return Guarded.fallback(resilience.getFallbackRoster().executors());
    }

    private static ServiceMode effectiveMode(ServiceMode mode, boolean fallback) {
        return fallback ? mode.atLeast(ServiceMode.DEGRADED) : mode;
    }

    private boolean commit(AssignmentDecision decision, ServiceMode mode) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("algorithm", decision.getAlgorithm());
        metadata.put("score", decision.getScore());
        metadata.put("service_mode", mode.value());
        Guarded<Boolean> committed = resilience.commit(decision.getTicketId(), decision.getExecutorId(),
                Collections.unmodifiableMap(metadata));
        if (committed.isFallbackUsed()) {
            log.warn("Assignment of ticket {} to {} not committed", decision.getTicketId(), decision.getExecutorId());
        }
        return Boolean.TRUE.equals(committed.get());
    }

    private void notifyExecutor(Ticket ticket, String executorId) {
        if (ticket == null) {
            return;
        }
        NotificationPriority priority = ticket.getUrgency() >= HIGH_PRIORITY_URGENCY
                ? NotificationPriority.HIGH : NotificationPriority.NORMAL;
        String message = String.format("New %s ticket %s (urgency %d)%s", ticket.getCategory(), ticket.getId(),
                ticket.getUrgency(), ticket.getZone() != null ? " in " + ticket.getZone() : "");
        resilience.notifyAsync(executorId, message, priority);
    }

    private static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }
}
