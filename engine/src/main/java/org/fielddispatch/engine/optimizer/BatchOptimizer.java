package org.fielddispatch.engine.optimizer;

import org.fielddispatch.engine.domain.model.AssignmentDecision;
import org.fielddispatch.engine.domain.model.Executor;
import org.fielddispatch.engine.domain.model.ServiceMode;
import org.fielddispatch.engine.domain.model.Ticket;
import org.fielddispatch.engine.domain.model.UnassignedReason;
import org.fielddispatch.engine.domain.service.DispatchService;
import org.fielddispatch.engine.domain.service.RoundRobinCursor;
import org.fielddispatch.engine.domain.service.ScoringService;
import org.fielddispatch.engine.exception.InvalidConfigurationException;
import org.fielddispatch.engine.geo.GeoService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Random;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Assigns a batch of tickets jointly. Every algorithm's raw solution goes
 * through feasibility repair, so no executor ends a batch above capacity.
 * In emergency mode the batch rotates through available executors on the
 * same cursor single-ticket dispatch uses.
 */
public final class BatchOptimizer {

    private static final Logger log = LoggerFactory.getLogger(BatchOptimizer.class);

    public static final int DEFAULT_SMALL_BATCH_MAX = 3;
    public static final int DEFAULT_LARGE_BATCH_MIN = 20;
    public static final int DEFAULT_CRITICAL_URGENCY = 5;

    static final int MAX_ALTERNATIVES = 3;

    private static final Map<OptimizationAlgorithm, SearchStrategy> STRATEGIES;

    static {
        Map<OptimizationAlgorithm, SearchStrategy> strategies = new EnumMap<>(OptimizationAlgorithm.class);
        strategies.put(OptimizationAlgorithm.GREEDY, new GreedySearch());
        strategies.put(OptimizationAlgorithm.POPULATION, new PopulationSearch());
        strategies.put(OptimizationAlgorithm.ANNEALING, new AnnealingSearch());
        strategies.put(OptimizationAlgorithm.HYBRID, (problem, budget, deadline, random) ->
                AnnealingSearch.anneal(problem, GreedySearch.solve(problem),
                        budget.getHybridAnnealingIterations(), budget, deadline, random));
        STRATEGIES = Collections.unmodifiableMap(strategies);
    }

    private final ScoringService scoringService;
    private final GeoService geoService;
    private final RoundRobinCursor cursor;
    private final OptimizationBudget budget;
    private final Supplier<Random> randomSupplier;
    private final Clock clock;
    private final boolean optimizationEnabled;
    private final int smallBatchMax;
    private final int largeBatchMin;
    private final int criticalUrgency;

    public BatchOptimizer(ScoringService scoringService, GeoService geoService, RoundRobinCursor cursor,
                          OptimizationBudget budget, Supplier<Random> randomSupplier, Clock clock) {
        this(scoringService, geoService, cursor, budget, randomSupplier, clock, true,
                DEFAULT_SMALL_BATCH_MAX, DEFAULT_LARGE_BATCH_MIN, DEFAULT_CRITICAL_URGENCY);
    }

    public BatchOptimizer(ScoringService scoringService, GeoService geoService, RoundRobinCursor cursor,
                          OptimizationBudget budget, Supplier<Random> randomSupplier, Clock clock,
                          boolean optimizationEnabled, int smallBatchMax, int largeBatchMin, int criticalUrgency) {
        this.scoringService = Objects.requireNonNull(scoringService, "scoringService must not be null");
        this.geoService = Objects.requireNonNull(geoService, "geoService must not be null");
        this.cursor = Objects.requireNonNull(cursor, "cursor must not be null");
        this.budget = Objects.requireNonNull(budget, "budget must not be null");
        this.randomSupplier = Objects.requireNonNull(randomSupplier, "randomSupplier must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        if (smallBatchMax < 0 || largeBatchMin <= smallBatchMax) {
            throw new InvalidConfigurationException(String.format(
                    "Batch selection thresholds invalid: small<=%d, large>=%d", smallBatchMax, largeBatchMin));
        }
        if (criticalUrgency < Ticket.MIN_URGENCY || criticalUrgency > Ticket.MAX_URGENCY) {
            throw new InvalidConfigurationException("Critical urgency must be in 1..5, got " + criticalUrgency);
        }
        this.optimizationEnabled = optimizationEnabled;
        this.smallBatchMax = smallBatchMax;
        this.largeBatchMin = largeBatchMin;
        this.criticalUrgency = criticalUrgency;
    }

    public OptimizationBudget getBudget() {
        return budget;
    }

    /**
     * Pick an algorithm for a batch the caller did not pin.
     * Outside FULL mode, or with optimization disabled, always GREEDY.
     */
    public OptimizationAlgorithm selectAlgorithm(List<Ticket> tickets, ServiceMode mode) {
        if (!optimizationEnabled || !mode.allowsOptimization()) {
            return OptimizationAlgorithm.GREEDY;
        }
        if (tickets.size() <= smallBatchMax) {
            return OptimizationAlgorithm.GREEDY;
        }
        boolean critical = tickets.stream().anyMatch(t -> t.getUrgency() >= criticalUrgency);
        if (critical) {
            return OptimizationAlgorithm.HYBRID;
        }
        if (tickets.size() >= largeBatchMin) {
            return OptimizationAlgorithm.POPULATION;
        }
        return OptimizationAlgorithm.HYBRID;
    }

    /**
     * Optimize a batch.
     *
     * @param tickets tickets to place
     * @param executors executor snapshot
     * @param algorithm pinned algorithm, or null to select automatically
     * @param mode current service mode; anything but FULL forces GREEDY
     * @return decisions in ticket input order
     */
    public BatchResult optimize(List<Ticket> tickets, List<Executor> executors,
                                OptimizationAlgorithm algorithm, ServiceMode mode) {
        Objects.requireNonNull(tickets, "tickets must not be null");
        Objects.requireNonNull(executors, "executors must not be null");
        OptimizationAlgorithm effective = resolve(tickets, algorithm, mode);
        return run(tickets, executors, effective, mode, mode == ServiceMode.EMERGENCY, clusters(tickets));
    }

    /**
     * Run all four algorithms on the same input, ignoring mode restrictions on
     * algorithm choice. Never advances the emergency rotation.
     */
    public AlgorithmComparison compare(List<Ticket> tickets, List<Executor> executors, ServiceMode mode) {
        Map<String, List<String>> clusters = clusters(tickets);
        Map<OptimizationAlgorithm, AlgorithmComparison.Entry> entries = new EnumMap<>(OptimizationAlgorithm.class);
        for (OptimizationAlgorithm algorithm : OptimizationAlgorithm.values()) {
            BatchResult result = run(tickets, executors, algorithm, mode, false, clusters);
            entries.put(algorithm, AlgorithmComparison.Entry.of(result));
        }
        AlgorithmComparison comparison = new AlgorithmComparison(entries, clusters);
        log.info("Compared algorithms on {} tickets, best={}", tickets.size(),
                comparison.best().map(OptimizationAlgorithm::value).orElse("none"));
        return comparison;
    }

    private OptimizationAlgorithm resolve(List<Ticket> tickets, OptimizationAlgorithm requested, ServiceMode mode) {
        if (!optimizationEnabled || !mode.allowsOptimization()) {
            if (requested != null && requested != OptimizationAlgorithm.GREEDY) {
                log.info("Mode {} (optimization enabled={}) forces greedy instead of {}",
                        mode.value(), optimizationEnabled, requested.value());
            }
            return OptimizationAlgorithm.GREEDY;
        }
        return requested != null ? requested : selectAlgorithm(tickets, mode);
    }

    private Map<String, List<String>> clusters(List<Ticket> tickets) {
        Map<String, List<String>> ids = new LinkedHashMap<>();
        geoService.clusterByZone(tickets, Ticket::getZone).forEach((zone, members) ->
                ids.put(zone, members.stream().map(Ticket::getId).collect(Collectors.toList())));
        return ids;
    }

    private BatchResult run(List<Ticket> tickets, List<Executor> executors, OptimizationAlgorithm algorithm,
                            ServiceMode mode, boolean rotate, Map<String, List<String>> clusters) {
        long start = System.nanoTime();
        AssignmentProblem problem = AssignmentProblem.of(tickets, executors, scoringService, mode);
        Deadline deadline = Deadline.after(budget.getTimeBudget(), clock);

        SearchOutcome outcome = rotate
                ? new SearchOutcome(roundRobin(problem), false, problem.ticketCount())
                : STRATEGIES.get(algorithm).search(problem, budget, deadline, randomSupplier.get());
        int[] solution = FeasibilityRepair.repair(problem, outcome.getSolution());
        double fitness = problem.fitness(solution, budget.getCapacityPenalty());
        Duration duration = Duration.ofNanos(System.nanoTime() - start);

        if (outcome.isBudgetExhausted()) {
            log.warn("{} search hit its time budget of {} ms after {} iterations",
                    algorithm.value(), budget.getTimeBudget().toMillis(), outcome.getIterations());
        }

        String label = rotate ? DispatchService.ALGORITHM_ROUND_ROBIN : algorithm.value();
        List<AssignmentDecision> decisions = decide(problem, solution, label, mode,
                outcome.isBudgetExhausted(), duration);
        BatchResult result = new BatchResult(decisions, algorithm, fitness, outcome.isBudgetExhausted(), duration,
                clusters);
        log.info("Batch optimized: {}", result);
        return result;
    }

    /**
     * Emergency rotation: in urgency order, each ticket takes the next slot of
     * the shared cursor among executors that still have room, in id order.
     */
    private int[] roundRobin(AssignmentProblem problem) {
        int[] solution = problem.emptySolution();
        int[] used = new int[problem.executorCount()];
        for (int t : problem.urgencyOrder()) {
            int[] rotation = IntStream.of(problem.options(t))
                    .filter(e -> used[e] < problem.spareCapacity(e))
                    .toArray();
            if (rotation.length == 0) {
                continue;
            }
            int chosen = rotation[cursor.next(rotation.length)];
            solution[t] = chosen;
            used[chosen]++;
        }
        return solution;
    }

    // Replays placements in urgency order so each decision carries the score at the load it was placed under.
    private static List<AssignmentDecision> decide(AssignmentProblem problem, int[] solution, String algorithm,
                                                   ServiceMode mode, boolean exhausted, Duration duration) {
        AssignmentDecision[] decisions = new AssignmentDecision[problem.ticketCount()];
        int[] used = new int[problem.executorCount()];
        for (int t : problem.urgencyOrder()) {
            decisions[t] = toDecision(problem, t, solution[t], used, algorithm, mode, exhausted, duration);
            if (solution[t] != AssignmentProblem.UNASSIGNED) {
                used[solution[t]]++;
            }
        }
        return Arrays.asList(decisions);
    }

    private static AssignmentDecision toDecision(AssignmentProblem problem, int t, int e, int[] used,
                                                 String algorithm, ServiceMode mode,
                                                 boolean exhausted, Duration duration) {
        Ticket ticket = problem.ticket(t);
        if (e == AssignmentProblem.UNASSIGNED) {
            return AssignmentDecision.unassigned(ticket.getId(), algorithm, unassignedReason(problem, t), mode)
                    .toBuilder()
                    .budgetExhausted(exhausted)
                    .processingTime(duration)
                    .build();
        }
        AssignmentDecision.Builder builder = AssignmentDecision.builder()
                .ticketId(ticket.getId())
                .algorithm(algorithm)
                .candidate(problem.candidate(t, e, used[e]))
                .alternativeExecutorIds(alternatives(problem, t, e, used))
                .serviceMode(mode)
                .budgetExhausted(exhausted)
                .processingTime(duration);
        if (DispatchService.ALGORITHM_ROUND_ROBIN.equals(algorithm)) {
            builder.reasoning("emergency round-robin");
        }
        return builder.build();
    }

    private static UnassignedReason unassignedReason(AssignmentProblem problem, int t) {
        boolean anyCapacity = IntStream.range(0, problem.executorCount()).anyMatch(e -> problem.spareCapacity(e) > 0);
        if (!anyCapacity) {
            return UnassignedReason.NO_CAPACITY;
        }
        if (!problem.hasSkillMatch(t)) {
            return UnassignedReason.NO_SKILL_MATCH;
        }
        boolean eligibleWithRoom = IntStream.of(problem.options(t)).anyMatch(e -> problem.spareCapacity(e) > 0);
        return eligibleWithRoom ? UnassignedReason.CAPACITY_EXHAUSTED : UnassignedReason.NO_CAPACITY;
    }

    private static List<String> alternatives(AssignmentProblem problem, int t, int chosen, int[] used) {
        return IntStream.of(problem.options(t))
                .filter(e -> e != chosen && used[e] < problem.spareCapacity(e))
                .boxed()
                .sorted((a, b) -> Double.compare(problem.score(t, b, used[b]), problem.score(t, a, used[a])))
                .limit(MAX_ALTERNATIVES)
                .map(e -> problem.executor(e).getId())
                .collect(Collectors.toList());
    }
}
