package org.fielddispatch.engine.optimizer;

import org.fielddispatch.engine.domain.model.AssignmentDecision;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one batch optimization: one decision per input ticket, in
 * input order.
 */
public final class BatchResult {

    private final List<AssignmentDecision> decisions;
    private final OptimizationAlgorithm algorithm;
    private final double fitness;
    private final boolean budgetExhausted;
    private final Duration duration;
    private final Map<String, List<String>> zoneClusters;

    public BatchResult(List<AssignmentDecision> decisions, OptimizationAlgorithm algorithm, double fitness,
                       boolean budgetExhausted, Duration duration, Map<String, List<String>> zoneClusters) {
        this.decisions = Collections.unmodifiableList(List.copyOf(decisions));
        this.algorithm = algorithm;
        this.fitness = fitness;
        this.budgetExhausted = budgetExhausted;
        this.duration = duration;
        this.zoneClusters = Collections.unmodifiableMap(new LinkedHashMap<>(zoneClusters));
    }

    /**
     * Same result with the decisions replaced, e.g. after commit.
     */
    public BatchResult withDecisions(List<AssignmentDecision> replaced) {
        return new BatchResult(replaced, algorithm, fitness, budgetExhausted, duration, zoneClusters);
    }

    public List<AssignmentDecision> getDecisions() {
        return decisions;
    }

    public OptimizationAlgorithm getAlgorithm() {
        return algorithm;
    }

    public double getFitness() {
        return fitness;
    }

    public boolean isBudgetExhausted() {
        return budgetExhausted;
    }

    public Duration getDuration() {
        return duration;
    }

    /**
     * Ticket ids of the batch grouped by zone, largest group first.
     */
    public Map<String, List<String>> getZoneClusters() {
        return zoneClusters;
    }

    public long assignedCount() {
        return decisions.stream().filter(AssignmentDecision::isAssigned).count();
    }

    @Override
    public String toString() {
        return String.format("BatchResult{algorithm=%s, assigned=%d/%d, fitness=%.4f, zones=%d, exhausted=%s}",
                algorithm.value(), assignedCount(), decisions.size(), fitness, zoneClusters.size(), budgetExhausted);
    }
}
