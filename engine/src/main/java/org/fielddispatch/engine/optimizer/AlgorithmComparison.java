package org.fielddispatch.engine.optimizer;

import java.time.Duration;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Side-by-side run of every algorithm on the same batch.
 */
public final class AlgorithmComparison {

    private final Map<OptimizationAlgorithm, Entry> entries;
    private final Map<String, List<String>> zoneClusters;

    public AlgorithmComparison(Map<OptimizationAlgorithm, Entry> entries, Map<String, List<String>> zoneClusters) {
        this.entries = Collections.unmodifiableMap(new EnumMap<>(entries));
        this.zoneClusters = Collections.unmodifiableMap(new LinkedHashMap<>(zoneClusters));
    }

    public Map<OptimizationAlgorithm, Entry> getEntries() {
        return entries;
    }

    public Entry get(OptimizationAlgorithm algorithm) {
        return entries.get(algorithm);
    }

    /**
     * Ticket ids of the compared batch grouped by zone, largest group first.
     */
    public Map<String, List<String>> getZoneClusters() {
        return zoneClusters;
    }

    /**
     * Highest fitness; ties go to the algorithm declared first.
     */
    public Optional<OptimizationAlgorithm> best() {
        return entries.values().stream()
                .max(Comparator.comparingDouble(Entry::getFitness)
                        .thenComparing(Entry::getAlgorithm, Comparator.reverseOrder()))
                .map(Entry::getAlgorithm);
    }

    /**
     * Result of one algorithm.
     */
    public static final class Entry {
        private final OptimizationAlgorithm algorithm;
        private final double fitness;
        private final long assignedCount;
        private final Duration duration;
        private final boolean budgetExhausted;

        public Entry(OptimizationAlgorithm algorithm, double fitness, long assignedCount, Duration duration,
                     boolean budgetExhausted) {
            this.algorithm = algorithm;
            this.fitness = fitness;
            this.assignedCount = assignedCount;
            this.duration = duration;
            this.budgetExhausted = budgetExhausted;
        }

        static Entry of(BatchResult result) {
            return new Entry(result.getAlgorithm(), result.getFitness(), result.assignedCount(),
                    result.getDuration(), result.isBudgetExhausted());
        }

        public OptimizationAlgorithm getAlgorithm() {
            return algorithm;
        }

        public double getFitness() {
            return fitness;
        }

        public long getAssignedCount() {
            return assignedCount;
        }

        public Duration getDuration() {
            return duration;
        }

        public boolean isBudgetExhausted() {
            return budgetExhausted;
        }
    }
}
