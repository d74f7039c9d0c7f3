package org.fielddispatch.engine.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.fielddispatch.engine.optimizer.AlgorithmComparison;
import org.fielddispatch.engine.optimizer.OptimizationAlgorithm;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Response of POST /compare.
 */
public final class ComparisonDto {

    @JsonProperty("best")
    private final String best;

    @JsonProperty("results")
    private final List<Result> results;

    @JsonProperty("zone_clusters")
    private final Map<String, List<String>> zoneClusters;

    private ComparisonDto(String best, List<Result> results, Map<String, List<String>> zoneClusters) {
        this.best = best;
        this.results = results;
        this.zoneClusters = zoneClusters;
    }

    public static ComparisonDto from(AlgorithmComparison comparison) {
        List<Result> results = new ArrayList<>();
        for (AlgorithmComparison.Entry entry : comparison.getEntries().values()) {
            results.add(new Result(entry));
        }
        String best = comparison.best().map(OptimizationAlgorithm::value).orElse(null);
        return new ComparisonDto(best, results, comparison.getZoneClusters());
    }

    public String getBest() {
        return best;
    }

    public List<Result> getResults() {
        return results;
    }

    public Map<String, List<String>> getZoneClusters() {
        return zoneClusters;
    }

    /**
     * Outcome of one algorithm on the compared batch.
     */
    public static final class Result {

        @JsonProperty("algorithm")
        private final String algorithm;

        @JsonProperty("fitness")
        private final double fitness;

        @JsonProperty("assigned")
        private final long assigned;

        @JsonProperty("duration_ms")
        private final long durationMillis;

        @JsonProperty("budget_exhausted")
        private final boolean budgetExhausted;

        Result(AlgorithmComparison.Entry entry) {
            this.algorithm = entry.getAlgorithm().value();
            this.fitness = entry.getFitness();
            this.assigned = entry.getAssignedCount();
            this.durationMillis = entry.getDuration().toMillis();
            this.budgetExhausted = entry.isBudgetExhausted();
        }

        public String getAlgorithm() {
            return algorithm;
        }

        public double getFitness() {
            return fitness;
        }

        public long getAssigned() {
            return assigned;
        }

        public long getDurationMillis() {
            return durationMillis;
        }

        public boolean isBudgetExhausted() {
            return budgetExhausted;
        }
    }
}
