package org.fielddispatch.engine.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.fielddispatch.engine.optimizer.BatchResult;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Response of POST /assign/batch.
 */
public final class BatchResponseDto {

    @JsonProperty("algorithm")
    private final String algorithm;

    @JsonProperty("fitness")
    private final double fitness;

    @JsonProperty("assigned")
    private final long assigned;

    @JsonProperty("budget_exhausted")
    private final boolean budgetExhausted;

    @JsonProperty("decisions")
    private final List<DecisionDto> decisions;

    @JsonProperty("zone_clusters")
    private final Map<String, List<String>> zoneClusters;

    private BatchResponseDto(String algorithm, double fitness, long assigned, boolean budgetExhausted,
                             List<DecisionDto> decisions, Map<String, List<String>> zoneClusters) {
        this.algorithm = algorithm;
        this.fitness = fitness;
        this.assigned = assigned;
        this.budgetExhausted = budgetExhausted;
        this.decisions = decisions;
        this.zoneClusters = zoneClusters;
    }

    public static BatchResponseDto from(BatchResult result) {
        return new BatchResponseDto(
                result.getAlgorithm().value(),
                result.getFitness(),
                result.assignedCount(),
                result.isBudgetExhausted(),
                result.getDecisions().stream().map(DecisionDto::from).collect(Collectors.toList()),
                result.getZoneClusters());
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

    public boolean isBudgetExhausted() {
        return budgetExhausted;
    }

    public List<DecisionDto> getDecisions() {
        return decisions;
    }

    public Map<String, List<String>> getZoneClusters() {
        return zoneClusters;
    }
}
