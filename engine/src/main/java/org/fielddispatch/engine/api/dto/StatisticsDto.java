package org.fielddispatch.engine.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.fielddispatch.engine.facade.AssignmentStatistics;

import java.util.Map;

/**
 * DTO for GET /stats.
 */
public final class StatisticsDto {

    @JsonProperty("total_decisions")
    private final long totalDecisions;

    @JsonProperty("assigned")
    private final long assigned;

    @JsonProperty("unassigned")
    private final long unassigned;

    @JsonProperty("fallback_decisions")
    private final long fallbackDecisions;

    @JsonProperty("committed")
    private final long committed;

    @JsonProperty("algorithm_usage")
    private final Map<String, Long> algorithmUsage;

    @JsonProperty("unassigned_reasons")
    private final Map<String, Long> unassignedReasons;

    @JsonProperty("average_score")
    private final double averageScore;

    @JsonProperty("average_processing_time_ms")
    private final double averageProcessingMillis;

    private StatisticsDto(AssignmentStatistics stats) {
        this.totalDecisions = stats.getTotalDecisions();
        this.assigned = stats.getAssigned();
        this.unassigned = stats.getUnassigned();
        this.fallbackDecisions = stats.getFallbackDecisions();
        this.committed = stats.getCommitted();
        this.algorithmUsage = stats.getAlgorithmUsage();
        this.unassignedReasons = stats.getUnassignedReasons();
        this.averageScore = stats.getAverageScore();
        this.averageProcessingMillis = stats.getAverageProcessingMillis();
    }

    public static StatisticsDto from(AssignmentStatistics stats) {
        return new StatisticsDto(stats);
    }

    public long getTotalDecisions() {
        return totalDecisions;
    }

    public long getAssigned() {
        return assigned;
    }

    public long getUnassigned() {
        return unassigned;
    }

    public long getFallbackDecisions() {
        return fallbackDecisions;
    }

    public long getCommitted() {
        return committed;
    }

    public Map<String, Long> getAlgorithmUsage() {
        return algorithmUsage;
    }

    public Map<String, Long> getUnassignedReasons() {
        return unassignedReasons;
    }

    public double getAverageScore() {
        return averageScore;
    }

    public double getAverageProcessingMillis() {
        return averageProcessingMillis;
    }
}
