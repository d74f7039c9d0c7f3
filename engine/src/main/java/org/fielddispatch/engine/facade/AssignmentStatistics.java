package org.fielddispatch.engine.facade;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Snapshot of decision counters since the engine started.
 */
public final class AssignmentStatistics {

    private final long totalDecisions;
    private final long assigned;
    private final long unassigned;
    private final long fallbackDecisions;
    private final long committed;
    private final Map<String, Long> algorithmUsage;
    private final Map<String, Long> unassignedReasons;
    private final double averageScore;
    private final double averageProcessingMillis;

    AssignmentStatistics(long totalDecisions, long assigned, long unassigned, long fallbackDecisions, long committed,
                         Map<String, Long> algorithmUsage, Map<String, Long> unassignedReasons,
                         double averageScore, double averageProcessingMillis) {
        this.totalDecisions = totalDecisions;
        this.assigned = assigned;
        this.unassigned = unassigned;
        this.fallbackDecisions = fallbackDecisions;
        this.committed = committed;
        this.algorithmUsage = Collections.unmodifiableMap(new TreeMap<>(algorithmUsage));
        this.unassignedReasons = Collections.unmodifiableMap(new TreeMap<>(unassignedReasons));
        this.averageScore = averageScore;
        this.averageProcessingMillis = averageProcessingMillis;
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

    /**
     * Decisions per algorithm name ({@code basic}, {@code hybrid}, ...).
     */
    public Map<String, Long> getAlgorithmUsage() {
        return algorithmUsage;
    }

    public Map<String, Long> getUnassignedReasons() {
        return unassignedReasons;
    }

    /**
     * Mean score over assigned decisions; 0 when there are none.
     */
    public double getAverageScore() {
        return averageScore;
    }

    public double getAverageProcessingMillis() {
        return averageProcessingMillis;
    }

    @Override
    public String toString() {
        return String.format("AssignmentStatistics{total=%d, assigned=%d, unassigned=%d, fallback=%d, avgScore=%.3f}",
                totalDecisions, assigned, unassigned, fallbackDecisions, averageScore);
    }
}
