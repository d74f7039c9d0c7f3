package org.fielddispatch.engine.domain.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable compatibility score of one executor for one ticket.
 * Higher score = better candidate. Computed per request, never persisted.
 */
public final class AssignmentCandidateScore {

    private final String ticketId;
    private final String executorId;
    private final double score;
    private final Map<ScoringFactor, Double> breakdown;
    private final String reasoning;

    public AssignmentCandidateScore(String ticketId, String executorId, double score,
                                    Map<ScoringFactor, Double> breakdown, String reasoning) {
        this.ticketId = Objects.requireNonNull(ticketId, "ticketId must not be null");
        this.executorId = Objects.requireNonNull(executorId, "executorId must not be null");
        this.score = score;
        EnumMap<ScoringFactor, Double> copy = new EnumMap<>(ScoringFactor.class);
        copy.putAll(Objects.requireNonNull(breakdown, "breakdown must not be null"));
        this.breakdown = Collections.unmodifiableMap(copy);
        this.reasoning = reasoning != null ? reasoning : "";
    }

    public String getTicketId() {
        return ticketId;
    }

    public String getExecutorId() {
        return executorId;
    }

    public double getScore() {
        return score;
    }

    public Map<ScoringFactor, Double> getBreakdown() {
        return breakdown;
    }

    public double factor(ScoringFactor factor) {
        return breakdown.getOrDefault(factor, 0.0);
    }

    /**
     * Breakdown keyed by factor name, in declaration order.
     */
    public Map<String, Double> factorsByKey() {
        Map<String, Double> out = new LinkedHashMap<>();
        for (Map.Entry<ScoringFactor, Double> entry : breakdown.entrySet()) {
            out.put(entry.getKey().key(), entry.getValue());
        }
        return out;
    }

    public String getReasoning() {
        return reasoning;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AssignmentCandidateScore)) {
            return false;
        }
        AssignmentCandidateScore other = (AssignmentCandidateScore) o;
        return Double.compare(score, other.score) == 0
                && ticketId.equals(other.ticketId)
                && executorId.equals(other.executorId)
                && breakdown.equals(other.breakdown)
                && reasoning.equals(other.reasoning);
    }

    @Override
    public int hashCode() {
        return Objects.hash(ticketId, executorId, score, breakdown, reasoning);
    }

    @Override
    public String toString() {
        return String.format("AssignmentCandidateScore{ticket='%s', executor='%s', score=%.4f}",
                ticketId, executorId, score);
    }
}
