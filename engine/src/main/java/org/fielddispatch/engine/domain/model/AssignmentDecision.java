package org.fielddispatch.engine.domain.model;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable, self-describing outcome of assigning one ticket.
 * Persisting it is the caller's job.
 */
public final class AssignmentDecision {

    public static final String UNASSIGNED = "unassigned";

    private final String ticketId;
    private final String executorId;
    private final UnassignedReason unassignedReason;
    private final String algorithm;
    private final double score;
    private final Map<ScoringFactor, Double> factors;
    private final Duration processingTime;
    private final boolean fallbackUsed;
    private final boolean budgetExhausted;
    private final ServiceMode serviceMode;
    private final List<String> alternativeExecutorIds;
    private final String reasoning;
    private final boolean committed;

    private AssignmentDecision(Builder builder) {
        this.ticketId = Objects.requireNonNull(builder.ticketId, "ticketId must not be null");
        this.algorithm = Objects.requireNonNull(builder.algorithm, "algorithm must not be null");
        if (builder.executorId == null || UNASSIGNED.equals(builder.executorId)) {
            this.executorId = UNASSIGNED;
            this.unassignedReason = Objects.requireNonNull(builder.unassignedReason,
                    "unassigned decisions need a reason");
        } else {
            this.executorId = builder.executorId;
            this.unassignedReason = null;
        }
        this.score = builder.score;
        EnumMap<ScoringFactor, Double> copy = new EnumMap<>(ScoringFactor.class);
        copy.putAll(builder.factors);
        this.factors = Collections.unmodifiableMap(copy);
        this.processingTime = builder.processingTime != null ? builder.processingTime : Duration.ZERO;
        this.fallbackUsed = builder.fallbackUsed;
        this.budgetExhausted = builder.budgetExhausted;
        this.serviceMode = builder.serviceMode != null ? builder.serviceMode : ServiceMode.FULL;
        this.alternativeExecutorIds = Collections.unmodifiableList(List.copyOf(builder.alternativeExecutorIds));
        this.reasoning = builder.reasoning != null ? builder.reasoning : "";
        this.committed = builder.committed;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Decision for a ticket that could not be placed.
     */
    public static AssignmentDecision unassigned(String ticketId, String algorithm, UnassignedReason reason,
                                                ServiceMode mode) {
        return builder()
                .ticketId(ticketId)
                .algorithm(algorithm)
                .unassigned(reason)
                .serviceMode(mode)
                .build();
    }

    public String getTicketId() {
        return ticketId;
    }

    /**
     * Chosen executor id, or {@link #UNASSIGNED}.
     */
    public String getExecutorId() {
        return executorId;
    }

    public boolean isAssigned() {
        return unassignedReason == null;
    }

    /**
     * Reason code such as {@code no_capacity}; null when assigned.
     */
    public String getReason() {
        return unassignedReason != null ? unassignedReason.value() : null;
    }

    public UnassignedReason getUnassignedReason() {
        return unassignedReason;
    }

    public String getAlgorithm() {
        return algorithm;
    }

    public double getScore() {
        return score;
    }

    public Map<ScoringFactor, Double> getFactors() {
        return factors;
    }

    public Duration getProcessingTime() {
        return processingTime;
    }

    public boolean isFallbackUsed() {
        return fallbackUsed;
    }

    public boolean isBudgetExhausted() {
        return budgetExhausted;
    }

    public ServiceMode getServiceMode() {
        return serviceMode;
    }

    public List<String> getAlternativeExecutorIds() {
        return alternativeExecutorIds;
    }

    public String getReasoning() {
        return reasoning;
    }

    /**
     * Whether the ticket store accepted this assignment.
     */
    public boolean isCommitted() {
        return committed;
    }

    public Builder toBuilder() {
        Builder builder = new Builder()
                .ticketId(ticketId)
                .algorithm(algorithm)
                .score(score)
                .factors(factors)
                .processingTime(processingTime)
                .fallbackUsed(fallbackUsed)
                .budgetExhausted(budgetExhausted)
                .serviceMode(serviceMode)
                .alternativeExecutorIds(alternativeExecutorIds)
                .reasoning(reasoning)
                .committed(committed);
        if (isAssigned()) {
            builder.executorId(executorId);
        } else {
            builder.unassigned(unassignedReason);
        }
        return builder;
    }

    @Override
    public String toString() {
        if (!isAssigned()) {
            return String.format("AssignmentDecision{ticket='%s', unassigned, reason=%s, algorithm=%s, fallback=%s}",
                    ticketId, getReason(), algorithm, fallbackUsed);
        }
        return String.format("AssignmentDecision{ticket='%s', executor='%s', score=%.4f, algorithm=%s, fallback=%s}",
                ticketId, executorId, score, algorithm, fallbackUsed);
    }

    /**
     * Builder for AssignmentDecision.
     */
    public static final class Builder {
        private String ticketId;
        private String executorId;
        private UnassignedReason unassignedReason;
        private String algorithm;
        private double score;
        private Map<ScoringFactor, Double> factors = Collections.emptyMap();
        private Duration processingTime;
        private boolean fallbackUsed;
        private boolean budgetExhausted;
        private ServiceMode serviceMode;
        private List<String> alternativeExecutorIds = Collections.emptyList();
        private String reasoning;
        private boolean committed;

        public Builder ticketId(String ticketId) {
            this.ticketId = ticketId;
            return this;
        }

        public Builder executorId(String executorId) {
            this.executorId = executorId;
            this.unassignedReason = null;
            return this;
        }

        public Builder unassigned(UnassignedReason reason) {
            this.executorId = null;
            this.unassignedReason = reason;
            return this;
        }

        public Builder algorithm(String algorithm) {
            this.algorithm = algorithm;
            return this;
        }

        public Builder score(double score) {
            this.score = score;
            return this;
        }

        public Builder factors(Map<ScoringFactor, Double> factors) {
            this.factors = factors != null ? factors : Collections.emptyMap();
            return this;
        }

        /**
         * Copies score, factors and reasoning from a candidate score.
         */
        public Builder candidate(AssignmentCandidateScore candidate) {
            this.executorId = candidate.getExecutorId();
            this.unassignedReason = null;
            this.score = candidate.getScore();
            this.factors = candidate.getBreakdown();
            this.reasoning = candidate.getReasoning();
            return this;
        }

        public Builder processingTime(Duration processingTime) {
            this.processingTime = processingTime;
            return this;
        }

        public Builder fallbackUsed(boolean fallbackUsed) {
            this.fallbackUsed = fallbackUsed;
            return this;
        }

        public Builder budgetExhausted(boolean budgetExhausted) {
            this.budgetExhausted = budgetExhausted;
            return this;
        }

        public Builder serviceMode(ServiceMode serviceMode) {
            this.serviceMode = serviceMode;
            return this;
        }

        public Builder alternativeExecutorIds(List<String> alternativeExecutorIds) {
            this.alternativeExecutorIds = alternativeExecutorIds != null
                    ? alternativeExecutorIds : Collections.emptyList();
            return this;
        }

        public Builder reasoning(String reasoning) {
            this.reasoning = reasoning;
            return this;
        }

        public Builder committed(boolean committed) {
            this.committed = committed;
            return this;
        }

        public AssignmentDecision build() {
            return new AssignmentDecision(this);
        }
    }
}
