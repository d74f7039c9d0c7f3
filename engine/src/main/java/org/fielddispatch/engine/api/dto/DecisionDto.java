package org.fielddispatch.engine.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.fielddispatch.engine.domain.model.AssignmentDecision;
import org.fielddispatch.engine.domain.model.ScoringFactor;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Wire form of an assignment decision.
 */
public final class DecisionDto {

    @JsonProperty("ticket_id")
    private String ticketId;

    @JsonProperty("executor")
    private String executor;

    @JsonProperty("reason")
    private String reason;

    @JsonProperty("algorithm")
    private String algorithm;

    @JsonProperty("score")
    private double score;

    @JsonProperty("factors")
    private Map<String, Double> factors;

    @JsonProperty("processing_time_ms")
    private double processingTimeMs;

    @JsonProperty("fallback_used")
    private boolean fallbackUsed;

    @JsonProperty("budget_exhausted")
    private boolean budgetExhausted;

    @JsonProperty("service_mode")
    private String serviceMode;

    @JsonProperty("alternatives")
    private List<String> alternatives;

    @JsonProperty("reasoning")
    private String reasoning;

    @JsonProperty("committed")
    private boolean committed;

    public static DecisionDto from(AssignmentDecision decision) {
        DecisionDto dto = new DecisionDto();
        dto.ticketId = decision.getTicketId();
        dto.executor = decision.getExecutorId();
        dto.reason = decision.getReason();
        dto.algorithm = decision.getAlgorithm();
        dto.score = decision.getScore();
        Map<String, Double> factors = new LinkedHashMap<>();
        for (Map.Entry<ScoringFactor, Double> entry : decision.getFactors().entrySet()) {
            factors.put(entry.getKey().key(), entry.getValue());
        }
        dto.factors = factors;
        dto.processingTimeMs = decision.getProcessingTime().toNanos() / 1_000_000.0;
        dto.fallbackUsed = decision.isFallbackUsed();
        dto.budgetExhausted = decision.isBudgetExhausted();
        dto.serviceMode = decision.getServiceMode().value();
        dto.alternatives = decision.getAlternativeExecutorIds();
        dto.reasoning = decision.getReasoning();
        dto.committed = decision.isCommitted();
        return dto;
    }

    public String getTicketId() {
        return ticketId;
    }

    public String getExecutor() {
        return executor;
    }

    public String getReason() {
        return reason;
    }

    public String getAlgorithm() {
        return algorithm;
    }

    public double getScore() {
        return score;
    }

    public Map<String, Double> getFactors() {
        return factors;
    }

    public double getProcessingTimeMs() {
        return processingTimeMs;
    }

    public boolean isFallbackUsed() {
        return fallbackUsed;
    }

    public boolean isBudgetExhausted() {
        return budgetExhausted;
    }

    public String getServiceMode() {
        return serviceMode;
    }

    public List<String> getAlternatives() {
        return alternatives;
    }

    public String getReasoning() {
        return reasoning;
    }

    public boolean isCommitted() {
        return committed;
    }
}
