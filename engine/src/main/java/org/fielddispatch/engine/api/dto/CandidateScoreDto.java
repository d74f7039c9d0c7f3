package org.fielddispatch.engine.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.fielddispatch.engine.domain.model.AssignmentCandidateScore;

import java.util.Map;

/**
 * DTO for one ranked candidate returned by the recommend endpoint.
 */
public final class CandidateScoreDto {

    @JsonProperty("executor_id")
    private final String executorId;

    @JsonProperty("score")
    private final double score;

    @JsonProperty("factors")
    private final Map<String, Double> factors;

    @JsonProperty("reasoning")
    private final String reasoning;

    private CandidateScoreDto(String executorId, double score, Map<String, Double> factors, String reasoning) {
        this.executorId = executorId;
        this.score = score;
        this.factors = factors;
        this.reasoning = reasoning;
    }

    public static CandidateScoreDto from(AssignmentCandidateScore candidate) {
        return new CandidateScoreDto(candidate.getExecutorId(), candidate.getScore(),
                candidate.factorsByKey(), candidate.getReasoning());
    }

    public String getExecutorId() {
        return executorId;
    }

    public double getScore() {
        return score;
    }

    public Map<String, Double> getFactors() {
        return factors;
    }

    public String getReasoning() {
        return reasoning;
    }
}
