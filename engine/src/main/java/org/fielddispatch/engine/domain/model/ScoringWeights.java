package org.fielddispatch.engine.domain.model;

import org.fielddispatch.engine.exception.InvalidConfigurationException;

import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable weights of the five scored factors.
 * Construction fails fast unless the weights are non-negative and sum to 1.0.
 */
public final class ScoringWeights {

    public static final double SUM_TOLERANCE = 1e-6;

    // Weight keys
    public static final String WEIGHT_SKILL_MATCH = "weight_skill_match";
    public static final String WEIGHT_EFFICIENCY = "weight_efficiency";
    public static final String WEIGHT_WORKLOAD_BALANCE = "weight_workload_balance";
    public static final String WEIGHT_AVAILABILITY = "weight_availability";
    public static final String WEIGHT_GEO_PROXIMITY = "weight_geo_proximity";

    private static final Map<String, ScoringFactor> KEYS;

    static {
        Map<String, ScoringFactor> keys = new HashMap<>();
        keys.put(WEIGHT_SKILL_MATCH, ScoringFactor.SKILL_MATCH);
        keys.put(WEIGHT_EFFICIENCY, ScoringFactor.EFFICIENCY);
        keys.put(WEIGHT_WORKLOAD_BALANCE, ScoringFactor.WORKLOAD_BALANCE);
        keys.put(WEIGHT_AVAILABILITY, ScoringFactor.AVAILABILITY);
        keys.put(WEIGHT_GEO_PROXIMITY, ScoringFactor.GEO_PROXIMITY);
        KEYS = Collections.unmodifiableMap(keys);
    }

    private final Map<ScoringFactor, Double> weights;

    private ScoringWeights(Map<ScoringFactor, Double> weights) {
        EnumMap<ScoringFactor, Double> copy = new EnumMap<>(ScoringFactor.class);
        double sum = 0.0;
        for (ScoringFactor factor : ScoringFactor.values()) {
            if (!factor.isWeighted()) {
                continue;
            }
            double weight = weights.getOrDefault(factor, 0.0);
            if (Double.isNaN(weight) || weight < 0.0) {
                throw new InvalidConfigurationException(
                        "Scoring weight for " + factor.key() + " must be a non-negative number, got " + weight);
            }
            copy.put(factor, weight);
            sum += weight;
        }
        if (Math.abs(sum - 1.0) > SUM_TOLERANCE) {
            throw new InvalidConfigurationException(
                    String.format("Scoring weights must sum to 1.0, got %.6f (%s)", sum, copy));
        }
        this.weights = Collections.unmodifiableMap(copy);
    }

    /**
     * Weights 0.40 / 0.30 / 0.20 / 0.10 for skill, efficiency, workload and
     * availability; proximity ignored.
     */
    public static ScoringWeights defaults() {
        return of(0.40, 0.30, 0.20, 0.10, 0.0);
    }

    /**
     * Preset for the geo-aware batch variant: proximity takes weight from
     * efficiency and workload.
     */
    public static ScoringWeights geoAware() {
        return of(0.35, 0.25, 0.15, 0.10, 0.15);
    }

    public static ScoringWeights of(double skillMatch, double efficiency, double workloadBalance,
                                    double availability, double geoProximity) {
        Map<ScoringFactor, Double> map = new EnumMap<>(ScoringFactor.class);
        map.put(ScoringFactor.SKILL_MATCH, skillMatch);
        map.put(ScoringFactor.EFFICIENCY, efficiency);
        map.put(ScoringFactor.WORKLOAD_BALANCE, workloadBalance);
        map.put(ScoringFactor.AVAILABILITY, availability);
        map.put(ScoringFactor.GEO_PROXIMITY, geoProximity);
        return new ScoringWeights(map);
    }

    /**
     * Creates weights from a map of configuration keys, e.g. {@code weight_skill_match}.
     * Missing keys count as zero.
     */
    public static ScoringWeights fromMap(Map<String, Double> values) {
        Objects.requireNonNull(values, "values must not be null");
        Map<ScoringFactor, Double> map = new EnumMap<>(ScoringFactor.class);
        for (Map.Entry<String, Double> entry : values.entrySet()) {
            ScoringFactor factor = KEYS.get(entry.getKey());
            if (factor == null) {
                throw new InvalidConfigurationException("Unknown scoring weight key: " + entry.getKey());
            }
            map.put(factor, entry.getValue());
        }
        return new ScoringWeights(map);
    }

    /**
     * Weight of a factor; zero for informational factors.
     */
    public double weightOf(ScoringFactor factor) {
        return weights.getOrDefault(factor, 0.0);
    }

    public Map<ScoringFactor, Double> asMap() {
        return weights;
    }

    public Map<String, Double> toKeyMap() {
        Map<String, Double> out = new HashMap<>();
        for (Map.Entry<String, ScoringFactor> entry : KEYS.entrySet()) {
            out.put(entry.getKey(), weightOf(entry.getValue()));
        }
        return out;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof ScoringWeights && weights.equals(((ScoringWeights) o).weights);
    }

    @Override
    public int hashCode() {
        return weights.hashCode();
    }

    @Override
    public String toString() {
        return "ScoringWeights" + weights;
    }
}
