package org.fielddispatch.engine.domain.model;

/**
 * Named contributions to an assignment score.
 */
public enum ScoringFactor {
    SKILL_MATCH("skill_match", true),
    EFFICIENCY("efficiency", true),
    WORKLOAD_BALANCE("workload_balance", true),
    AVAILABILITY("availability", true),
    GEO_PROXIMITY("geo_proximity", true),
    /** Reported for explanation only; never part of the weighted sum. */
    URGENCY_BONUS("urgency_bonus", false);

    private final String key;
    private final boolean weighted;

    ScoringFactor(String key, boolean weighted) {
        this.key = key;
        this.weighted = weighted;
    }

    public String key() {
        return key;
    }

    public boolean isWeighted() {
        return weighted;
    }

    public static ScoringFactor fromKey(String key) {
        for (ScoringFactor factor : values()) {
            if (factor.key.equals(key)) {
                return factor;
            }
        }
        throw new IllegalArgumentException("Unknown scoring factor: " + key);
    }
}
