package org.fielddispatch.engine.domain.model;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Process-wide degradation level. Declared from most to least capable,
 * so a higher ordinal never trusts more inputs than a lower one.
 */
public enum ServiceMode {
    /** All algorithms, live data. */
    FULL(EnumSet.of(ScoringFactor.SKILL_MATCH, ScoringFactor.EFFICIENCY, ScoringFactor.WORKLOAD_BALANCE,
            ScoringFactor.AVAILABILITY, ScoringFactor.GEO_PROXIMITY)),
    /** Basic dispatcher only, snapshot executor data. */
    DEGRADED(EnumSet.of(ScoringFactor.SKILL_MATCH, ScoringFactor.EFFICIENCY, ScoringFactor.WORKLOAD_BALANCE,
            ScoringFactor.AVAILABILITY, ScoringFactor.GEO_PROXIMITY)),
    /** Skill and availability scoring only. */
    MINIMAL(EnumSet.of(ScoringFactor.SKILL_MATCH, ScoringFactor.AVAILABILITY)),
    /** Round-robin over available executors, skills ignored. */
    EMERGENCY(EnumSet.of(ScoringFactor.AVAILABILITY));

    private final Set<ScoringFactor> activeFactors;

    ServiceMode(EnumSet<ScoringFactor> activeFactors) {
        this.activeFactors = Collections.unmodifiableSet(activeFactors);
    }

    /**
     * Weighted factors this mode takes into account.
     */
    public Set<ScoringFactor> activeFactors() {
        return activeFactors;
    }

    public boolean considers(ScoringFactor factor) {
        return activeFactors.contains(factor);
    }

    /**
     * Whether batch optimization beyond greedy dispatch is allowed.
     */
    public boolean allowsOptimization() {
        return this == FULL;
    }

    /**
     * Whether live roster data is trusted in this mode.
     */
    public boolean usesLiveRoster() {
        return this == FULL;
    }

    public boolean enforcesSkillMatch() {
        return this != EMERGENCY;
    }

    /**
     * Returns the less capable of the two modes.
     */
    public ServiceMode atLeast(ServiceMode other) {
        return other.ordinal() > ordinal() ? other : this;
    }

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ServiceMode fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("service mode must not be null");
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
