package org.fielddispatch.engine.domain.service;

import org.fielddispatch.engine.domain.model.AssignmentCandidateScore;
import org.fielddispatch.engine.domain.model.Executor;
import org.fielddispatch.engine.domain.model.ScoringFactor;
import org.fielddispatch.engine.domain.model.ScoringWeights;
import org.fielddispatch.engine.domain.model.ServiceMode;
import org.fielddispatch.engine.domain.model.Ticket;
import org.fielddispatch.engine.exception.InvalidConfigurationException;
import org.fielddispatch.engine.geo.GeoService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Implementation of ScoringService using multi-factor weighted scoring.
 *
 * Score formula (higher = better):
 *   score = w1 * skill_match          (1.0 exact, partial credit for generalists)
 *         + w2 * efficiency           (rating / 100)
 *         + w3 * workload_balance     (1 - load / capacity)
 *         + w4 * availability         (1 or 0)
 *         + w5 * geo_proximity        (from the geo module)
 *
 * urgency_bonus is reported alongside but carries no weight.
 */
public final class ScoringServiceImpl implements ScoringService {

    private static final Logger log = LoggerFactory.getLogger(ScoringServiceImpl.class);

    public static final double DEFAULT_PARTIAL_CREDIT = 0.5;
    public static final String DEFAULT_GENERALIST_TAG = "general";

    private final GeoService geoService;
    private final ScoringWeights weights;
    private final double partialCredit;
    private final Set<String> generalistTags;
    private final boolean geoEnabled;

    public ScoringServiceImpl(GeoService geoService, ScoringWeights weights) {
        this(geoService, weights, DEFAULT_PARTIAL_CREDIT, Collections.singleton(DEFAULT_GENERALIST_TAG), true);
    }

    public ScoringServiceImpl(GeoService geoService, ScoringWeights weights, double partialCredit,
                              Collection<String> generalistTags, boolean geoEnabled) {
        this.geoService = Objects.requireNonNull(geoService, "geoService must not be null");
        this.weights = Objects.requireNonNull(weights, "weights must not be null");
        if (Double.isNaN(partialCredit) || partialCredit < 0.0 || partialCredit > 1.0) {
            throw new InvalidConfigurationException("Partial skill credit must be in [0,1], got " + partialCredit);
        }
        this.partialCredit = partialCredit;
        this.generalistTags = Collections.unmodifiableSet(
                new LinkedHashSet<>(Objects.requireNonNull(generalistTags, "generalistTags must not be null")));
        this.geoEnabled = geoEnabled;
    }

    public ScoringWeights getWeights() {
        return weights;
    }

    @Override
    public AssignmentCandidateScore score(Ticket ticket, Executor executor, ServiceMode mode) {
        Map<ScoringFactor, Double> breakdown = new EnumMap<>(ScoringFactor.class);
        breakdown.put(ScoringFactor.SKILL_MATCH,
                gated(mode, ScoringFactor.SKILL_MATCH, calculateSkillMatch(ticket, executor)));
        breakdown.put(ScoringFactor.EFFICIENCY,
                gated(mode, ScoringFactor.EFFICIENCY, executor.getEfficiencyRating() / 100.0));
        breakdown.put(ScoringFactor.WORKLOAD_BALANCE,
                gated(mode, ScoringFactor.WORKLOAD_BALANCE, calculateWorkloadBalance(executor)));
        breakdown.put(ScoringFactor.AVAILABILITY,
                gated(mode, ScoringFactor.AVAILABILITY, executor.isAvailable() ? 1.0 : 0.0));
        breakdown.put(ScoringFactor.GEO_PROXIMITY,
                geoEnabled ? gated(mode, ScoringFactor.GEO_PROXIMITY, calculateProximity(ticket, executor)) : 0.0);
        breakdown.put(ScoringFactor.URGENCY_BONUS, ticket.getUrgency() / (double) Ticket.MAX_URGENCY);

        double score = 0.0;
        for (Map.Entry<ScoringFactor, Double> entry : breakdown.entrySet()) {
            score += weights.weightOf(entry.getKey()) * entry.getValue();
        }

        if (log.isDebugEnabled()) {
            log.debug("Scored executor {} for ticket {}: {} total={}",
                    executor.getId(), ticket.getId(), breakdown, String.format("%.4f", score));
        }

        return new AssignmentCandidateScore(ticket.getId(), executor.getId(), score, breakdown,
                describe(ticket, executor, breakdown));
    }

    @Override
    public boolean isSkillEligible(Ticket ticket, Executor executor) {
        if (executor.hasSkill(ticket.getCategory())) {
            return true;
        }
        for (String tag : generalistTags) {
            if (executor.hasSkill(tag)) {
                return true;
            }
        }
        return false;
    }

    private static double gated(ServiceMode mode, ScoringFactor factor, double value) {
        return mode.considers(factor) ? value : 0.0;
    }

    /**
     * Exact category match scores 1.0, a generalist gets partial credit,
     * anyone else nothing.
     */
    private double calculateSkillMatch(Ticket ticket, Executor executor) {
        if (executor.hasSkill(ticket.getCategory())) {
            return 1.0;
        }
        return isSkillEligible(ticket, executor) ? partialCredit : 0.0;
    }

    private static double calculateWorkloadBalance(Executor executor) {
        if (executor.getWorkloadCapacity() <= 0) {
            return 0.0;
        }
        double ratio = 1.0 - (double) executor.getCurrentLoad() / executor.getWorkloadCapacity();
        return Math.max(0.0, Math.min(1.0, ratio));
    }

    private double calculateProximity(Ticket ticket, Executor executor) {
        return geoService.proximity(executor.getHomeZone(), ticket.getZone());
    }

    private String describe(Ticket ticket, Executor executor, Map<ScoringFactor, Double> breakdown) {
        StringBuilder sb = new StringBuilder();
        double skill = breakdown.get(ScoringFactor.SKILL_MATCH);
        if (skill >= 1.0) {
            sb.append("skill match (").append(ticket.getCategory()).append(')');
        } else if (skill > 0.0) {
            sb.append("generalist");
        } else {
            sb.append("no skill credit");
        }
        if (breakdown.get(ScoringFactor.EFFICIENCY) > 0.0) {
            sb.append(String.format(", efficiency %.0f%%", executor.getEfficiencyRating()));
        }
        if (breakdown.get(ScoringFactor.WORKLOAD_BALANCE) > 0.0 || executor.getCurrentLoad() > 0) {
            sb.append(", load ").append(executor.getCurrentLoad()).append('/').append(executor.getWorkloadCapacity());
        }
        if (weights.weightOf(ScoringFactor.GEO_PROXIMITY) > 0.0 && breakdown.get(ScoringFactor.GEO_PROXIMITY) > 0.0) {
            sb.append(String.format(", proximity %.2f", breakdown.get(ScoringFactor.GEO_PROXIMITY)));
        }
        return sb.toString();
    }
}
