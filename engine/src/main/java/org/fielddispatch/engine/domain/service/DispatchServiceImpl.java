package org.fielddispatch.engine.domain.service;

import org.fielddispatch.engine.domain.model.AssignmentCandidateScore;
import org.fielddispatch.engine.domain.model.AssignmentDecision;
import org.fielddispatch.engine.domain.model.Executor;
import org.fielddispatch.engine.domain.model.ServiceMode;
import org.fielddispatch.engine.domain.model.Ticket;
import org.fielddispatch.engine.domain.model.UnassignedReason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Implementation of DispatchService.
 * Scores every eligible executor once and picks the best; in emergency mode
 * rotates through available executors instead.
 */
public final class DispatchServiceImpl implements DispatchService {

    private static final Logger log = LoggerFactory.getLogger(DispatchServiceImpl.class);

    static final int MAX_ALTERNATIVES = 3;

    private final ScoringService scoringService;
    private final RoundRobinCursor cursor;

    public DispatchServiceImpl(ScoringService scoringService, RoundRobinCursor cursor) {
        this.scoringService = Objects.requireNonNull(scoringService, "scoringService must not be null");
        this.cursor = Objects.requireNonNull(cursor, "cursor must not be null");
    }

    @Override
    public AssignmentDecision assign(Ticket ticket, List<Executor> executors, ServiceMode mode) {
        long start = System.nanoTime();

        List<Executor> withCapacity = executors.stream()
                .filter(Executor::canAcceptWork)
                .collect(Collectors.toList());
        if (withCapacity.isEmpty()) {
            log.info("No executor with capacity for ticket {} ({} in pool)", ticket.getId(), executors.size());
            return unassigned(ticket, mode, UnassignedReason.NO_CAPACITY, start);
        }

        List<Executor> eligible = filterBySkill(ticket, withCapacity, mode);
        if (eligible.isEmpty()) {
            log.info("No executor with skill '{}' for ticket {}", ticket.getCategory(), ticket.getId());
            return unassigned(ticket, mode, UnassignedReason.NO_SKILL_MATCH, start);
        }

        if (mode == ServiceMode.EMERGENCY) {
            return assignRoundRobin(ticket, eligible, mode, start);
        }

        List<AssignmentCandidateScore> ranked = rankEligible(ticket, eligible, mode);
        AssignmentCandidateScore best = ranked.get(0);
        AssignmentDecision decision = AssignmentDecision.builder()
                .ticketId(ticket.getId())
                .algorithm(ALGORITHM_BASIC)
                .candidate(best)
                .serviceMode(mode)
                .alternativeExecutorIds(alternatives(ranked))
                .processingTime(elapsedSince(start))
                .build();

        log.info("Assigned ticket {} to executor {} (score={}, mode={})",
                ticket.getId(), best.getExecutorId(), String.format("%.4f", best.getScore()), mode.value());
        return decision;
    }

    @Override
    public List<AssignmentCandidateScore> rank(Ticket ticket, List<Executor> executors, ServiceMode mode) {
        List<Executor> withCapacity = executors.stream()
                .filter(Executor::canAcceptWork)
                .collect(Collectors.toList());
        return rankEligible(ticket, filterBySkill(ticket, withCapacity, mode), mode);
    }

    private List<Executor> filterBySkill(Ticket ticket, List<Executor> executors, ServiceMode mode) {
        if (!mode.enforcesSkillMatch()) {
            return executors;
        }
        return executors.stream()
                .filter(e -> scoringService.isSkillEligible(ticket, e))
                .collect(Collectors.toList());
    }

    private List<AssignmentCandidateScore> rankEligible(Ticket ticket, List<Executor> eligible, ServiceMode mode) {
        List<Ranked> scored = new ArrayList<>(eligible.size());
        for (Executor executor : eligible) {
            scored.add(new Ranked(executor, scoringService.score(ticket, executor, mode)));
        }
        scored.sort(Ranked.ORDER);
        return scored.stream().map(r -> r.score).collect(Collectors.toList());
    }

    /**
     * Emergency rotation: executors ordered by id, next slot from the shared cursor.
     */
    private AssignmentDecision assignRoundRobin(Ticket ticket, List<Executor> eligible, ServiceMode mode, long start) {
        List<Executor> rotation = new ArrayList<>(eligible);
        rotation.sort(Comparator.comparing(Executor::getId, Executor.ID_ORDER));
        int slot = cursor.next(rotation.size());
        Executor chosen = rotation.get(slot);

        List<String> alternatives = new ArrayList<>();
        for (int i = 1; i < rotation.size() && alternatives.size() < MAX_ALTERNATIVES; i++) {
            alternatives.add(rotation.get((slot + i) % rotation.size()).getId());
        }

        AssignmentCandidateScore score = scoringService.score(ticket, chosen, mode);
        log.info("Emergency round-robin assigned ticket {} to executor {} (slot {}/{})",
                ticket.getId(), chosen.getId(), slot, rotation.size());
        return AssignmentDecision.builder()
                .ticketId(ticket.getId())
                .algorithm(ALGORITHM_ROUND_ROBIN)
                .candidate(score)
                .reasoning("emergency round-robin")
                .serviceMode(mode)
                .alternativeExecutorIds(alternatives)
                .processingTime(elapsedSince(start))
                .build();
    }

    private static List<String> alternatives(List<AssignmentCandidateScore> ranked) {
        return ranked.stream()
                .skip(1)
                .limit(MAX_ALTERNATIVES)
                .map(AssignmentCandidateScore::getExecutorId)
                .collect(Collectors.toList());
    }

    private static AssignmentDecision unassigned(Ticket ticket, ServiceMode mode, UnassignedReason reason, long start) {
        return AssignmentDecision.unassigned(ticket.getId(), ALGORITHM_BASIC, reason, mode)
                .toBuilder()
                .processingTime(elapsedSince(start))
                .build();
    }

    private static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    private static final class Ranked {
        static final Comparator<Ranked> ORDER = Comparator
                .comparingDouble((Ranked r) -> r.score.getScore()).reversed()
                .thenComparingInt(r -> r.executor.getCurrentLoad())
                .thenComparing(r -> r.executor.getId(), Executor.ID_ORDER);

        final Executor executor;
        final AssignmentCandidateScore score;

        Ranked(Executor executor, AssignmentCandidateScore score) {
            this.executor = executor;
            this.score = score;
        }
    }
}
