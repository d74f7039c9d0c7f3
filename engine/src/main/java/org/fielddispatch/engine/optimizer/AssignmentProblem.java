package org.fielddispatch.engine.optimizer;

import org.fielddispatch.engine.domain.model.AssignmentCandidateScore;
import org.fielddispatch.engine.domain.model.Executor;
import org.fielddispatch.engine.domain.model.ServiceMode;
import org.fielddispatch.engine.domain.model.Ticket;
import org.fielddispatch.engine.domain.service.ScoringService;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Snapshot of one batch: N tickets against M executors.
 * Executors are held in id order so that index order doubles as the id
 * tie-break. Solutions are {@code int[N]} of executor indices, -1 for
 * unassigned.
 * <p>
 * Scores depend on the executor's working load: the snapshot load plus the
 * tickets already placed with it earlier in the batch. Placements are charged
 * in urgency order, the same order greedy dispatch walks, so every strategy
 * optimizes the same objective. Scores are computed lazily and cached per
 * (ticket, executor, extra load).
 */
public final class AssignmentProblem {

    public static final int UNASSIGNED = -1;

    private final List<Ticket> tickets;
    private final List<Executor> executors;
    private final ScoringService scoringService;
    private final ServiceMode mode;
    private final AssignmentCandidateScore[][][] candidates;
    private final boolean[][] eligible;
    private final int[][] options;
    private final int[] spareCapacity;
    private final int[] urgencyOrder;
    private final boolean[] anySkillMatch;

    private AssignmentProblem(List<Ticket> tickets, List<Executor> executors,
                              ScoringService scoringService, ServiceMode mode) {
        this.tickets = Collections.unmodifiableList(new ArrayList<>(tickets));
        List<Executor> sorted = new ArrayList<>(executors);
        sorted.sort(Comparator.comparing(Executor::getId, Executor.ID_ORDER));
        this.executors = Collections.unmodifiableList(sorted);
        this.scoringService = scoringService;
        this.mode = mode;

        int n = this.tickets.size();
        int m = this.executors.size();
        this.candidates = new AssignmentCandidateScore[n][m][];
        this.eligible = new boolean[n][m];
        this.options = new int[n][];
        this.spareCapacity = new int[m];
        this.anySkillMatch = new boolean[n];

        for (int e = 0; e < m; e++) {
            Executor executor = this.executors.get(e);
            spareCapacity[e] = executor.isAvailable() ? executor.getSpareCapacity() : 0;
        }
        for (int t = 0; t < n; t++) {
            Ticket ticket = this.tickets.get(t);
            List<Integer> ticketOptions = new ArrayList<>();
            for (int e = 0; e < m; e++) {
                Executor executor = this.executors.get(e);
                boolean skillOk = !mode.enforcesSkillMatch() || scoringService.isSkillEligible(ticket, executor);
                anySkillMatch[t] |= skillOk;
                eligible[t][e] = skillOk && executor.isAvailable();
                if (eligible[t][e]) {
                    // Workload balance bottoms out once the executor is full, so loads past that share a score.
                    candidates[t][e] = new AssignmentCandidateScore[executor.getSpareCapacity() + 1];
                    ticketOptions.add(e);
                }
            }
            options[t] = ticketOptions.stream().mapToInt(Integer::intValue).toArray();
        }
        this.urgencyOrder = computeUrgencyOrder(this.tickets);
    }

    public static AssignmentProblem of(List<Ticket> tickets, List<Executor> executors,
                                       ScoringService scoringService, ServiceMode mode) {
        return new AssignmentProblem(tickets, executors, scoringService, mode);
    }

    private static int[] computeUrgencyOrder(List<Ticket> tickets) {
        List<Integer> order = new ArrayList<>(tickets.size());
        for (int i = 0; i < tickets.size(); i++) {
            order.add(i);
        }
        order.sort(Comparator
                .comparingInt((Integer i) -> tickets.get(i).getUrgency()).reversed()
                .thenComparing(i -> tickets.get(i).getCreatedAt())
                .thenComparing(i -> tickets.get(i).getId()));
        return order.stream().mapToInt(Integer::intValue).toArray();
    }

    public int ticketCount() {
        return tickets.size();
    }

    public int executorCount() {
        return executors.size();
    }

    public Ticket ticket(int t) {
        return tickets.get(t);
    }

    public Executor executor(int e) {
        return executors.get(e);
    }

    public List<Ticket> getTickets() {
        return tickets;
    }

    public List<Executor> getExecutors() {
        return executors;
    }

    public boolean isEligible(int t, int e) {
        return eligible[t][e];
    }

    /**
     * Executor indices that may take ticket {@code t}, in id order.
     */
    public int[] options(int t) {
        return options[t];
    }

    /**
     * Whether any executor has the skill for ticket {@code t}, ignoring availability.
     */
    public boolean hasSkillMatch(int t) {
        return anySkillMatch[t];
    }

    /**
     * Score of ticket {@code t} on executor {@code e} once {@code extraLoad}
     * batch tickets are already placed with it; 0 when ineligible.
     */
    public double score(int t, int e, int extraLoad) {
        AssignmentCandidateScore candidate = candidate(t, e, extraLoad);
        return candidate != null ? candidate.getScore() : 0.0;
    }

    /**
     * Full breakdown of ticket {@code t} on executor {@code e} at working load
     * snapshot + {@code extraLoad}, or null when ineligible.
     */
    public AssignmentCandidateScore candidate(int t, int e, int extraLoad) {
        AssignmentCandidateScore[] byLoad = candidates[t][e];
        if (byLoad == null) {
            return null;
        }
        int slot = Math.min(Math.max(0, extraLoad), byLoad.length - 1);
        if (byLoad[slot] == null) {
            Executor executor = executors.get(e);
            Executor working = slot == 0 ? executor : executor.withCurrentLoad(executor.getCurrentLoad() + slot);
            byLoad[slot] = scoringService.score(tickets.get(t), working, mode);
        }
        return byLoad[slot];
    }

    public int spareCapacity(int e) {
        return spareCapacity[e];
    }

    /**
     * Ticket indices by descending urgency, then creation time, then id.
     */
    public int[] urgencyOrder() {
        return urgencyOrder.clone();
    }

    public int[] emptySolution() {
        int[] solution = new int[tickets.size()];
        Arrays.fill(solution, UNASSIGNED);
        return solution;
    }

    /**
     * Extra load each placed ticket sees on its executor: the number of batch
     * tickets placed with the same executor before it in urgency order.
     * Unassigned and ineligible placements get -1.
     */
    public int[] placementLoads(int[] solution) {
        int[] loads = new int[solution.length];
        Arrays.fill(loads, -1);
        int[] used = new int[executors.size()];
        for (int t : urgencyOrder) {
            int e = solution[t];
            if (e != UNASSIGNED && eligible[t][e]) {
                loads[t] = used[e]++;
            }
        }
        return loads;
    }

    /**
     * Sum of working-load scores of placed tickets minus the penalty for every
     * ticket placed beyond spare capacity. Ineligible placements count as
     * overflow.
     */
    public double fitness(int[] solution, double capacityPenalty) {
        int[] used = new int[executors.size()];
        double total = 0.0;
        int overflow = 0;
        for (int t : urgencyOrder) {
            int e = solution[t];
            if (e == UNASSIGNED) {
                continue;
            }
            if (!eligible[t][e]) {
                overflow++;
                continue;
            }
            total += score(t, e, used[e]);
            used[e]++;
        }
        for (int e = 0; e < used.length; e++) {
            overflow += Math.max(0, used[e] - spareCapacity[e]);
        }
        return total - capacityPenalty * overflow;
    }

    public int assignedCount(int[] solution) {
        int count = 0;
        for (int e : solution) {
            if (e != UNASSIGNED) {
                count++;
            }
        }
        return count;
    }
}
