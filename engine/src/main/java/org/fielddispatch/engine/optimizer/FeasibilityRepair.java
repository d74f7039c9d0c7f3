package org.fielddispatch.engine.optimizer;

/**
 * Makes any search result capacity-feasible.
 * Tickets are visited by descending urgency: each keeps its executor while it
 * has room, otherwise moves to the eligible executor with room that scores
 * best at its working load, otherwise stays unassigned. The least urgent tickets are dropped first.
 */
final class FeasibilityRepair {

    private FeasibilityRepair() {
    }

    static int[] repair(AssignmentProblem problem, int[] solution) {
        int[] repaired = problem.emptySolution();
        int[] used = new int[problem.executorCount()];

        for (int t : problem.urgencyOrder()) {
            int chosen = solution[t];
            if (chosen == AssignmentProblem.UNASSIGNED
                    || !problem.isEligible(t, chosen)
                    || used[chosen] >= problem.spareCapacity(chosen)) {
                chosen = bestWithRoom(problem, t, used);
            }
            if (chosen != AssignmentProblem.UNASSIGNED) {
                repaired[t] = chosen;
                used[chosen]++;
            }
        }
        return repaired;
    }

    private static int bestWithRoom(AssignmentProblem problem, int t, int[] used) {
        int best = AssignmentProblem.UNASSIGNED;
        for (int e : problem.options(t)) {
            if (used[e] >= problem.spareCapacity(e)) {
                continue;
            }
            if (best == AssignmentProblem.UNASSIGNED
                    || problem.score(t, e, used[e]) > problem.score(t, best, used[best])) {
                best = e;
            }
        }
        return best;
    }
}
