package org.fielddispatch.engine.optimizer;

import java.util.Random;

/**
 * Sequential dispatch by descending urgency over a working copy of loads.
 * Each ticket goes to the eligible executor with room that scores best at its
 * current working load; ties go to the lower working load, then the lower id.
 */
public final class GreedySearch implements SearchStrategy {

    @Override
    public SearchOutcome search(AssignmentProblem problem, OptimizationBudget budget, Deadline deadline, Random random) {
        return new SearchOutcome(solve(problem), false, problem.ticketCount());
    }

    static int[] solve(AssignmentProblem problem) {
        int[] solution = problem.emptySolution();
        int[] used = new int[problem.executorCount()];

        for (int t : problem.urgencyOrder()) {
            int best = AssignmentProblem.UNASSIGNED;
            for (int e : problem.options(t)) {
                if (used[e] >= problem.spareCapacity(e)) {
                    continue;
                }
                if (best == AssignmentProblem.UNASSIGNED || isBetter(problem, t, e, best, used)) {
                    best = e;
                }
            }
            if (best != AssignmentProblem.UNASSIGNED) {
                solution[t] = best;
                used[best]++;
            }
        }
        return solution;
    }

    // Options come in id order, so only a strictly better candidate replaces the current one.
    private static boolean isBetter(AssignmentProblem problem, int t, int candidate, int current, int[] used) {
        int byScore = Double.compare(problem.score(t, candidate, used[candidate]),
                problem.score(t, current, used[current]));
        if (byScore != 0) {
            return byScore > 0;
        }
        int candidateLoad = problem.executor(candidate).getCurrentLoad() + used[candidate];
        int currentLoad = problem.executor(current).getCurrentLoad() + used[current];
        return candidateLoad < currentLoad;
    }
}
