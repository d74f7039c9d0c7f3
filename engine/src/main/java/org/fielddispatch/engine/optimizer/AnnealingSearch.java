package org.fielddispatch.engine.optimizer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Random;

/**
 * Simulated annealing over single-ticket reassignments.
 * Starts from the greedy solution, cools geometrically and returns the best
 * solution seen, which is never worse than greedy.
 */
public final class AnnealingSearch implements SearchStrategy {

    private static final Logger log = LoggerFactory.getLogger(AnnealingSearch.class);

    @Override
    public SearchOutcome search(AssignmentProblem problem, OptimizationBudget budget, Deadline deadline, Random random) {
        return anneal(problem, GreedySearch.solve(problem), budget.getAnnealingIterations(), budget, deadline, random);
    }

    /**
     * Run at most {@code iterations} moves from {@code start}, stopping early
     * when the temperature floor or the deadline is reached.
     */
    static SearchOutcome anneal(AssignmentProblem problem, int[] start, int iterations,
                                OptimizationBudget budget, Deadline deadline, Random random) {
        double penalty = budget.getCapacityPenalty();
        int[] current = start.clone();
        double currentFitness = problem.fitness(current, penalty);
        int[] best = current.clone();
        double bestFitness = currentFitness;
        double temperature = budget.getInitialTemperature();

        if (problem.ticketCount() == 0) {
            return new SearchOutcome(best, false, 0);
        }

        int step = 0;
        boolean exhausted = false;
        while (step < iterations && temperature > budget.getMinTemperature()) {
            if (deadline.isExpired()) {
                exhausted = true;
                break;
            }
            int t = random.nextInt(problem.ticketCount());
            int[] options = problem.options(t);
            // one extra slot stands for "leave unassigned"
            int pick = random.nextInt(options.length + 1);
            int proposed = pick == options.length ? AssignmentProblem.UNASSIGNED : options[pick];

            if (proposed != current[t]) {
                int previous = current[t];
                current[t] = proposed;
                double candidateFitness = problem.fitness(current, penalty);
                double delta = candidateFitness - currentFitness;
                if (delta >= 0 || random.nextDouble() < Math.exp(delta / temperature)) {
                    currentFitness = candidateFitness;
                    if (currentFitness > bestFitness) {
                        bestFitness = currentFitness;
                        best = current.clone();
                    }
                } else {
                    current[t] = previous;
                }
            }
            temperature *= budget.getCoolingRate();
            step++;
        }

        log.debug("Annealing finished after {} steps, best fitness {}", step, bestFitness);
        return new SearchOutcome(best, exhausted, step);
    }
}
