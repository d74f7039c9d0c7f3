package org.fielddispatch.engine.optimizer;

import java.util.Random;

/**
 * Common contract of the batch search algorithms.
 * Implementations only touch request-local arrays and must check the
 * deadline between iterations.
 */
@FunctionalInterface
public interface SearchStrategy {

    SearchOutcome search(AssignmentProblem problem, OptimizationBudget budget, Deadline deadline, Random random);
}
