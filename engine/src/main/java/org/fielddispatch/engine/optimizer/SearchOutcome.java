package org.fielddispatch.engine.optimizer;

/**
 * Best solution a search found, with whether the time budget cut it short.
 */
public final class SearchOutcome {

    private final int[] solution;
    private final boolean budgetExhausted;
    private final int iterations;

    public SearchOutcome(int[] solution, boolean budgetExhausted, int iterations) {
        this.solution = solution.clone();
        this.budgetExhausted = budgetExhausted;
        this.iterations = iterations;
    }

    public int[] getSolution() {
        return solution.clone();
    }

    public boolean isBudgetExhausted() {
        return budgetExhausted;
    }

    /**
     * Generations or annealing steps actually run.
     */
    public int getIterations() {
        return iterations;
    }
}
