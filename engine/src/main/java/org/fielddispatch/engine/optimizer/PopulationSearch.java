package org.fielddispatch.engine.optimizer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Random;

/**
 * Genetic search. Genes are executor indices (or -1); selection is by
 * tournament, recombination single-point, mutation per gene, and the fittest
 * individuals survive unchanged. The greedy solution seeds the population.
 */
public final class PopulationSearch implements SearchStrategy {

    private static final Logger log = LoggerFactory.getLogger(PopulationSearch.class);

    @Override
    public SearchOutcome search(AssignmentProblem problem, OptimizationBudget budget, Deadline deadline, Random random) {
        int n = problem.ticketCount();
        double penalty = budget.getCapacityPenalty();
        if (n == 0) {
            return new SearchOutcome(problem.emptySolution(), false, 0);
        }

        List<Individual> population = new ArrayList<>(budget.getPopulationSize());
        int[] seed = GreedySearch.solve(problem);
        population.add(new Individual(seed, problem.fitness(seed, penalty)));
        while (population.size() < budget.getPopulationSize()) {
            int[] genes = new int[n];
            for (int t = 0; t < n; t++) {
                genes[t] = randomGene(problem, t, random);
            }
            population.add(new Individual(genes, problem.fitness(genes, penalty)));
        }
        population.sort(Individual.FITTEST_FIRST);

        int generation = 0;
        boolean exhausted = false;
        while (generation < budget.getGenerations()) {
            if (deadline.isExpired()) {
                exhausted = true;
                break;
            }
            List<Individual> next = new ArrayList<>(budget.getPopulationSize());
            for (int i = 0; i < budget.getEliteSize(); i++) {
                next.add(population.get(i));
            }
            while (next.size() < budget.getPopulationSize()) {
                int[] mother = tournament(population, budget.getTournamentSize(), random).genes;
                int[] father = tournament(population, budget.getTournamentSize(), random).genes;
                int[] child = random.nextDouble() < budget.getCrossoverRate()
                        ? crossover(mother, father, random)
                        : mother.clone();
                mutate(problem, child, budget.getMutationRate(), random);
                next.add(new Individual(child, problem.fitness(child, penalty)));
            }
            next.sort(Individual.FITTEST_FIRST);
            population = next;
            generation++;
        }

        Individual best = population.get(0);
        log.debug("Population search finished after {} generations, best fitness {}", generation, best.fitness);
        return new SearchOutcome(best.genes, exhausted, generation);
    }

    private static int randomGene(AssignmentProblem problem, int t, Random random) {
        int[] options = problem.options(t);
        int pick = random.nextInt(options.length + 1);
        return pick == options.length ? AssignmentProblem.UNASSIGNED : options[pick];
    }

    private static Individual tournament(List<Individual> population, int size, Random random) {
        Individual winner = null;
        for (int i = 0; i < size; i++) {
            Individual contender = population.get(random.nextInt(population.size()));
            if (winner == null || contender.fitness > winner.fitness) {
                winner = contender;
            }
        }
        return winner;
    }

    private static int[] crossover(int[] mother, int[] father, Random random) {
        int[] child = mother.clone();
        if (child.length < 2) {
            return child;
        }
        int point = 1 + random.nextInt(child.length - 1);
        System.arraycopy(father, point, child, point, child.length - point);
        return child;
    }

    private static void mutate(AssignmentProblem problem, int[] genes, double rate, Random random) {
        for (int t = 0; t < genes.length; t++) {
            if (random.nextDouble() < rate) {
                genes[t] = randomGene(problem, t, random);
            }
        }
    }

    private static final class Individual {
        // Stable sort keeps earlier (elite) individuals ahead on equal fitness.
        static final Comparator<Individual> FITTEST_FIRST =
                Comparator.comparingDouble((Individual i) -> i.fitness).reversed();

        final int[] genes;
        final double fitness;

        Individual(int[] genes, double fitness) {
            this.genes = genes;
            this.fitness = fitness;
        }
    }
}
