package org.fielddispatch.engine.optimizer;

import org.fielddispatch.engine.exception.InvalidConfigurationException;

import java.time.Duration;
import java.util.Objects;

/**
 * Iteration and time limits for batch searches.
 * Immutable. Use {@link Builder} to create instances.
 */
public final class OptimizationBudget {

    private final int populationSize;
    private final int generations;
    private final double mutationRate;
    private final double crossoverRate;
    private final int eliteSize;
    private final int tournamentSize;
    private final int annealingIterations;
    private final double initialTemperature;
    private final double coolingRate;
    private final double minTemperature;
    private final int hybridAnnealingIterations;
    private final double capacityPenalty;
    private final Duration timeBudget;

    private OptimizationBudget(Builder builder) {
        this.populationSize = builder.populationSize;
        this.generations = builder.generations;
        this.mutationRate = builder.mutationRate;
        this.crossoverRate = builder.crossoverRate;
        this.eliteSize = builder.eliteSize;
        this.tournamentSize = builder.tournamentSize;
        this.annealingIterations = builder.annealingIterations;
        this.initialTemperature = builder.initialTemperature;
        this.coolingRate = builder.coolingRate;
        this.minTemperature = builder.minTemperature;
        this.hybridAnnealingIterations = builder.hybridAnnealingIterations;
        this.capacityPenalty = builder.capacityPenalty;
        this.timeBudget = Objects.requireNonNull(builder.timeBudget, "timeBudget must not be null");
        validate();
    }

    public static OptimizationBudget defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    private void validate() {
        require(populationSize >= 2, "populationSize must be at least 2");
        require(generations >= 0, "generations must not be negative");
        require(mutationRate >= 0.0 && mutationRate <= 1.0, "mutationRate must be in [0,1]");
        require(crossoverRate >= 0.0 && crossoverRate <= 1.0, "crossoverRate must be in [0,1]");
        require(eliteSize >= 0 && eliteSize < populationSize, "eliteSize must be in [0, populationSize)");
        require(tournamentSize >= 1 && tournamentSize <= populationSize,
                "tournamentSize must be in [1, populationSize]");
        require(annealingIterations >= 0, "annealingIterations must not be negative");
        require(initialTemperature > 0.0, "initialTemperature must be positive");
        require(coolingRate > 0.0 && coolingRate < 1.0, "coolingRate must be in (0,1)");
        require(minTemperature > 0.0 && minTemperature < initialTemperature,
                "minTemperature must be positive and below initialTemperature");
        require(hybridAnnealingIterations >= 0, "hybridAnnealingIterations must not be negative");
        require(capacityPenalty >= 0.0, "capacityPenalty must not be negative");
        require(!timeBudget.isNegative(), "timeBudget must not be negative");
    }

    private static void require(boolean condition, String message) {
        if (!condition) {
            throw new InvalidConfigurationException("Invalid optimization budget: " + message);
        }
    }

    public int getPopulationSize() {
        return populationSize;
    }

    public int getGenerations() {
        return generations;
    }

    public double getMutationRate() {
        return mutationRate;
    }

    public double getCrossoverRate() {
        return crossoverRate;
    }

    public int getEliteSize() {
        return eliteSize;
    }

    public int getTournamentSize() {
        return tournamentSize;
    }

    public int getAnnealingIterations() {
        return annealingIterations;
    }

    public double getInitialTemperature() {
        return initialTemperature;
    }

    public double getCoolingRate() {
        return coolingRate;
    }

    public double getMinTemperature() {
        return minTemperature;
    }

    public int getHybridAnnealingIterations() {
        return hybridAnnealingIterations;
    }

    /**
     * Fitness cost of each ticket placed beyond an executor's spare capacity.
     */
    public double getCapacityPenalty() {
        return capacityPenalty;
    }

    /**
     * Wall-clock limit for one search.
     */
    public Duration getTimeBudget() {
        return timeBudget;
    }

    public Builder toBuilder() {
        return new Builder()
                .populationSize(populationSize)
                .generations(generations)
                .mutationRate(mutationRate)
                .crossoverRate(crossoverRate)
                .eliteSize(eliteSize)
                .tournamentSize(tournamentSize)
                .annealingIterations(annealingIterations)
                .initialTemperature(initialTemperature)
                .coolingRate(coolingRate)
                .minTemperature(minTemperature)
                .hybridAnnealingIterations(hybridAnnealingIterations)
                .capacityPenalty(capacityPenalty)
                .timeBudget(timeBudget);
    }

    @Override
    public String toString() {
        return String.format("OptimizationBudget{population=%d, generations=%d, annealing=%d, T0=%.1f, cooling=%.3f, "
                        + "hybrid=%d, time=%dms}",
                populationSize, generations, annealingIterations, initialTemperature, coolingRate,
                hybridAnnealingIterations, timeBudget.toMillis());
    }

    /**
     * Builder for OptimizationBudget.
     */
    public static final class Builder {
        private int populationSize = 50;
        private int generations = 100;
        private double mutationRate = 0.1;
        private double crossoverRate = 0.8;
        private int eliteSize = 5;
        private int tournamentSize = 3;
        private int annealingIterations = 1000;
        private double initialTemperature = 1000.0;
        private double coolingRate = 0.95;
        private double minTemperature = 0.1;
        private int hybridAnnealingIterations = 200;
        private double capacityPenalty = 10.0;
        private Duration timeBudget = Duration.ofSeconds(2);

        public Builder populationSize(int populationSize) {
            this.populationSize = populationSize;
            return this;
        }

        public Builder generations(int generations) {
            this.generations = generations;
            return this;
        }

        public Builder mutationRate(double mutationRate) {
            this.mutationRate = mutationRate;
            return this;
        }

        public Builder crossoverRate(double crossoverRate) {
            this.crossoverRate = crossoverRate;
            return this;
        }

        public Builder eliteSize(int eliteSize) {
            this.eliteSize = eliteSize;
            return this;
        }

        public Builder tournamentSize(int tournamentSize) {
            this.tournamentSize = tournamentSize;
            return this;
        }

        public Builder annealingIterations(int annealingIterations) {
            this.annealingIterations = annealingIterations;
            return this;
        }

        public Builder initialTemperature(double initialTemperature) {
            this.initialTemperature = initialTemperature;
            return this;
        }

        public Builder coolingRate(double coolingRate) {
            this.coolingRate = coolingRate;
            return this;
        }

        public Builder minTemperature(double minTemperature) {
            this.minTemperature = minTemperature;
            return this;
        }

        public Builder hybridAnnealingIterations(int hybridAnnealingIterations) {
            this.hybridAnnealingIterations = hybridAnnealingIterations;
            return this;
        }

        public Builder capacityPenalty(double capacityPenalty) {
            this.capacityPenalty = capacityPenalty;
            return this;
        }

        public Builder timeBudget(Duration timeBudget) {
            this.timeBudget = timeBudget;
            return this;
        }

        public OptimizationBudget build() {
            return new OptimizationBudget(this);
        }
    }
}
