package org.fielddispatch.engine.optimizer;

import org.fielddispatch.engine.exception.InvalidConfigurationException;

import java.util.Locale;

/**
 * Batch search strategies.
 */
public enum OptimizationAlgorithm {
    GREEDY("greedy"),
    /** Genetic search over executor-index genes. */
    POPULATION("population"),
    /** Simulated annealing starting from the greedy solution. */
    ANNEALING("annealing"),
    /** Greedy followed by a short annealing run. */
    HYBRID("hybrid");

    private final String value;

    OptimizationAlgorithm(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * Resolve an algorithm by name. Accepts the enum name, the lowercase value
     * and the historic aliases {@code genetic} and {@code simulated_annealing}.
     *
     * @throws InvalidConfigurationException for any other name
     */
    public static OptimizationAlgorithm fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new InvalidConfigurationException("Algorithm name must not be empty");
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        switch (normalized) {
            case "genetic":
                return POPULATION;
            case "simulated_annealing":
                return ANNEALING;
            default:
                for (OptimizationAlgorithm algorithm : values()) {
                    if (algorithm.value.equals(normalized)) {
                        return algorithm;
                    }
                }
                throw new InvalidConfigurationException("Unknown optimization algorithm: " + name);
        }
    }
}
