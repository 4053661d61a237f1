package com.paretorank.core.config;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Top-level POJO for the ranker YAML configuration.
 *
 * <p>
 * Expected YAML structure:
 * </p>
 *
 * <pre>
 * strategy: parallel
 * parallelism: 4
 * parallelThreshold: 256
 * dominance: pareto
 * </pre>
 *
 * <p>
 * Every key is optional; the defaults give a sequential sorter with plain
 * Pareto dominance. Call {@link #validate()} after loading.
 * </p>
 *
 * @since 1.0.0
 */
public class RankerConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final String DEFAULT_STRATEGY = "sequential";
    public static final String DEFAULT_DOMINANCE = "pareto";
    public static final int DEFAULT_PARALLEL_THRESHOLD = 256;

    /** Sorting strategy: "sequential" or "parallel". */
    private String strategy = DEFAULT_STRATEGY;

    /** Worker threads for the parallel strategy. */
    private int parallelism = Runtime.getRuntime().availableProcessors();

    /** Population size from which the parallel strategy uses its workers. */
    private int parallelThreshold = DEFAULT_PARALLEL_THRESHOLD;

    /** Dominance predicate: "pareto" or "constrained". */
    private String dominance = DEFAULT_DOMINANCE;

    /**
     * @return configuration with every default applied
     */
    public static RankerConfig defaults() {
        return new RankerConfig();
    }

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * Validate every setting. Collects all errors and throws a single
     * exception if any value is illegal.
     *
     * @throws IllegalStateException if validation fails
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (strategy == null || strategy.isBlank()) {
            errors.add("'strategy' is required");
        } else if (!strategy.equals("sequential") && !strategy.equals("parallel")) {
            errors.add("Unknown strategy: '" + strategy + "'. Supported: sequential, parallel");
        }
        if (dominance == null || dominance.isBlank()) {
            errors.add("'dominance' is required");
        } else if (!dominance.equals("pareto") && !dominance.equals("constrained")) {
            errors.add("Unknown dominance: '" + dominance + "'. Supported: pareto, constrained");
        }
        if (parallelism < 1) {
            errors.add("'parallelism' must be >= 1, got: " + parallelism);
        }
        if (parallelThreshold < 0) {
            errors.add("'parallelThreshold' must be >= 0, got: " + parallelThreshold);
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Ranker configuration validation failed:\n  - "
                            + String.join("\n  - ", errors));
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public String getStrategy() {
        return strategy;
    }

    /**
     * Set the strategy, normalised to lowercase.
     *
     * @param strategy strategy name
     */
    public void setStrategy(String strategy) {
        this.strategy = strategy != null ? strategy.toLowerCase(Locale.ROOT) : null;
    }

    public int getParallelism() {
        return parallelism;
    }

    public void setParallelism(int parallelism) {
        this.parallelism = parallelism;
    }

    public int getParallelThreshold() {
        return parallelThreshold;
    }

    public void setParallelThreshold(int parallelThreshold) {
        this.parallelThreshold = parallelThreshold;
    }

    public String getDominance() {
        return dominance;
    }

    /**
     * Set the dominance predicate name, normalised to lowercase.
     *
     * @param dominance dominance name
     */
    public void setDominance(String dominance) {
        this.dominance = dominance != null ? dominance.toLowerCase(Locale.ROOT) : null;
    }

    @Override
    public String toString() {
        return "RankerConfig{" +
                "strategy='" + strategy + '\'' +
                ", parallelism=" + parallelism +
                ", parallelThreshold=" + parallelThreshold +
                ", dominance='" + dominance + '\'' +
                '}';
    }
}
