package com.paretorank.core.ranking;

import com.paretorank.core.config.RankerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Objects;

/**
 * Factory that creates {@link NonDominatedSorter} and
 * {@link DominanceComparator} instances from configuration names.
 *
 * <p>
 * This is the single point of extension when adding a new strategy or
 * dominance predicate: register the name here.
 * </p>
 *
 * @since 1.0.0
 */
public final class SorterFactory {

    private static final Logger LOG = LoggerFactory.getLogger(SorterFactory.class);

    private SorterFactory() {
        // utility class
    }

    /**
     * Create a sorter for the given configuration.
     *
     * @param config ranker configuration; must not be {@code null}
     * @return a new sorter; the caller owns it and must close it
     * @throws NullPointerException     if {@code config} or its strategy is
     *                                  {@code null}
     * @throws IllegalArgumentException if the strategy or dominance is unknown
     */
    public static NonDominatedSorter create(RankerConfig config) {
        Objects.requireNonNull(config, "RankerConfig must not be null");
        Objects.requireNonNull(config.getStrategy(), "Strategy must not be null");

        DominanceComparator comparator = comparator(config.getDominance());
        String strategy = config.getStrategy().toLowerCase(Locale.ROOT);
        NonDominatedSorter sorter = switch (strategy) {
            case FastNonDominatedSorter.NAME -> new FastNonDominatedSorter(comparator);
            case ParallelNonDominatedSorter.NAME -> new ParallelNonDominatedSorter(
                    comparator, config.getParallelism(), config.getParallelThreshold());
            default -> throw new IllegalArgumentException(
                    "Unknown strategy: '" + config.getStrategy()
                            + "'. Supported strategies: sequential, parallel");
        };
        LOG.debug("Created {}", sorter);
        return sorter;
    }

    /**
     * Resolve a dominance predicate by name.
     *
     * @param name comparator name; {@code null} selects Pareto dominance
     * @return the comparator
     * @throws IllegalArgumentException if the name is unknown
     */
    public static DominanceComparator comparator(String name) {
        if (name == null) {
            return DominanceComparator.pareto();
        }
        return switch (name.toLowerCase(Locale.ROOT)) {
            case ParetoDominanceComparator.NAME -> DominanceComparator.pareto();
            case ConstrainedDominanceComparator.NAME -> DominanceComparator.constrained();
            default -> throw new IllegalArgumentException(
                    "Unknown dominance: '" + name + "'. Supported: pareto, constrained");
        };
    }
}
