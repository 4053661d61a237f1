package com.paretorank.core.ranking;

import com.paretorank.core.config.RankerConfig;
import com.paretorank.core.model.InvalidInputException;
import com.paretorank.core.model.Population;
import com.paretorank.core.model.RankingResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Entry point for ranking populations.
 *
 * <p>
 * Delegates to the configured {@link NonDominatedSorter} and never modifies
 * its input: ranks come back in a {@link RankingResult} indexed by each
 * solution's position in the population.
 * </p>
 *
 * <pre>
 * try (DominanceRanker ranker = DominanceRanker.create()) {
 *     RankingResult result = ranker.rank(Population.of(
 *             new double[] {1, 4}, new double[] {5, 5}));
 *     result.rankOf(1); // 1
 * }
 * </pre>
 *
 * <p>
 * Thread-safe as long as the underlying sorter is; both built-in sorters
 * are.
 * </p>
 *
 * @since 1.0.0
 */
public class DominanceRanker implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(DominanceRanker.class);

    private final NonDominatedSorter sorter;

    /**
     * @param sorter the strategy to rank with; must not be {@code null}. The
     *               ranker takes ownership and closes it.
     */
    public DominanceRanker(NonDominatedSorter sorter) {
        this.sorter = Objects.requireNonNull(sorter, "NonDominatedSorter must not be null");
    }

    /**
     * @return a ranker using the sequential sorter and Pareto dominance
     */
    public static DominanceRanker create() {
        return new DominanceRanker(new FastNonDominatedSorter());
    }

    /**
     * @param config validated ranker configuration
     * @return a ranker for that configuration
     * @throws IllegalArgumentException if the configuration names an unknown
     *                                  strategy or dominance
     */
    public static DominanceRanker fromConfig(RankerConfig config) {
        return new DominanceRanker(SorterFactory.create(config));
    }

    /**
     * Assign a non-domination rank to every solution.
     *
     * @param population the population to rank; must not be {@code null}
     * @return rank per solution and the fronts; empty for an empty population
     * @throws InvalidInputException if the objective vectors do not share one
     *                               dimension
     */
    public RankingResult rank(Population population) {
        Objects.requireNonNull(population, "Population must not be null");
        long startNanos = System.nanoTime();
        RankingResult result = sorter.sort(population);
        LOG.debug("rank(size={}) -> {} front(s) in {} µs",
                population.size(), result.frontCount(), (System.nanoTime() - startNanos) / 1_000);
        return result;
    }

    public NonDominatedSorter getSorter() {
        return sorter;
    }

    @Override
    public void close() {
        sorter.close();
    }
}
