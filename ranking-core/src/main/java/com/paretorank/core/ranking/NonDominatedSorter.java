package com.paretorank.core.ranking;

import com.paretorank.core.model.InvalidInputException;
import com.paretorank.core.model.Population;
import com.paretorank.core.model.RankingResult;

/**
 * Contract for non-dominated sorting strategies.
 *
 * <p>
 * A sorter partitions a population into fronts: front 0 holds every solution
 * no other solution dominates, front {@code k + 1} every solution dominated
 * only by members of fronts {@code 0..k}.
 * </p>
 *
 * <p>
 * Implementations keep no population data between calls and must return the
 * same {@link RankingResult} as {@link FastNonDominatedSorter} for the same
 * input.
 * </p>
 */
public interface NonDominatedSorter extends AutoCloseable {

    /**
     * Rank every solution of the population.
     *
     * @param population the population; must not be {@code null}
     * @return rank per solution index and the induced fronts
     * @throws InvalidInputException if the objective vectors do not share one
     *                               dimension; thrown before any work is done
     */
    RankingResult sort(Population population);

    /**
     * Return the unique name of this strategy.
     *
     * @return strategy name
     */
    String getName();

    /**
     * Release worker resources, if any. The default does nothing.
     */
    @Override
    default void close() {
    }
}
