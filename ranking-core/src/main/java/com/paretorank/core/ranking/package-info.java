/**
 * Non-dominated sorting.
 *
 * <p>
 * {@link com.paretorank.core.ranking.DominanceRanker} is the entry point. It
 * runs one of the {@link com.paretorank.core.ranking.NonDominatedSorter}
 * strategies created by {@link com.paretorank.core.ranking.SorterFactory}:
 * </p>
 * <ul>
 * <li>{@link com.paretorank.core.ranking.FastNonDominatedSorter}: single
 * threaded reference</li>
 * <li>{@link com.paretorank.core.ranking.ParallelNonDominatedSorter}:
 * pairwise stage and large fronts spread over a worker pool</li>
 * </ul>
 *
 * <p>
 * Dominance itself is decided by a
 * {@link com.paretorank.core.ranking.DominanceComparator}: plain Pareto
 * dominance or feasibility-first constrained dominance.
 * </p>
 *
 * @since 1.0.0
 */
package com.paretorank.core.ranking;
