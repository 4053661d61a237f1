package com.paretorank.core.ranking;

import com.paretorank.core.model.Solution;

import java.io.Serializable;

/**
 * Dominance predicate over two solutions whose objectives are already
 * oriented so that lower is better.
 *
 * <p>
 * Implementations must describe a strict partial order: no solution
 * dominates itself, and no chain of dominance returns to its start. The
 * sorters rely on this to terminate.
 * </p>
 *
 * @since 1.0.0
 */
public interface DominanceComparator extends Serializable {

    /**
     * Compare two solutions of equal dimension.
     *
     * @param a first solution
     * @param b second solution
     * @return the relation of {@code a} to {@code b}
     */
    DominanceRelation compare(Solution a, Solution b);

    /**
     * @param a first solution
     * @param b second solution
     * @return {@code true} iff {@code a} dominates {@code b}
     */
    default boolean dominates(Solution a, Solution b) {
        return compare(a, b) == DominanceRelation.DOMINATES;
    }

    /**
     * Return the unique name of this comparator, as used in configuration.
     *
     * @return comparator name
     */
    String getName();

    /**
     * @return the plain Pareto comparator
     */
    static DominanceComparator pareto() {
        return ParetoDominanceComparator.INSTANCE;
    }

    /**
     * @return the feasibility-first comparator
     */
    static DominanceComparator constrained() {
        return ConstrainedDominanceComparator.INSTANCE;
    }
}
