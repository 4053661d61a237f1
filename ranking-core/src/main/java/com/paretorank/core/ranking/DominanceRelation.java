package com.paretorank.core.ranking;

/**
 * Outcome of comparing two solutions {@code a} and {@code b}.
 *
 * @since 1.0.0
 */
public enum DominanceRelation {

    /** {@code a} dominates {@code b}. */
    DOMINATES,

    /** {@code b} dominates {@code a}. */
    DOMINATED_BY,

    /** Neither dominates the other (includes identical vectors and NaN). */
    NON_DOMINATED;

    /**
     * @return the relation seen from the other side of the pair
     */
    public DominanceRelation inverse() {
        return switch (this) {
            case DOMINATES -> DOMINATED_BY;
            case DOMINATED_BY -> DOMINATES;
            case NON_DOMINATED -> NON_DOMINATED;
        };
    }
}
