package com.paretorank.core.model;

/**
 * Optimisation direction of a single objective.
 *
 * <p>
 * Objective vectors are compared as "lower is better". A {@link #MAXIMIZE}
 * objective is compared reversed so callers do not have to negate values
 * themselves.
 * </p>
 *
 * @since 1.0.0
 */
public enum ObjectiveDirection {

    MINIMIZE,

    MAXIMIZE;

    /**
     * Orient a raw objective value so that lower is better.
     *
     * @param value raw objective value (may be {@code NaN})
     * @return the value itself for {@link #MINIMIZE}, its negation for
     *         {@link #MAXIMIZE}
     */
    public double orient(double value) {
        return this == MAXIMIZE ? -value : value;
    }
}
