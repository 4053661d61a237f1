package com.paretorank.core.model;

import java.io.Serializable;
import java.util.Arrays;
import java.util.Objects;

/**
 * An evaluated candidate solution: an opaque identifier paired with its
 * objective vector.
 *
 * <p>
 * Instances are immutable. The objective array is copied on the way in and
 * on the way out, so a solution cannot change after it has been handed to a
 * ranker. Ranks are not stored here; see {@link RankingResult}.
 * </p>
 *
 * <h3>Undefined objectives</h3>
 * <p>
 * An objective may be {@link Double#NaN} to mark an undefined value. Such a
 * solution is mutually non-dominated with every other solution.
 * </p>
 *
 * @since 1.0.0
 */
public final class Solution implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Caller-supplied handle, e.g. the input index or a design id. */
    private final String id;

    /** Objective values, lower is better unless the population says otherwise. */
    private final double[] objectives;

    /** Aggregate constraint violation; {@code 0} means feasible. */
    private final double constraintViolation;

    /**
     * Create a feasible solution.
     *
     * @param id         solution handle; must not be {@code null}
     * @param objectives objective values; must not be {@code null}
     * @throws NullPointerException if any argument is {@code null}
     */
    public Solution(String id, double[] objectives) {
        this(id, objectives, 0.0);
    }

    /**
     * @param id                  solution handle; must not be {@code null}
     * @param objectives          objective values; must not be {@code null}
     * @param constraintViolation aggregate violation, {@code 0} when feasible
     * @throws NullPointerException     if any argument is {@code null}
     * @throws IllegalArgumentException if {@code constraintViolation} is
     *                                  negative or {@code NaN}
     */
    public Solution(String id, double[] objectives, double constraintViolation) {
        this.id = Objects.requireNonNull(id, "Solution id must not be null");
        this.objectives = Objects.requireNonNull(objectives, "Objectives must not be null").clone();
        if (!(constraintViolation >= 0)) {
            throw new IllegalArgumentException(
                    "constraintViolation must be a number >= 0 for solution '" + id + "', got: "
                            + constraintViolation);
        }
        this.constraintViolation = constraintViolation;
    }

    /**
     * Convenience factory for a feasible solution.
     *
     * @param id         solution handle
     * @param objectives objective values
     * @return a new solution
     */
    public static Solution of(String id, double... objectives) {
        return new Solution(id, objectives);
    }

    public String getId() {
        return id;
    }

    /**
     * @return a copy of the objective vector
     */
    public double[] getObjectives() {
        return objectives.clone();
    }

    /**
     * Read one objective without copying the vector.
     *
     * @param index objective index
     * @return the objective value
     * @throws ArrayIndexOutOfBoundsException if {@code index} is out of range
     */
    public double getObjective(int index) {
        return objectives[index];
    }

    /**
     * @return number of objectives
     */
    public int dimension() {
        return objectives.length;
    }

    public double getConstraintViolation() {
        return constraintViolation;
    }

    public boolean isFeasible() {
        return constraintViolation == 0.0;
    }

    /**
     * @return {@code true} if any objective is {@code NaN}
     */
    public boolean hasUndefinedObjective() {
        for (double v : objectives) {
            if (Double.isNaN(v)) {
                return true;
            }
        }
        return false;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Solution that))
            return false;
        return id.equals(that.id)
                && Arrays.equals(objectives, that.objectives)
                && Double.compare(constraintViolation, that.constraintViolation) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, Arrays.hashCode(objectives), constraintViolation);
    }

    @Override
    public String toString() {
        return "Solution{" +
                "id='" + id + '\'' +
                ", objectives=" + Arrays.toString(objectives) +
                (constraintViolation != 0.0 ? ", constraintViolation=" + constraintViolation : "") +
                '}';
    }
}
