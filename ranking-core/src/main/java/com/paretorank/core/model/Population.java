package com.paretorank.core.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Ordered, immutable sequence of evaluated {@link Solution}s.
 *
 * <p>
 * Objective vectors are not required to be unique. Every solution is expected
 * to have the same number of objectives; this is checked by
 * {@link #validate()} rather than at construction so that a ranker can reject
 * the population with an {@link InvalidInputException} before doing any work.
 * </p>
 *
 * <h3>Directions</h3>
 * <p>
 * By default every objective is minimised. A population may declare one
 * {@link ObjectiveDirection} per objective via {@link #withDirections}; the
 * ranker then compares the {@link #normalized() normalised} solutions.
 * </p>
 *
 * @since 1.0.0
 */
public final class Population implements Serializable {

    private static final long serialVersionUID = 1L;

    private static final Population EMPTY = new Population(Collections.emptyList(), null);

    private final List<Solution> solutions;

    /** One direction per objective, or {@code null} for all-minimise. */
    private final List<ObjectiveDirection> directions;

    private Population(List<Solution> solutions, List<ObjectiveDirection> directions) {
        this.solutions = solutions;
        this.directions = directions;
    }

    // ---------------------------------------------------------------
    // Factories
    // ---------------------------------------------------------------

    /**
     * @return the empty population
     */
    public static Population empty() {
        return EMPTY;
    }

    /**
     * Create a population from existing solutions. The list is copied.
     *
     * @param solutions solutions in input order; must not be {@code null}
     * @return a new population
     * @throws NullPointerException if {@code solutions} is {@code null}
     */
    public static Population of(List<Solution> solutions) {
        Objects.requireNonNull(solutions, "Solutions list must not be null");
        return new Population(Collections.unmodifiableList(new ArrayList<>(solutions)), null);
    }

    /**
     * Create a population from raw objective vectors. Each solution's id is
     * its position in the argument list.
     *
     * @param objectiveVectors one vector per solution
     * @return a new population
     */
    public static Population of(double[]... objectiveVectors) {
        Objects.requireNonNull(objectiveVectors, "Objective vectors must not be null");
        List<Solution> list = new ArrayList<>(objectiveVectors.length);
        for (int i = 0; i < objectiveVectors.length; i++) {
            list.add(new Solution(String.valueOf(i), objectiveVectors[i]));
        }
        return new Population(Collections.unmodifiableList(list), null);
    }

    /**
     * Return a copy of this population with explicit objective directions.
     *
     * @param directions one direction per objective
     * @return a new population sharing the same solutions
     * @throws NullPointerException if {@code directions} or any element is
     *                              {@code null}
     */
    public Population withDirections(ObjectiveDirection... directions) {
        Objects.requireNonNull(directions, "Directions must not be null");
        return new Population(solutions, List.of(directions));
    }

    // ---------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------

    public int size() {
        return solutions.size();
    }

    public boolean isEmpty() {
        return solutions.isEmpty();
    }

    public Solution get(int index) {
        return solutions.get(index);
    }

    /**
     * @return unmodifiable view of the solutions in input order
     */
    public List<Solution> getSolutions() {
        return solutions;
    }

    /**
     * @return number of objectives of the first solution, or {@code 0} when
     *         the population is empty
     */
    public int dimension() {
        if (solutions.isEmpty() || solutions.get(0) == null) {
            return 0;
        }
        return solutions.get(0).dimension();
    }

    /**
     * @param objective objective index
     * @return declared direction of the objective ({@code MINIMIZE} by default)
     */
    public ObjectiveDirection direction(int objective) {
        return directions == null ? ObjectiveDirection.MINIMIZE : directions.get(objective);
    }

    /**
     * @return {@code true} if at least one objective is maximised
     */
    public boolean hasMaximizedObjective() {
        return directions != null && directions.contains(ObjectiveDirection.MAXIMIZE);
    }

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * Verify that the population can be ranked.
     *
     * <ul>
     * <li>no {@code null} solution</li>
     * <li>every objective vector has the same dimension, at least 1</li>
     * <li>declared directions, if any, match that dimension</li>
     * </ul>
     *
     * <p>
     * An empty population is valid.
     * </p>
     *
     * @throws InvalidInputException on the first violation found
     */
    public void validate() {
        if (solutions.isEmpty()) {
            return;
        }
        for (int i = 0; i < solutions.size(); i++) {
            if (solutions.get(i) == null) {
                throw new InvalidInputException("Solution at index " + i + " is null", i);
            }
        }

        int expected = solutions.get(0).dimension();
        if (expected < 1) {
            throw new InvalidInputException("Solutions must have at least one objective", 0);
        }
        for (int i = 1; i < solutions.size(); i++) {
            int actual = solutions.get(i).dimension();
            if (actual != expected) {
                throw InvalidInputException.dimensionMismatch(i, expected, actual);
            }
        }
        if (directions != null && directions.size() != expected) {
            throw new InvalidInputException(
                    "Population declares " + directions.size() + " objective direction(s) for "
                            + expected + " objective(s)");
        }
    }

    /**
     * Return the solutions with every objective oriented so that lower is
     * better. When all objectives are minimised the original solutions are
     * returned as-is.
     *
     * @return solutions in input order, ready for dominance comparison
     */
    public List<Solution> normalized() {
        if (!hasMaximizedObjective()) {
            return solutions;
        }
        List<Solution> oriented = new ArrayList<>(solutions.size());
        for (Solution s : solutions) {
            double[] values = s.getObjectives();
            for (int k = 0; k < values.length; k++) {
                values[k] = direction(k).orient(values[k]);
            }
            oriented.add(new Solution(s.getId(), values, s.getConstraintViolation()));
        }
        return Collections.unmodifiableList(oriented);
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Population that))
            return false;
        return solutions.equals(that.solutions)
                && Objects.equals(directions, that.directions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(solutions, directions);
    }

    @Override
    public String toString() {
        return "Population{size=" + solutions.size()
                + (directions != null ? ", directions=" + Arrays.toString(directions.toArray()) : "")
                + '}';
    }
}
