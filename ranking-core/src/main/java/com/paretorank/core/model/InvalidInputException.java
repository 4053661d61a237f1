package com.paretorank.core.model;

/**
 * Thrown when a population cannot be ranked because its objective vectors
 * are inconsistent (mismatched or zero dimensionality, missing solutions,
 * directions that do not match the dimension).
 *
 * <p>
 * Always raised before any ranking work begins, so a failed call never
 * produces partial output.
 * </p>
 *
 * @since 1.0.0
 */
public class InvalidInputException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    /** Index of the offending solution, or {@code -1} if not solution-specific. */
    private final int solutionIndex;

    public InvalidInputException(String message) {
        this(message, -1);
    }

    public InvalidInputException(String message, int solutionIndex) {
        super(message);
        this.solutionIndex = solutionIndex;
    }

    /**
     * Build the exception for a solution whose objective vector does not
     * have the population's dimension.
     *
     * @param index    position of the solution in the population
     * @param expected dimension of the first solution
     * @param actual   dimension of the offending solution
     * @return a new exception
     */
    public static InvalidInputException dimensionMismatch(int index, int expected, int actual) {
        return new InvalidInputException(
                "Solution at index " + index + " has " + actual
                        + " objective(s), expected " + expected,
                index);
    }

    /**
     * @return index of the offending solution, or {@code -1}
     */
    public int getSolutionIndex() {
        return solutionIndex;
    }
}
