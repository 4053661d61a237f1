package com.paretorank.core.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * A {@link Solution} paired with the rank it was assigned.
 *
 * @since 1.0.0
 */
public final class RankedSolution implements Serializable {

    private static final long serialVersionUID = 1L;

    private final Solution solution;
    private final int rank;

    public RankedSolution(Solution solution, int rank) {
        this.solution = Objects.requireNonNull(solution, "Solution must not be null");
        this.rank = rank;
    }

    public Solution getSolution() {
        return solution;
    }

    public int getRank() {
        return rank;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof RankedSolution that))
            return false;
        return rank == that.rank && solution.equals(that.solution);
    }

    @Override
    public int hashCode() {
        return Objects.hash(solution, rank);
    }

    @Override
    public String toString() {
        return "RankedSolution{" + solution.getId() + " -> " + rank + '}';
    }
}
