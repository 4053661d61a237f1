package com.paretorank.core.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Output of a ranking call: a rank per solution index plus the fronts those
 * ranks induce.
 *
 * <p>
 * The population itself is never modified; consumers look ranks up here by
 * the solution's position in the population that was ranked.
 * </p>
 *
 * <h3>Invariants</h3>
 * <ul>
 * <li>every index in {@code [0, size)} has exactly one rank</li>
 * <li>ranks are contiguous from {@code 0} to {@code frontCount - 1}</li>
 * <li>front {@code k} lists exactly the indices whose rank is {@code k}, in
 * ascending order</li>
 * </ul>
 *
 * @since 1.0.0
 */
public final class RankingResult implements Serializable {

    private static final long serialVersionUID = 1L;

    private static final RankingResult EMPTY = new RankingResult(new int[0], Collections.emptyList());

    private final int[] ranks;
    private final List<Front> fronts;

    private RankingResult(int[] ranks, List<Front> fronts) {
        this.ranks = ranks;
        this.fronts = fronts;
    }

    /**
     * @return result for an empty population: no ranks, zero fronts
     */
    public static RankingResult empty() {
        return EMPTY;
    }

    /**
     * Build a result from fronts produced in rank order.
     *
     * @param size   population size
     * @param fronts member indices per front; front {@code k} at position
     *               {@code k}
     * @return a new result
     * @throws IllegalStateException if the fronts do not partition
     *                               {@code [0, size)}
     */
    public static RankingResult fromFronts(int size, List<int[]> fronts) {
        Objects.requireNonNull(fronts, "Fronts must not be null");
        int[] ranks = new int[size];
        Arrays.fill(ranks, -1);
        List<Front> built = new ArrayList<>(fronts.size());

        for (int k = 0; k < fronts.size(); k++) {
            int[] members = fronts.get(k).clone();
            Arrays.sort(members);
            for (int index : members) {
                if (ranks[index] != -1) {
                    throw new IllegalStateException(
                            "Solution " + index + " assigned to fronts " + ranks[index] + " and " + k);
                }
                ranks[index] = k;
            }
            built.add(new Front(k, members));
        }
        for (int i = 0; i < size; i++) {
            if (ranks[i] == -1) {
                throw new IllegalStateException("Solution " + i + " was not assigned to any front");
            }
        }
        return new RankingResult(ranks, Collections.unmodifiableList(built));
    }

    // ---------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------

    /**
     * @return number of ranked solutions
     */
    public int size() {
        return ranks.length;
    }

    /**
     * @param index position of the solution in the ranked population
     * @return its rank
     * @throws IndexOutOfBoundsException if {@code index} is out of range
     */
    public int rankOf(int index) {
        Objects.checkIndex(index, ranks.length);
        return ranks[index];
    }

    /**
     * @return copy of the rank array, indexed by population position
     */
    public int[] ranks() {
        return ranks.clone();
    }

    public int frontCount() {
        return fronts.size();
    }

    /**
     * @return unmodifiable list of fronts in rank order
     */
    public List<Front> fronts() {
        return fronts;
    }

    /**
     * @param rank front index
     * @return the front with that rank
     * @throws IndexOutOfBoundsException if no such front exists
     */
    public Front front(int rank) {
        return fronts.get(rank);
    }

    /**
     * Pair every solution of {@code population} with its rank, in input
     * order.
     *
     * @param population the population that produced this result
     * @return unmodifiable list of ranked solutions
     * @throws IllegalArgumentException if the population size differs from
     *                                  this result's size
     */
    public List<RankedSolution> rankedSolutions(Population population) {
        Objects.requireNonNull(population, "Population must not be null");
        if (population.size() != ranks.length) {
            throw new IllegalArgumentException(
                    "Population has " + population.size() + " solution(s) but result has " + ranks.length);
        }
        List<RankedSolution> out = new ArrayList<>(ranks.length);
        for (int i = 0; i < ranks.length; i++) {
            out.add(new RankedSolution(population.get(i), ranks[i]));
        }
        return Collections.unmodifiableList(out);
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof RankingResult that))
            return false;
        return Arrays.equals(ranks, that.ranks);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(ranks);
    }

    @Override
    public String toString() {
        return "RankingResult{size=" + ranks.length + ", fronts=" + fronts + '}';
    }
}
