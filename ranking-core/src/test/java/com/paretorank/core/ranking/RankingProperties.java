package com.paretorank.core.ranking;

import com.paretorank.core.model.Population;
import com.paretorank.core.model.RankingResult;
import com.paretorank.core.model.Solution;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Shared checks for the layering guarantees every sorter must meet, plus a
 * seeded population generator.
 */
final class RankingProperties {

    private RankingProperties() {
    }

    /**
     * Assert the result is a correct layering of the domination order.
     */
    static void assertValidLayering(Population population, RankingResult result, DominanceComparator comparator) {
        int n = population.size();
        assertThat(result.size()).isEqualTo(n);

        int[] ranks = result.ranks();
        int maxRank = -1;
        boolean[] used = new boolean[n + 1];
        for (int r : ranks) {
            assertThat(r).isBetween(0, n - 1);
            used[r] = true;
            maxRank = Math.max(maxRank, r);
        }
        // contiguous from 0
        for (int r = 0; r <= maxRank; r++) {
            assertThat(used[r]).as("rank %d in use", r).isTrue();
        }
        assertThat(result.frontCount()).isEqualTo(maxRank + 1);

        List<Solution> solutions = population.normalized();
        for (int a = 0; a < n; a++) {
            for (int b = 0; b < n; b++) {
                if (a == b) {
                    continue;
                }
                boolean aDominatesB = comparator.dominates(solutions.get(a), solutions.get(b));
                if (aDominatesB) {
                    assertThat(ranks[a])
                            .as("%s dominates %s so must rank lower", solutions.get(a), solutions.get(b))
                            .isLessThan(ranks[b]);
                }
            }
        }

        // every solution beyond front 0 is dominated by someone exactly one front up
        for (int b = 0; b < n; b++) {
            if (ranks[b] == 0) {
                continue;
            }
            boolean hasParent = false;
            for (int a = 0; a < n && !hasParent; a++) {
                hasParent = ranks[a] == ranks[b] - 1
                        && comparator.dominates(solutions.get(a), solutions.get(b));
            }
            assertThat(hasParent).as("solution %d in front %d has a dominator in front %d", b, ranks[b], ranks[b] - 1)
                    .isTrue();
        }
    }

    /**
     * Random population on a coarse grid so that duplicates and ties are
     * common; roughly {@code nanRate} of the solutions get one NaN objective.
     */
    static Population randomPopulation(long seed, int size, int dimension, double nanRate) {
        Random random = new Random(seed);
        List<Solution> solutions = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            double[] objectives = new double[dimension];
            for (int k = 0; k < dimension; k++) {
                objectives[k] = random.nextInt(10) - 3;
            }
            if (random.nextDouble() < nanRate) {
                objectives[random.nextInt(dimension)] = Double.NaN;
            }
            solutions.add(new Solution("s" + i, objectives));
        }
        return Population.of(solutions);
    }

    /**
     * Like {@link #randomPopulation} but with random constraint violations,
     * half of the solutions feasible.
     */
    static Population randomConstrainedPopulation(long seed, int size, int dimension) {
        Random random = new Random(seed);
        List<Solution> solutions = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            double[] objectives = new double[dimension];
            for (int k = 0; k < dimension; k++) {
                objectives[k] = random.nextInt(8);
            }
            double violation = random.nextBoolean() ? 0.0 : random.nextInt(4) + 1;
            solutions.add(new Solution("s" + i, objectives, violation));
        }
        return Population.of(solutions);
    }
}
