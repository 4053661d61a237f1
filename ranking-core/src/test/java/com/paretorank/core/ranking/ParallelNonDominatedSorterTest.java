package com.paretorank.core.ranking;

import com.paretorank.core.model.InvalidInputException;
import com.paretorank.core.model.Population;
import com.paretorank.core.model.RankingResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ParallelNonDominatedSorter}, checked against the
 * sequential {@link FastNonDominatedSorter}.
 */
class ParallelNonDominatedSorterTest {

    private ParallelNonDominatedSorter sorter;
    private FastNonDominatedSorter reference;

    @BeforeEach
    void setUp() {
        sorter = new ParallelNonDominatedSorter(DominanceComparator.pareto(), 4, 0);
        reference = new FastNonDominatedSorter();
    }

    @AfterEach
    void tearDown() {
        sorter.close();
    }

    @Test
    @DisplayName("Should rank the diagonal example like the sequential sorter")
    void shouldRankDiagonalExample() {
        Population population = Population.of(
                new double[] {1, 4},
                new double[] {2, 3},
                new double[] {3, 2},
                new double[] {4, 1},
                new double[] {5, 5});

        assertThat(sorter.sort(population).ranks()).containsExactly(0, 0, 0, 0, 1);
    }

    @ParameterizedTest(name = "seed {0}")
    @ValueSource(longs = {11, 12, 13, 99, 2024})
    @DisplayName("Should match the sequential partition on random populations")
    void shouldMatchSequentialSorter(long seed) {
        Population population = RankingProperties.randomPopulation(seed, 400, 3, 0.05);

        RankingResult expected = reference.sort(population);
        RankingResult actual = sorter.sort(population);

        assertThat(actual).isEqualTo(expected);
        assertThat(actual.fronts()).isEqualTo(expected.fronts());
    }

    @Test
    @DisplayName("Should peel a large front across workers without losing members")
    void shouldPeelLargeFronts() {
        // 300 trade-off points in front 0, each dominating one point of front 1
        int n = 300;
        double[][] vectors = new double[2 * n][];
        for (int i = 0; i < n; i++) {
            vectors[i] = new double[] {i, n - i};
            vectors[n + i] = new double[] {i + 0.5, n - i + 0.5};
        }
        Population population = Population.of(vectors);

        RankingResult result = sorter.sort(population);

        assertThat(result).isEqualTo(reference.sort(population));
        assertThat(result.front(0).size()).isEqualTo(n);
        assertThat(result.front(1).size()).isEqualTo(n);
        RankingProperties.assertValidLayering(population, result, DominanceComparator.pareto());
    }

    @Test
    @DisplayName("Should match the sequential partition with constrained dominance")
    void shouldMatchSequentialConstrained() {
        Population population = RankingProperties.randomConstrainedPopulation(31L, 300, 2);

        try (ParallelNonDominatedSorter constrained =
                new ParallelNonDominatedSorter(DominanceComparator.constrained(), 3, 0)) {
            RankingResult expected = new FastNonDominatedSorter(DominanceComparator.constrained()).sort(population);
            assertThat(constrained.sort(population)).isEqualTo(expected);
        }
    }

    @Test
    @DisplayName("Should delegate small populations to the sequential sorter")
    void shouldFallBackBelowThreshold() {
        try (ParallelNonDominatedSorter thresholded =
                new ParallelNonDominatedSorter(DominanceComparator.pareto(), 2, 1_000)) {
            Population population = RankingProperties.randomPopulation(3L, 50, 2, 0.0);
            assertThat(thresholded.sort(population)).isEqualTo(reference.sort(population));
        }
    }

    @Test
    @DisplayName("Should fail fast on mismatched dimensions")
    void shouldRejectMismatchedDimensions() {
        Population population = Population.of(new double[] {1, 2}, new double[] {1, 2, 3});

        assertThatThrownBy(() -> sorter.sort(population))
                .isInstanceOf(InvalidInputException.class);
    }

    @Test
    @DisplayName("Should handle empty and single-solution populations")
    void shouldHandleDegenerateInput() {
        assertThat(sorter.sort(Population.empty()).frontCount()).isZero();
        assertThat(sorter.sort(Population.of(new double[] {0, 0})).ranks()).containsExactly(0);
    }

    @Test
    @DisplayName("Should reject illegal pool settings")
    void shouldRejectIllegalSettings() {
        assertThatThrownBy(() -> new ParallelNonDominatedSorter(DominanceComparator.pareto(), 0, 0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("parallelism");
        assertThatThrownBy(() -> new ParallelNonDominatedSorter(DominanceComparator.pareto(), 1, -1))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("parallelThreshold");
    }
}
