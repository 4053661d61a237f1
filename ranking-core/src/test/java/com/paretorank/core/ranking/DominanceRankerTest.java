package com.paretorank.core.ranking;

import com.paretorank.core.config.RankerConfig;
import com.paretorank.core.model.InvalidInputException;
import com.paretorank.core.model.Population;
import com.paretorank.core.model.RankedSolution;
import com.paretorank.core.model.RankingResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link DominanceRanker}.
 */
class DominanceRankerTest {

    @Test
    @DisplayName("Should rank through the default sequential sorter")
    void shouldRankWithDefaults() {
        try (DominanceRanker ranker = DominanceRanker.create()) {
            RankingResult result = ranker.rank(Population.of(
                    new double[] {1, 1},
                    new double[] {2, 2},
                    new double[] {3, 3}));

            assertThat(ranker.getSorter()).isInstanceOf(FastNonDominatedSorter.class);
            assertThat(result.ranks()).containsExactly(0, 1, 2);
        }
    }

    @Test
    @DisplayName("Should rank through a configured parallel sorter")
    void shouldRankFromConfig() {
        RankerConfig config = new RankerConfig();
        config.setStrategy("parallel");
        config.setParallelism(2);
        config.setParallelThreshold(0);

        try (DominanceRanker ranker = DominanceRanker.fromConfig(config)) {
            RankingResult result = ranker.rank(Population.of(
                    new double[] {2, 2},
                    new double[] {2, 2},
                    new double[] {2, 2}));

            assertThat(result.ranks()).containsExactly(0, 0, 0);
        }
    }

    @Test
    @DisplayName("Should leave the population untouched and expose ranks per solution")
    void shouldNotMutatePopulation() {
        Population population = Population.of(new double[] {5, 5}, new double[] {1, 4});
        Population copy = Population.of(population.getSolutions());

        try (DominanceRanker ranker = DominanceRanker.create()) {
            List<RankedSolution> ranked = ranker.rank(population).rankedSolutions(population);

            assertThat(population).isEqualTo(copy);
            assertThat(ranked).extracting(r -> r.getSolution().getId()).containsExactly("0", "1");
            assertThat(ranked).extracting(RankedSolution::getRank).containsExactly(1, 0);
        }
    }

    @Test
    @DisplayName("Should surface invalid input before ranking")
    void shouldSurfaceInvalidInput() {
        try (DominanceRanker ranker = DominanceRanker.create()) {
            assertThatThrownBy(() -> ranker.rank(Population.of(new double[] {1}, new double[] {1, 2})))
                    .isInstanceOf(InvalidInputException.class);
        }
    }

    @Test
    @DisplayName("Should reject a null population")
    void shouldRejectNullPopulation() {
        try (DominanceRanker ranker = DominanceRanker.create()) {
            assertThatThrownBy(() -> ranker.rank(null))
                    .isInstanceOf(NullPointerException.class)
                    .hasMessageContaining("Population");
        }
    }
}
