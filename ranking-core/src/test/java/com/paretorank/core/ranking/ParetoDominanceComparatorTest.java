package com.paretorank.core.ranking;

import com.paretorank.core.model.Solution;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link ParetoDominanceComparator}.
 */
class ParetoDominanceComparatorTest {

    private final DominanceComparator comparator = DominanceComparator.pareto();

    @Test
    @DisplayName("Should dominate when no worse anywhere and better somewhere")
    void shouldDominateWhenBetterInOneObjective() {
        Solution a = Solution.of("a", 1, 2);
        Solution b = Solution.of("b", 1, 3);

        assertThat(comparator.compare(a, b)).isEqualTo(DominanceRelation.DOMINATES);
        assertThat(comparator.compare(b, a)).isEqualTo(DominanceRelation.DOMINATED_BY);
        assertThat(comparator.dominates(a, b)).isTrue();
        assertThat(comparator.dominates(b, a)).isFalse();
    }

    @Test
    @DisplayName("Should treat a trade-off as non-dominated")
    void shouldNotDominateOnTradeOff() {
        Solution a = Solution.of("a", 1, 4);
        Solution b = Solution.of("b", 4, 1);

        assertThat(comparator.compare(a, b)).isEqualTo(DominanceRelation.NON_DOMINATED);
        assertThat(comparator.compare(b, a)).isEqualTo(DominanceRelation.NON_DOMINATED);
    }

    @Test
    @DisplayName("Should never let identical vectors dominate each other")
    void shouldNotDominateOnEqualVectors() {
        Solution a = Solution.of("a", 2, 2);
        Solution b = Solution.of("b", 2, 2);

        assertThat(comparator.dominates(a, b)).isFalse();
        assertThat(comparator.dominates(b, a)).isFalse();
        assertThat(comparator.dominates(a, a)).isFalse();
    }

    @Test
    @DisplayName("Should treat any NaN objective as non-dominated, even against a clearly worse vector")
    void shouldNotDominateWhenNaNPresent() {
        Solution withNaN = Solution.of("nan", Double.NaN, 2);
        Solution better = Solution.of("better", 0, 0);
        Solution worse = Solution.of("worse", 9, 9);

        assertThat(comparator.compare(better, withNaN)).isEqualTo(DominanceRelation.NON_DOMINATED);
        assertThat(comparator.compare(withNaN, worse)).isEqualTo(DominanceRelation.NON_DOMINATED);
        assertThat(comparator.compare(withNaN, withNaN)).isEqualTo(DominanceRelation.NON_DOMINATED);
    }

    @Test
    @DisplayName("Should honour the NaN policy when the NaN is in the last objective")
    void shouldCheckNaNAfterADecidingObjective() {
        Solution a = Solution.of("a", 0, Double.NaN);
        Solution b = Solution.of("b", 5, 5);

        assertThat(comparator.compare(a, b)).isEqualTo(DominanceRelation.NON_DOMINATED);
    }

    @Test
    @DisplayName("Should handle negative values and single objectives")
    void shouldCompareNegativeSingleObjective() {
        assertThat(comparator.compare(Solution.of("a", -3), Solution.of("b", -1)))
                .isEqualTo(DominanceRelation.DOMINATES);
    }

    @Test
    @DisplayName("Should treat negative and positive zero as equal")
    void shouldTreatSignedZerosAsEqual() {
        assertThat(comparator.compare(Solution.of("a", -0.0, 1), Solution.of("b", 0.0, 1)))
                .isEqualTo(DominanceRelation.NON_DOMINATED);
    }

    @Test
    @DisplayName("Inverse relation swaps the two sides")
    void shouldInvertRelation() {
        assertThat(DominanceRelation.DOMINATES.inverse()).isEqualTo(DominanceRelation.DOMINATED_BY);
        assertThat(DominanceRelation.NON_DOMINATED.inverse()).isEqualTo(DominanceRelation.NON_DOMINATED);
    }
}
