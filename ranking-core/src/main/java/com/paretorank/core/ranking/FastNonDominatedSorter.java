package com.paretorank.core.ranking;

import com.paretorank.core.model.Population;
import com.paretorank.core.model.RankingResult;
import com.paretorank.core.model.Solution;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Single-threaded fast non-dominated sort (Deb et al., NSGA-II).
 *
 * <h3>Algorithm</h3>
 * <ol>
 * <li>Compare every unordered pair once; the {@link DominanceRelation}
 * answers both directions. Each solution gets a domination counter and a
 * list of the solutions it dominates.</li>
 * <li>Front 0 is every solution whose counter is zero.</li>
 * <li>For each member of the current front, decrement the counter of every
 * solution it dominates; those reaching zero form the next front.</li>
 * </ol>
 *
 * <p>
 * {@code O(M·N²)} comparisons and {@code O(N²)} memory in the worst case.
 * This is the reference implementation other strategies are checked against.
 * </p>
 *
 * @since 1.0.0
 */
public class FastNonDominatedSorter implements NonDominatedSorter {

    private static final Logger LOG = LoggerFactory.getLogger(FastNonDominatedSorter.class);

    /** Strategy name used in configuration. */
    public static final String NAME = "sequential";

    private final DominanceComparator comparator;

    /**
     * Create a sorter using plain Pareto dominance.
     */
    public FastNonDominatedSorter() {
        this(DominanceComparator.pareto());
    }

    /**
     * @param comparator dominance predicate; must not be {@code null}
     * @throws NullPointerException if {@code comparator} is {@code null}
     */
    public FastNonDominatedSorter(DominanceComparator comparator) {
        this.comparator = Objects.requireNonNull(comparator, "DominanceComparator must not be null");
    }

    @Override
    public RankingResult sort(Population population) {
        Objects.requireNonNull(population, "Population must not be null");
        population.validate();

        int n = population.size();
        if (n == 0) {
            LOG.debug("Empty population: nothing to rank");
            return RankingResult.empty();
        }

        DominanceGraph graph = buildGraph(population.normalized());
        List<int[]> fronts = graph.peelFronts();
        RankingResult result = RankingResult.fromFronts(n, fronts);

        LOG.debug("Ranked {} solution(s) into {} front(s) using {} dominance",
                n, result.frontCount(), comparator.getName());
        return result;
    }

    private DominanceGraph buildGraph(List<Solution> solutions) {
        int n = solutions.size();
        DominanceGraph graph = new DominanceGraph(n);

        for (int i = 0; i < n; i++) {
            Solution a = solutions.get(i);
            for (int j = i + 1; j < n; j++) {
                switch (comparator.compare(a, solutions.get(j))) {
                    case DOMINATES -> graph.addDomination(i, j);
                    case DOMINATED_BY -> graph.addDomination(j, i);
                    case NON_DOMINATED -> {
                        // same front is possible; no edge
                    }
                }
            }
        }
        return graph;
    }

    public DominanceComparator getComparator() {
        return comparator;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String toString() {
        return "FastNonDominatedSorter{comparator=" + comparator.getName() + '}';
    }
}
