package com.paretorank.core.ranking;

import com.paretorank.core.model.Solution;

/**
 * Pareto dominance on minimised objectives.
 *
 * <p>
 * {@code a} dominates {@code b} iff {@code a[i] <= b[i]} for every objective
 * {@code i} and {@code a[j] < b[j]} for at least one {@code j}.
 * </p>
 *
 * <ul>
 * <li>Identical vectors are {@link DominanceRelation#NON_DOMINATED}.</li>
 * <li>If either vector holds a {@code NaN} at any index, the pair is
 * {@link DominanceRelation#NON_DOMINATED}, whatever the other values are.</li>
 * </ul>
 *
 * <p>
 * Stateless; use {@link DominanceComparator#pareto()}.
 * </p>
 *
 * @since 1.0.0
 */
public final class ParetoDominanceComparator implements DominanceComparator {

    private static final long serialVersionUID = 1L;

    static final ParetoDominanceComparator INSTANCE = new ParetoDominanceComparator();

    /** Configuration name of this comparator. */
    public static final String NAME = "pareto";

    private ParetoDominanceComparator() {
    }

    @Override
    public DominanceRelation compare(Solution a, Solution b) {
        int dimension = a.dimension();
        boolean aBetterSomewhere = false;
        boolean bBetterSomewhere = false;

        for (int i = 0; i < dimension; i++) {
            double av = a.getObjective(i);
            double bv = b.getObjective(i);
            if (Double.isNaN(av) || Double.isNaN(bv)) {
                return DominanceRelation.NON_DOMINATED;
            }
            if (av < bv) {
                aBetterSomewhere = true;
            } else if (bv < av) {
                bBetterSomewhere = true;
            }
        }

        if (aBetterSomewhere == bBetterSomewhere) {
            // both better somewhere (trade-off) or neither (equal vectors)
            return DominanceRelation.NON_DOMINATED;
        }
        return aBetterSomewhere ? DominanceRelation.DOMINATES : DominanceRelation.DOMINATED_BY;
    }

    @Override
    public String getName() {
        return NAME;
    }

    private Object readResolve() {
        return INSTANCE;
    }

    @Override
    public String toString() {
        return "ParetoDominanceComparator";
    }
}
