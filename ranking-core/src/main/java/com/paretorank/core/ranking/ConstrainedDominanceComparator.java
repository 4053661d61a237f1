package com.paretorank.core.ranking;

import com.paretorank.core.model.Solution;

/**
 * Feasibility-first dominance.
 *
 * <p>
 * The aggregate constraint violation is compared before the objectives: the
 * solution with the smaller violation dominates. Equal violations (in
 * particular two feasible solutions) fall back to
 * {@link ParetoDominanceComparator}, including its {@code NaN} policy.
 * </p>
 *
 * <p>
 * {@link Solution} rejects {@code NaN} violations, which keeps this ordering
 * lexicographic and therefore acyclic.
 * </p>
 *
 * @since 1.0.0
 */
public final class ConstrainedDominanceComparator implements DominanceComparator {

    private static final long serialVersionUID = 1L;

    static final ConstrainedDominanceComparator INSTANCE = new ConstrainedDominanceComparator();

    /** Configuration name of this comparator. */
    public static final String NAME = "constrained";

    private ConstrainedDominanceComparator() {
    }

    @Override
    public DominanceRelation compare(Solution a, Solution b) {
        double av = a.getConstraintViolation();
        double bv = b.getConstraintViolation();

        if (av < bv) {
            return DominanceRelation.DOMINATES;
        }
        if (bv < av) {
            return DominanceRelation.DOMINATED_BY;
        }
        return ParetoDominanceComparator.INSTANCE.compare(a, b);
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
        return "ConstrainedDominanceComparator";
    }
}
