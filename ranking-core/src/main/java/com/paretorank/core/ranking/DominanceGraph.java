package com.paretorank.core.ranking;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Index-based domination graph of one population.
 *
 * <p>
 * For every solution {@code i} the graph keeps how many solutions dominate
 * {@code i} and the list of solutions {@code i} dominates. Solutions are
 * referred to by their population index only.
 * </p>
 *
 * <p>
 * Not thread-safe. The parallel sorter gives each worker a disjoint block of
 * rows, so writes never overlap.
 * </p>
 */
final class DominanceGraph {

    private static final int INITIAL_ROW_CAPACITY = 4;

    private final int size;
    private final int[] dominationCount;
    private final int[][] dominated;
    private final int[] dominatedSize;

    DominanceGraph(int size) {
        this.size = size;
        this.dominationCount = new int[size];
        this.dominated = new int[size][];
        this.dominatedSize = new int[size];
    }

    int size() {
        return size;
    }

    /**
     * Record that {@code dominator} dominates {@code target}: appends to the
     * dominator's row and bumps the target's counter.
     */
    void addDomination(int dominator, int target) {
        appendDominated(dominator, target);
        dominationCount[target]++;
    }

    /** Row-local half of {@link #addDomination}: touches row {@code dominator} only. */
    void appendDominated(int dominator, int target) {
        int[] row = dominated[dominator];
        int n = dominatedSize[dominator];
        if (row == null) {
            row = new int[INITIAL_ROW_CAPACITY];
        } else if (n == row.length) {
            row = Arrays.copyOf(row, n * 2);
        }
        row[n] = target;
        dominated[dominator] = row;
        dominatedSize[dominator] = n + 1;
    }

    /** Row-local counterpart: touches row {@code target} only. */
    void incrementDominationCount(int target) {
        dominationCount[target]++;
    }

    int dominationCount(int index) {
        return dominationCount[index];
    }

    /**
     * @return the indices {@code index} dominates, in discovery order
     */
    int[] dominatedBy(int index) {
        int n = dominatedSize[index];
        return n == 0 ? new int[0] : Arrays.copyOf(dominated[index], n);
    }

    /**
     * @return a copy of every domination counter
     */
    int[] dominationCounts() {
        return dominationCount.clone();
    }

    /**
     * @return ascending indices nobody dominates
     */
    int[] firstFront() {
        int[] buf = new int[size];
        int n = 0;
        for (int i = 0; i < size; i++) {
            if (dominationCount[i] == 0) {
                buf[n++] = i;
            }
        }
        return Arrays.copyOf(buf, n);
    }

    /**
     * Peel the graph into fronts on a single thread. Counters are worked on
     * a copy so the graph can be peeled again.
     *
     * @return member indices per front, each ascending
     */
    List<int[]> peelFronts() {
        int[] remaining = dominationCounts();
        List<int[]> fronts = new ArrayList<>();
        int[] current = firstFront();

        while (current.length > 0) {
            fronts.add(current);
            int[] next = new int[size];
            int n = 0;
            for (int p : current) {
                int rowSize = dominatedSize[p];
                int[] row = dominated[p];
                for (int k = 0; k < rowSize; k++) {
                    int q = row[k];
                    if (--remaining[q] == 0) {
                        next[n++] = q;
                    }
                }
            }
            current = Arrays.copyOf(next, n);
            Arrays.sort(current);
        }
        return fronts;
    }
}
