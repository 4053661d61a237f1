package com.paretorank.core.ranking;

import com.paretorank.core.model.Population;
import com.paretorank.core.model.RankingResult;
import com.paretorank.core.model.Solution;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicIntegerArray;

/**
 * Multi-threaded fast non-dominated sort.
 *
 * <h3>Pairwise stage</h3>
 * <p>
 * The rows of the domination graph are split into contiguous blocks, one
 * block per worker. A worker compares each of its rows {@code i} against
 * every other solution and writes only row {@code i}: the dominated list of
 * {@code i} and the domination counter of {@code i}. Blocks are disjoint, so
 * no comparison is counted twice or lost and no locking is needed.
 * </p>
 *
 * <h3>Peeling stage</h3>
 * <p>
 * Fronts are resolved one after another. Within a large front the members
 * are split across workers and counters are decremented through an
 * {@link AtomicIntegerArray}, since one solution may be dominated by several
 * members of the same front. Exactly one worker observes a counter reach
 * zero, so each solution joins the next front once.
 * </p>
 *
 * <p>
 * Populations smaller than {@code parallelThreshold} are handed to a
 * {@link FastNonDominatedSorter}. The result is always identical to the
 * sequential sorter's.
 * </p>
 *
 * <h3>Lifecycle</h3>
 * <p>
 * The sorter owns a fixed pool of daemon threads; call {@link #close()} when
 * done. Population data is never kept between calls.
 * </p>
 *
 * @since 1.0.0
 */
public class ParallelNonDominatedSorter implements NonDominatedSorter {

    private static final Logger LOG = LoggerFactory.getLogger(ParallelNonDominatedSorter.class);

    /** Strategy name used in configuration. */
    public static final String NAME = "parallel";

    /** Fronts smaller than this are peeled on the calling thread. */
    static final int MIN_PARALLEL_FRONT_SIZE = 64;

    private final DominanceComparator comparator;
    private final int parallelism;
    private final int parallelThreshold;
    private final FastNonDominatedSorter fallback;
    private final ExecutorService executor;

    /**
     * @param comparator        dominance predicate; must not be {@code null}
     * @param parallelism       number of worker threads, {@code >= 1}
     * @param parallelThreshold population size from which workers are used,
     *                          {@code >= 0}
     * @throws NullPointerException     if {@code comparator} is {@code null}
     * @throws IllegalArgumentException if a numeric argument is out of range
     */
    public ParallelNonDominatedSorter(DominanceComparator comparator, int parallelism, int parallelThreshold) {
        this.comparator = Objects.requireNonNull(comparator, "DominanceComparator must not be null");
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be >= 1, got: " + parallelism);
        }
        if (parallelThreshold < 0) {
            throw new IllegalArgumentException("parallelThreshold must be >= 0, got: " + parallelThreshold);
        }
        this.parallelism = parallelism;
        this.parallelThreshold = parallelThreshold;
        this.fallback = new FastNonDominatedSorter(comparator);
        this.executor = Executors.newFixedThreadPool(parallelism, new WorkerThreadFactory());
        LOG.info("Parallel sorter started with {} worker(s), threshold={}", parallelism, parallelThreshold);
    }

    @Override
    public RankingResult sort(Population population) {
        Objects.requireNonNull(population, "Population must not be null");
        population.validate();

        int n = population.size();
        if (n == 0) {
            return RankingResult.empty();
        }
        if (n < parallelThreshold || parallelism == 1) {
            LOG.trace("Population of {} below parallel threshold {}; sorting sequentially", n, parallelThreshold);
            return fallback.sort(population);
        }

        List<Solution> solutions = population.normalized();
        DominanceGraph graph = buildGraph(solutions);
        List<int[]> fronts = peelFronts(graph);
        RankingResult result = RankingResult.fromFronts(n, fronts);

        LOG.debug("Ranked {} solution(s) into {} front(s) on {} worker(s)",
                n, result.frontCount(), parallelism);
        return result;
    }

    // ---------------------------------------------------------------
    // Pairwise stage
    // ---------------------------------------------------------------

    private DominanceGraph buildGraph(List<Solution> solutions) {
        int n = solutions.size();
        DominanceGraph graph = new DominanceGraph(n);
        int blocks = Math.min(parallelism, n);
        int blockSize = (n + blocks - 1) / blocks;

        List<Callable<Void>> tasks = new ArrayList<>(blocks);
        for (int from = 0; from < n; from += blockSize) {
            int lo = from;
            int hi = Math.min(n, from + blockSize);
            tasks.add(() -> {
                fillRows(graph, solutions, lo, hi);
                return null;
            });
        }
        invokeAll(tasks);
        return graph;
    }

    private void fillRows(DominanceGraph graph, List<Solution> solutions, int lo, int hi) {
        int n = solutions.size();
        for (int i = lo; i < hi; i++) {
            Solution a = solutions.get(i);
            for (int j = 0; j < n; j++) {
                if (j == i) {
                    continue;
                }
                DominanceRelation relation = comparator.compare(a, solutions.get(j));
                if (relation == DominanceRelation.DOMINATES) {
                    graph.appendDominated(i, j);
                } else if (relation == DominanceRelation.DOMINATED_BY) {
                    graph.incrementDominationCount(i);
                }
            }
        }
    }

    // ---------------------------------------------------------------
    // Peeling stage
    // ---------------------------------------------------------------

    private List<int[]> peelFronts(DominanceGraph graph) {
        AtomicIntegerArray remaining = new AtomicIntegerArray(graph.dominationCounts());
        List<int[]> fronts = new ArrayList<>();
        int[] current = graph.firstFront();

        while (current.length > 0) {
            fronts.add(current);
            int[] next = current.length < MIN_PARALLEL_FRONT_SIZE
                    ? releaseDominated(graph, remaining, current, 0, current.length)
                    : releaseDominatedInParallel(graph, remaining, current);
            Arrays.sort(next);
            current = next;
        }
        return fronts;
    }

    private int[] releaseDominatedInParallel(DominanceGraph graph, AtomicIntegerArray remaining, int[] front) {
        int blocks = Math.min(parallelism, front.length);
        int blockSize = (front.length + blocks - 1) / blocks;

        List<Callable<int[]>> tasks = new ArrayList<>(blocks);
        for (int from = 0; from < front.length; from += blockSize) {
            int lo = from;
            int hi = Math.min(front.length, from + blockSize);
            tasks.add(() -> releaseDominated(graph, remaining, front, lo, hi));
        }

        List<int[]> partials = invokeAll(tasks);
        int total = 0;
        for (int[] part : partials) {
            total += part.length;
        }
        int[] merged = new int[total];
        int offset = 0;
        for (int[] part : partials) {
            System.arraycopy(part, 0, merged, offset, part.length);
            offset += part.length;
        }
        return merged;
    }

    private static int[] releaseDominated(DominanceGraph graph, AtomicIntegerArray remaining,
            int[] front, int lo, int hi) {
        int[] released = new int[graph.size()];
        int n = 0;
        for (int m = lo; m < hi; m++) {
            for (int q : graph.dominatedBy(front[m])) {
                if (remaining.decrementAndGet(q) == 0) {
                    released[n++] = q;
                }
            }
        }
        return Arrays.copyOf(released, n);
    }

    // ---------------------------------------------------------------
    // Executor plumbing
    // ---------------------------------------------------------------

    private <T> List<T> invokeAll(List<Callable<T>> tasks) {
        try {
            List<Future<T>> futures = executor.invokeAll(tasks);
            List<T> results = new ArrayList<>(futures.size());
            for (Future<T> future : futures) {
                results.add(future.get());
            }
            return results;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while ranking population", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            if (cause instanceof Error err) {
                throw err;
            }
            throw new IllegalStateException("Ranking worker failed", cause);
        }
    }

    @Override
    public void close() {
        executor.shutdownNow();
        LOG.info("Parallel sorter stopped");
    }

    public int getParallelism() {
        return parallelism;
    }

    public int getParallelThreshold() {
        return parallelThreshold;
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
        return "ParallelNonDominatedSorter{comparator=" + comparator.getName()
                + ", parallelism=" + parallelism
                + ", parallelThreshold=" + parallelThreshold + '}';
    }

    private static final class WorkerThreadFactory implements ThreadFactory {

        private final AtomicInteger sequence = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "ranker-worker-" + sequence.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
