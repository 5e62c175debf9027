package hobogo.impl;

import hobogo.contracts.InfoHandler;
import hobogo.contracts.TimeManager;
import hobogo.contracts.WorkerPool;
import hobogo.records.Action;
import hobogo.records.SearchResult;
import hobogo.records.SearchSpec;
import hobogo.records.TimeAllocation;
import hobogo.rules.GameState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SplittableRandom;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import static hobogo.constants.CoreConstants.DEFAULT_EXPLORATION;
import static hobogo.constants.CoreConstants.DEFAULT_INFO_INTERVAL_MS;

/**
 * Root-parallel search: every worker thread grows its own tree over its own copy of
 * the root, seeded from one base seed. When all workers are done their root visit
 * counts are summed and the most visited action wins.
 */
public final class WorkerPoolImpl implements WorkerPool {

    private static final Logger LOG = LoggerFactory.getLogger(WorkerPoolImpl.class);
    private static final AtomicInteger POOL_IDS = new AtomicInteger();

    private int parallelism;
    private ExecutorService executor;
    private volatile double exploration = DEFAULT_EXPLORATION;
    private volatile long infoIntervalMs = DEFAULT_INFO_INTERVAL_MS;

    private final AtomicBoolean stopFlag = new AtomicBoolean(false);
    private final AtomicLong totalIterations = new AtomicLong(0);

    public WorkerPoolImpl(int threads) {
        if (threads < 1) throw new IllegalArgumentException("threads must be >= 1");
        this.parallelism = threads;
        this.executor = newExecutor(threads);
    }

    public WorkerPoolImpl() {
        this(1);
    }

    @Override
    public synchronized void setParallelism(int threads) {
        if (threads < 1) throw new IllegalArgumentException("threads must be >= 1");
        if (threads == this.parallelism) return;
        executor.shutdown();
        this.parallelism = threads;
        this.executor = newExecutor(threads);
        LOG.info("Worker pool resized to {} thread(s)", threads);
    }

    @Override public synchronized int getParallelism() { return parallelism; }

    @Override public void setExploration(double c) { this.exploration = c; }

    @Override public void setInfoIntervalMs(long ms) { this.infoIntervalMs = Math.max(1, ms); }

    @Override
    public synchronized CompletableFuture<SearchResult> startSearch(GameState root, SearchSpec spec,
                                                                    TimeManager tm, InfoHandler ih) {
        stopFlag.set(false);
        totalIterations.set(0);
        long startMs = System.currentTimeMillis();

        if (root.isTerminal()) {
            return CompletableFuture.completedFuture(SearchResult.none(0));
        }

        TimeAllocation limits = tm.calculate(spec, root);
        InfoHandler handler = ih != null ? ih : InfoHandler.NONE;
        long baseSeed = spec.seed() != null ? spec.seed() : System.nanoTime();
        long budget = spec.iterations() > 0 ? (spec.iterations() + parallelism - 1) / parallelism : 0;

        LOG.debug("Search start: {} worker(s), soft={}ms hard={}ms, budget={} iterations/worker",
                parallelism, limits.soft(), limits.maximum(), budget);

        List<CompletableFuture<SearchWorkerImpl.Outcome>> parts = new ArrayList<>(parallelism);
        SplittableRandom seeds = new SplittableRandom(baseSeed);
        for (int i = 0; i < parallelism; i++) {
            SearchWorkerImpl worker = new SearchWorkerImpl(this, i == 0, exploration);
            SplittableRandom rng = seeds.split();
            GameState snapshot = root.copy();
            parts.add(CompletableFuture.supplyAsync(
                    () -> worker.run(snapshot, spec, budget, limits, rng, handler, infoIntervalMs, startMs),
                    executor));
        }

        return CompletableFuture.allOf(parts.toArray(new CompletableFuture[0]))
                .thenApply(v -> merge(parts, System.currentTimeMillis() - startMs));
    }

    private static SearchResult merge(List<CompletableFuture<SearchWorkerImpl.Outcome>> parts, long timeMs) {
        Map<Action, Long> visits = new LinkedHashMap<>();
        Map<Action, Double> weighted = new LinkedHashMap<>();
        long iterations = 0;
        int treeSize = 0;
        for (CompletableFuture<SearchWorkerImpl.Outcome> part : parts) {
            SearchWorkerImpl.Outcome o = part.join();
            iterations += o.iterations();
            if (treeSize == 0) treeSize = o.treeSize();
            o.rootVisits().forEach((a, n) -> {
                visits.merge(a, n, Long::sum);
                weighted.merge(a, o.rootRewards().get(a) * n, Double::sum);
            });
        }

        Action best = null;
        long bestVisits = -1;
        for (Map.Entry<Action, Long> e : visits.entrySet()) {
            if (e.getValue() > bestVisits) {
                bestVisits = e.getValue();
                best = e.getKey();
            }
        }
        double share = best == null || bestVisits == 0 ? 0.0 : weighted.get(best) / bestVisits;
        return new SearchResult(Optional.ofNullable(best), iterations, treeSize, visits, share, timeMs);
    }

    void countIteration() { totalIterations.incrementAndGet(); }
    boolean isStopped()   { return stopFlag.get(); }

    @Override public long totalIterations() { return totalIterations.get(); }
    @Override public void stopSearch()      { stopFlag.set(true); }

    @Override
    public synchronized void close() {
        stopFlag.set(true);
        executor.shutdownNow();
    }

    private static ExecutorService newExecutor(int threads) {
        int poolId = POOL_IDS.incrementAndGet();
        AtomicInteger n = new AtomicInteger();
        ThreadFactory factory = r -> {
            Thread t = new Thread(r, "Hobogo-Worker-" + poolId + "-" + n.getAndIncrement());
            t.setDaemon(true);
            return t;
        };
        return Executors.newFixedThreadPool(threads, factory);
    }
}
