package hobogo.impl;

import hobogo.contracts.*;
import hobogo.records.SearchResult;
import hobogo.records.SearchSpec;
import hobogo.rules.GameState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;

import static hobogo.constants.CoreConstants.DEFAULT_EXPLORATION;
import static hobogo.constants.CoreConstants.DEFAULT_INFO_INTERVAL_MS;

/**
 * Thin façade that delegates all heavy lifting to the configured WorkerPool.
 * The caller's state is copied before it is handed over, so the authoritative
 * game state is never touched by a search.
 */
public final class SearchImpl implements Search {

    private static final Logger LOG = LoggerFactory.getLogger(SearchImpl.class);

    /* configurable services */
    private WorkerPool  workerPool;
    private TimeManager timeManager;

    /* remembered for future pool swaps */
    private int requestedThreads = 1;
    private double exploration = DEFAULT_EXPLORATION;
    private long infoIntervalMs = DEFAULT_INFO_INTERVAL_MS;

    public SearchImpl(WorkerPool pool, TimeManager tm) {
        this.workerPool  = pool;
        this.timeManager = tm;
        if (pool != null) this.requestedThreads = pool.getParallelism();
    }

    /* ── setters required by Search interface ───────────────────── */

    @Override public void setThreads(int n) {
        this.requestedThreads = n;
        if (workerPool != null) workerPool.setParallelism(n);
    }

    @Override public int getThreads() {
        return workerPool != null ? workerPool.getParallelism() : requestedThreads;
    }

    @Override public void setExploration(double c) {
        this.exploration = c;
        if (workerPool != null) workerPool.setExploration(c);
    }

    @Override public void setInfoIntervalMs(long ms) {
        this.infoIntervalMs = ms;
        if (workerPool != null) workerPool.setInfoIntervalMs(ms);
    }

    @Override public void setWorkerPool(WorkerPool pool) {
        if (this.workerPool != null) this.workerPool.close();
        this.workerPool = pool;
        if (pool != null) {
            pool.setParallelism(requestedThreads);
            pool.setExploration(exploration);
            pool.setInfoIntervalMs(infoIntervalMs);
        }
    }

    @Override public void setTimeManager(TimeManager tm) { this.timeManager = tm; }

    /* ── synchronous / asynchronous search ─────────────────────── */

    @Override
    public SearchResult search(GameState state, SearchSpec spec, InfoHandler ih) {
        if (workerPool == null)
            throw new IllegalStateException("WorkerPool not set");
        LOG.debug("Searching for player {} of {}", state.nextPlayer(), state.numPlayers());
        SearchResult result = workerPool
                .startSearch(state.copy(), spec, timeManager, ih)
                .join(); // block caller
        LOG.debug("Search done: best={} after {} iterations in {} ms",
                result.bestAction().map(a -> a.name()).orElse("none"), result.iterations(), result.timeMs());
        return result;
    }

    @Override
    public CompletableFuture<SearchResult> searchAsync(GameState state, SearchSpec spec, InfoHandler ih) {
        GameState snapshot = state.copy();
        return CompletableFuture.supplyAsync(() -> search(snapshot, spec, ih));
    }

    @Override public void stop() { if (workerPool != null) workerPool.stopSearch(); }

    @Override
    public void close() {
        if (workerPool != null) workerPool.close();
    }
}
