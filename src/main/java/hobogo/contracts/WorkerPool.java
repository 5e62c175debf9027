package hobogo.contracts;

import hobogo.rules.GameState;
import hobogo.records.SearchResult;
import hobogo.records.SearchSpec;

import java.util.concurrent.CompletableFuture;

/**
 * Runs one decision on one or more worker threads. Every worker owns a private
 * copy of the root state and a private tree; only finished results are merged.
 */
public interface WorkerPool extends AutoCloseable {

    /* one-off configuration */
    void setParallelism(int threads);
    int getParallelism();
    void setExploration(double c);
    void setInfoIntervalMs(long ms);

    /* search life-cycle */
    CompletableFuture<SearchResult> startSearch(GameState root, SearchSpec spec, TimeManager tm, InfoHandler ih);

    /** Cooperative: workers finish their current iteration, then stop. */
    void stopSearch();

    long totalIterations();

    /* infra */
    @Override void close();
}
