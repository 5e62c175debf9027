package hobogo.contracts;

import hobogo.rules.GameState;
import hobogo.records.SearchResult;
import hobogo.records.SearchSpec;

import java.util.concurrent.CompletableFuture;

/**
 * Bot decision façade: hand over a snapshot, get back one action (or none).
 */
public interface Search extends AutoCloseable {
    void setThreads(int workerCount);
    int getThreads();
    void setExploration(double c);
    void setInfoIntervalMs(long ms);
    void setWorkerPool(WorkerPool pool);
    void setTimeManager(TimeManager tm);

    /** Blocks until the budget in {@code spec} is used up or {@link #stop()} is called. */
    SearchResult search(GameState state, SearchSpec spec, InfoHandler ih);
    CompletableFuture<SearchResult> searchAsync(GameState state, SearchSpec spec, InfoHandler ih);

    void stop();
    @Override
    void close();
}
