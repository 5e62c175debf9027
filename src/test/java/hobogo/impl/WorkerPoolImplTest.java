package hobogo.impl;

import hobogo.contracts.TimeManager;
import hobogo.records.SearchInfo;
import hobogo.records.SearchResult;
import hobogo.records.SearchSpec;
import hobogo.rules.GameState;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class WorkerPoolImplTest {

    private final TimeManager tm = new TimeManagerImpl();
    private WorkerPoolImpl pool;

    @AfterEach
    void shutdown() {
        if (pool != null) pool.close();
    }

    @Test
    void iterationBudgetIsSharedBetweenWorkers() throws Exception {
        pool = new WorkerPoolImpl(2);
        SearchResult r = pool.startSearch(GameState.newGame(5, 2, 0), SearchSpec.ofIterations(1_000, 3), tm, null)
                .get(30, TimeUnit.SECONDS);

        assertEquals(1_000, r.iterations());
        assertEquals(1_000, r.rootVisits().values().stream().mapToLong(Long::longValue).sum());
        assertTrue(r.bestAction().isPresent());
        assertEquals(1_000, pool.totalIterations());
    }

    @Test
    void terminalRootReturnsNoDecision() throws Exception {
        pool = new WorkerPoolImpl(2);
        GameState over = new PositionCodecImpl().fromText("01/10 0 2");
        SearchResult r = pool.startSearch(over, SearchSpec.ofIterations(200, 1), tm, null).get(5, TimeUnit.SECONDS);

        assertTrue(r.bestAction().isEmpty());
        assertEquals(0, r.iterations());
    }

    @Test
    void fixedSeedIsReproducible() throws Exception {
        pool = new WorkerPoolImpl(2);
        GameState root = GameState.newGame(5, 3, 0);
        SearchResult a = pool.startSearch(root, SearchSpec.ofIterations(600, 77), tm, null).get(30, TimeUnit.SECONDS);
        SearchResult b = pool.startSearch(root, SearchSpec.ofIterations(600, 77), tm, null).get(30, TimeUnit.SECONDS);

        assertEquals(a.rootVisits(), b.rootVisits());
        assertEquals(a.bestAction(), b.bestAction());
    }

    @Test
    void stopEndsAnInfiniteSearch() throws Exception {
        pool = new WorkerPoolImpl(2);
        SearchSpec spec = new SearchSpec.Builder().infinite(true).seed(5L).build();
        CompletableFuture<SearchResult> f = pool.startSearch(GameState.newGame(7, 2, 0), spec, tm, null);

        Thread.sleep(100);
        assertFalse(f.isDone());
        pool.stopSearch();

        SearchResult r = f.get(10, TimeUnit.SECONDS);
        assertTrue(r.iterations() > 0);
        assertTrue(r.bestAction().isPresent());
    }

    @Test
    void moveTimeIsRespected() throws Exception {
        pool = new WorkerPoolImpl(1);
        long t0 = System.currentTimeMillis();
        SearchResult r = pool.startSearch(GameState.newGame(9, 2, 0), SearchSpec.ofMoveTime(200), tm, null)
                .get(10, TimeUnit.SECONDS);
        long elapsed = System.currentTimeMillis() - t0;

        assertTrue(r.bestAction().isPresent());
        assertTrue(elapsed < 2_000, "took " + elapsed + " ms");
    }

    @Test
    void mainWorkerReportsProgress() throws Exception {
        pool = new WorkerPoolImpl(2);
        pool.setInfoIntervalMs(1);
        List<SearchInfo> infos = new CopyOnWriteArrayList<>();
        pool.startSearch(GameState.newGame(5, 2, 0), SearchSpec.ofIterations(2_000, 9), tm, infos::add)
                .get(30, TimeUnit.SECONDS);

        assertFalse(infos.isEmpty());
        SearchInfo last = infos.get(infos.size() - 1);
        assertNotNull(last.bestAction());
        assertTrue(last.expectedShare() >= 0.0 && last.expectedShare() <= 1.0);
    }

    @Test
    void parallelismCanBeChanged() {
        pool = new WorkerPoolImpl();
        assertEquals(1, pool.getParallelism());
        pool.setParallelism(3);
        assertEquals(3, pool.getParallelism());
        assertThrows(IllegalArgumentException.class, () -> pool.setParallelism(0));
    }
}
