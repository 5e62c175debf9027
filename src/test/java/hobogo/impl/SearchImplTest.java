package hobogo.impl;

import hobogo.contracts.InfoHandler;
import hobogo.contracts.Search;
import hobogo.records.Action;
import hobogo.records.SearchResult;
import hobogo.records.SearchSpec;
import hobogo.rules.GameState;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class SearchImplTest {

    private Search search;

    @BeforeEach
    void wire() {
        search = new SearchImpl(new WorkerPoolImpl(1), new TimeManagerImpl());
    }

    @AfterEach
    void shutdown() {
        search.close();
    }

    @Test
    void picksALegalActionAndLeavesTheCallerStateAlone() {
        GameState state = new PositionCodecImpl().fromText("....../.0..../....1./....../.1..0./...... 1 2");
        GameState before = state.copy();

        SearchResult r = search.search(state, SearchSpec.ofIterations(500, 4), InfoHandler.NONE);

        Action best = r.bestAction().orElseThrow();
        assertTrue(state.isLegal(best));
        assertEquals(before, state);
    }

    @Test
    void asyncSearchCompletes() throws Exception {
        SearchResult r = search.searchAsync(GameState.newGame(5, 2, 0), SearchSpec.ofIterations(300, 8), InfoHandler.NONE)
                .get(30, TimeUnit.SECONDS);
        assertEquals(300, r.iterations());
    }

    @Test
    void settingsSurviveAPoolSwap() {
        search.setThreads(3);
        search.setExploration(0.5);
        search.setWorkerPool(new WorkerPoolImpl(1));
        assertEquals(3, search.getThreads());

        SearchResult r = search.search(GameState.newGame(4, 2, 0), SearchSpec.ofIterations(90, 2), InfoHandler.NONE);
        assertEquals(90, r.iterations());
    }

    @Test
    void searchWithoutPoolFails() {
        Search bare = new SearchImpl(null, new TimeManagerImpl());
        assertThrows(IllegalStateException.class,
                () -> bare.search(GameState.newGame(3, 2, 0), SearchSpec.ofIterations(10, 1), InfoHandler.NONE));
    }
}
