package hobogo.impl;

import hobogo.contracts.EngineOptions;
import hobogo.contracts.Search;
import hobogo.records.Settings;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class EngineOptionsImplTest {

    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private Search search;
    private EngineOptions opts;

    @BeforeEach
    void wire() {
        search = new SearchImpl(new WorkerPoolImpl(1), new TimeManagerImpl());
        opts = new EngineOptionsImpl(search, new PrintStream(buffer, true, StandardCharsets.UTF_8));
    }

    @AfterEach
    void shutdown() {
        search.close();
    }

    @Test
    void defaultsMatchTheClassicGame() {
        Settings s = opts.settings();
        assertEquals(Settings.defaults(), s);
        assertNull(opts.seed());
        assertEquals(500, opts.infoIntervalMs());
        assertEquals("141", opts.getOptionValue("Exploration"));
    }

    @Test
    void printsEveryOption() {
        opts.printOptions();
        String text = buffer.toString(StandardCharsets.UTF_8);
        assertTrue(text.contains("option name BoardSize type spin default 9 min 5 max 17"), text);
        assertTrue(text.contains("option name HumansFirst type check default true"), text);
        assertTrue(text.contains("option name Threads type spin default 1"), text);
        assertEquals(9, text.lines().count());
    }

    @Test
    void setupOptionsFeedTheSettings() {
        opts.setOption("setoption name BoardSize value 7");
        opts.setOption("setoption name Humans value 2");
        opts.setOption("setoption name Bots value 1");
        opts.setOption("setoption name HumansFirst value false");
        opts.setOption("setoption name ThinkTime value 250");

        Settings s = opts.settings();
        assertEquals(new Settings(7, 2, 1, false, 250), s);
        assertEquals(2, s.firstPlayer());
        assertEquals("7", opts.getOptionValue("boardsize"));
    }

    @Test
    void tooFewPlayersAreTopUpWithHumans() {
        opts.setOption("setoption name Humans value 0");
        opts.setOption("setoption name Bots value 0");
        assertEquals(2, opts.settings().numHumans());
        assertEquals(0, opts.settings().numBots());
    }

    @Test
    void searchOptionsReachTheSearch() {
        opts.setOption("setoption name Threads value 2");
        opts.setOption("setoption name InfoInterval value 100");
        opts.setOption("setoption name Seed value 12");

        assertEquals(2, search.getThreads());
        assertEquals(100, opts.infoIntervalMs());
        assertEquals(12L, opts.seed());

        opts.setOption("setoption name Seed value 0");
        assertNull(opts.seed());
    }

    @Test
    void badOptionsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> opts.setOption("setoption name Colour value red"));
        assertThrows(IllegalArgumentException.class, () -> opts.setOption("setoption name BoardSize value 4"));
        assertThrows(IllegalArgumentException.class, () -> opts.setOption("setoption name BoardSize value big"));
        assertThrows(IllegalArgumentException.class, () -> opts.setOption("setoption name HumansFirst value maybe"));
        assertEquals("9", opts.getOptionValue("BoardSize"));
        assertNull(opts.getOptionValue("Colour"));
    }
}
