package hobogo.impl;

import hobogo.contracts.EngineOptions;
import hobogo.contracts.PositionCodec;
import hobogo.contracts.ProtocolHandler;
import hobogo.contracts.Search;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ProtocolHandlerImplTest {

    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private PrintStream out;
    private Search search;
    private EngineOptions opts;
    private GameSession session;

    @BeforeEach
    void wire() {
        out = new PrintStream(buffer, true, StandardCharsets.UTF_8);
        search = new SearchImpl(new WorkerPoolImpl(1), new TimeManagerImpl());
        opts = new EngineOptionsImpl(search, out);
        session = new GameSession(search, new PositionCodecImpl(), opts.settings());
    }

    @AfterEach
    void shutdown() {
        search.close();
    }

    private ProtocolHandler handler(String input) {
        PositionCodec codec = new PositionCodecImpl();
        return new ProtocolHandlerImpl(search, codec, opts, session, new BufferedReader(new StringReader(input)), out);
    }

    private ProtocolHandler handler() {
        return handler("");
    }

    private List<String> lines() {
        return buffer.toString(StandardCharsets.UTF_8).lines().toList();
    }

    private String lastLine() {
        List<String> l = lines();
        return l.isEmpty() ? "" : l.get(l.size() - 1);
    }

    private String awaitLineStartingWith(String prefix) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 20_000;
        while (System.currentTimeMillis() < deadline) {
            for (String l : lines()) if (l.startsWith(prefix)) return l;
            Thread.sleep(10);
        }
        return fail("no line starting with '" + prefix + "' in:\n" + buffer.toString(StandardCharsets.UTF_8));
    }

    @Test
    void handshake() {
        ProtocolHandler h = handler();
        assertFalse(h.handle("hobogo"));
        List<String> l = lines();
        assertEquals("id name Hobogo", l.get(0));
        assertTrue(l.stream().anyMatch(s -> s.startsWith("option name ThinkTime")));
        assertEquals("hobogook", lastLine());

        h.handle("isready");
        assertEquals("readyok", lastLine());
    }

    @Test
    void unknownCommandsAndBadInputAreReportedNotFatal() {
        ProtocolHandler h = handler();
        assertFalse(h.handle("fly away"));
        assertEquals("info string Unknown command: fly away", lastLine());

        assertFalse(h.handle("undo"));
        assertEquals("info string error: Nothing to undo", lastLine());

        assertFalse(h.handle("position text ..x 0 2"));
        assertTrue(lastLine().startsWith("info string error: "));

        assertFalse(h.handle("setoption name BoardSize value 99"));
        assertTrue(lastLine().startsWith("info string error: "));

        assertFalse(h.handle("play"));
        assertEquals("info string error: Missing action", lastLine());
    }

    @Test
    void positionTextThenQueries() {
        ProtocolHandler h = handler();
        h.handle("position text .0./0../..1 1 2");

        h.handle("legal");
        assertEquals("legal C0 B1 C1 A2 B2", lastLine());
        h.handle("score");
        assertEquals("score 6 3", lastLine());
        h.handle("text");
        assertEquals(".0./0../..1 1 2", lastLine());
    }

    @Test
    void positionStartposWithActions() {
        ProtocolHandler h = handler();
        h.handle("position startpos size 5 players 3 first 2 actions C2 pass");
        h.handle("text");
        assertEquals("...../...../..2../...../..... 1 3", lastLine());

        h.handle("position startpos size 5 actions C2 C2");
        assertTrue(lastLine().startsWith("info string error: "));
    }

    @Test
    void playMakesTheBotReply() {
        ProtocolHandler h = handler();
        h.handle("setoption name ThinkTime value 20");
        h.handle("setoption name BoardSize value 5");
        h.handle("setoption name Seed value 4");
        h.handle("newgame");
        h.handle("play C2");

        assertTrue(lastLine().startsWith("botaction 1 "), lastLine());
        assertEquals(0, session.state().nextPlayer());

        h.handle("undo");
        assertTrue(session.state().board().isEmpty());
    }

    @Test
    void goPrintsInfoAndBestAction() throws Exception {
        ProtocolHandler h = handler();
        h.handle("position startpos size 5");
        h.handle("go iterations 300 seed 3");

        String best = awaitLineStartingWith("bestaction ");
        assertNotEquals("bestaction none", best);
        assertTrue(lines().stream().anyMatch(l -> l.startsWith("info iterations ")));
        assertTrue(session.state().board().isEmpty(), "go must not play the move");
    }

    @Test
    void goOnFinishedGameHasNoAction() throws Exception {
        ProtocolHandler h = handler();
        h.handle("position text 01/10 0 2");
        h.handle("go iterations 50");
        assertEquals("bestaction none", awaitLineStartingWith("bestaction "));
    }

    @Test
    void stopEndsAnInfiniteGo() throws Exception {
        ProtocolHandler h = handler();
        h.handle("position startpos size 7");
        h.handle("go infinite");
        Thread.sleep(50);
        h.handle("stop");
        assertTrue(awaitLineStartingWith("bestaction ").length() > "bestaction ".length());
    }

    @Test
    void showDrawsTheBoard() {
        ProtocolHandler h = handler();
        h.handle("position text .0./0../..1 1 2");
        h.handle("show");
        List<String> l = lines();
        assertEquals("    A  B  C ", l.get(0));
        assertEquals(" 0  0 [0](0)", l.get(1));
        assertEquals(" 2 (0)(1)[1]", l.get(3));
        assertTrue(l.contains("Next: Pink (bot)"));
        assertTrue(l.contains("Score: 6 3"));
    }

    @Test
    void benchReportsTotals() {
        ProtocolHandler h = handler();
        h.handle("bench");
        assertEquals("benchok", lastLine());
        assertTrue(lines().stream().anyMatch(l -> l.startsWith("Iterations        : ")));
    }

    @Test
    void loopRunsUntilQuit() {
        handler("isready\n\nquit\nisready\n").runLoop();
        assertEquals(List.of("readyok"), lines());
    }
}
