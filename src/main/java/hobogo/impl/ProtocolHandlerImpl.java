package hobogo.impl;

import hobogo.contracts.EngineOptions;
import hobogo.contracts.PositionCodec;
import hobogo.contracts.ProtocolHandler;
import hobogo.contracts.Search;
import hobogo.records.Action;
import hobogo.records.Coord;
import hobogo.records.Influence;
import hobogo.records.SearchInfo;
import hobogo.records.SearchResult;
import hobogo.records.SearchSpec;
import hobogo.records.Settings;
import hobogo.rules.Board;
import hobogo.rules.GameState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * Line-protocol front-end, modelled on UCI.
 *
 * <p>All interaction with {@link Search} happens behind a single
 * monitor ({@code searchLock}) so that:</p>
 * <ul>
 *   <li>only <em>one</em> search can run at a time</li>
 *   <li>"info ..." and "bestaction ..." from an <em>old</em> search are
 *       never printed after a new position / search has started</li>
 * </ul>
 */
public final class ProtocolHandlerImpl implements ProtocolHandler {

    private static final Logger LOG = LoggerFactory.getLogger(ProtocolHandlerImpl.class);

    public static final List<String> BENCH_POSITIONS = List.of(
            "........./........./........./........./........./........./........./........./......... 0 2",
            "0.1../.0.1./..0../.1.0./..... 1 2",
            "......./.0...1./......./...2.../......./.1...0./....... 0 3",
            "........./.0.....1./........./........./....2..../........./........./.3......./......... 2 4"
    );
    static final long BENCH_ITERATIONS = 2_000;
    static final long BENCH_SEED = 1;

    private static final long STOP_POLL_MS = 50;

    /* ── engine singletons ─────────────────────────────────────── */
    private final Search        search;
    private final PositionCodec codec;
    private final EngineOptions opts;
    private final GameSession   session;
    private final BufferedReader in;
    private final PrintStream    out;

    /* ── mutable engine state (guarded by searchLock) ──────────── */
    private final Object searchLock = new Object();

    /** handle of the search currently in flight (nullable) */
    private CompletableFuture<SearchResult> searchFuture;
    /** incremented for every new "go", used to ignore stale callbacks */
    private int searchId = 0;

    public ProtocolHandlerImpl(Search search, PositionCodec codec, EngineOptions opts,
                               GameSession session, BufferedReader in, PrintStream out) {
        this.search  = search;
        this.codec   = codec;
        this.opts    = opts;
        this.session = session;
        this.in      = in;
        this.out     = out;
    }

    /* ── main loop ─────────────────────────────────────────────── */
    @Override public void runLoop() {
        try {
            String raw;
            while ((raw = in.readLine()) != null) {
                String line = raw.trim();
                if (!line.isEmpty() && handle(line)) return;   // "quit" -> exit
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Reading commands failed", e);
        }
        synchronized (searchLock) { cancelRunningSearch(); }
    }

    /* ── router ───────────────────────────────────────────────── */
    @Override
    public boolean handle(String cmd) {
        String[] t = cmd.trim().split("\\s+");
        try {
            return switch (t[0].toLowerCase(Locale.ROOT)) {
                case "hobogo"    -> { cmdHello();       yield false; }
                case "isready"   -> { out.println("readyok"); yield false; }
                case "setoption" -> { cmdSetOption(cmd); yield false; }
                case "newgame"   -> { cmdNewGame();     yield false; }
                case "position"  -> { cmdPosition(t);   yield false; }
                case "play"      -> { cmdPlay(t);       yield false; }
                case "bots"      -> { cmdBots();        yield false; }
                case "go"        -> { cmdGo(t);         yield false; }
                case "stop"      -> { cmdStop();        yield false; }
                case "undo"      -> { cmdUndo();        yield false; }
                case "legal"     -> { cmdLegal();       yield false; }
                case "score"     -> { cmdScore();       yield false; }
                case "show", "d" -> { cmdShow();        yield false; }
                case "text"      -> { out.println(codec.toText(session.state())); yield false; }
                case "bench"     -> { cmdBench();       yield false; }
                case "quit"      -> { cmdStop();        yield true;  }
                default          -> {
                    out.println("info string Unknown command: " + cmd);
                    yield false;
                }
            };
        } catch (IllegalArgumentException | IllegalStateException e) {
            LOG.warn("Command '{}' failed: {}", cmd, e.getMessage());
            out.println("info string error: " + e.getMessage());
            return false;
        }
    }

    /* ── commands ─────────────────────────────────────────────── */

    private void cmdHello() {
        out.println("id name Hobogo");
        out.println("id author the Hobogo developers");
        opts.printOptions();
        out.println("hobogook");
    }

    private void cmdSetOption(String cmd) {
        synchronized (searchLock) {
            cancelRunningSearch();
            opts.setOption(cmd);
            session.setSeed(opts.seed());
        }
    }

    private void cmdNewGame() {
        synchronized (searchLock) {
            cancelRunningSearch();
            session.setSeed(opts.seed());
            session.newGame(opts.settings());
        }
    }

    /**
     * {@code position startpos [size N] [players P] [first F] [actions ...]} or
     * {@code position text <rows> <next> <players> [actions ...]}.
     */
    private void cmdPosition(String[] t) {
        synchronized (searchLock) {
            cancelRunningSearch();

            String kind = arg(t, 1, "startpos or text");
            GameState pos;
            int i;
            if ("startpos".equals(kind)) {
                Settings s = session.settings();
                int size = s.boardSize();
                int players = s.numPlayers();
                int first = -1;
                i = 2;
                while (i < t.length && !"actions".equals(t[i])) {
                    switch (t[i]) {
                        case "size"    -> size = Integer.parseInt(arg(t, ++i, "board size"));
                        case "players" -> players = Integer.parseInt(arg(t, ++i, "player count"));
                        case "first"   -> first = Integer.parseInt(arg(t, ++i, "first player"));
                        default -> throw new IllegalArgumentException("Unexpected token: " + t[i]);
                    }
                    i++;
                }
                if (first < 0) {
                    first = players == s.numPlayers() ? s.firstPlayer() : 0;
                }
                pos = GameState.newGame(size, players, first);
            } else if ("text".equals(kind)) {
                StringBuilder text = new StringBuilder();
                i = 2;
                while (i < t.length && !"actions".equals(t[i])) text.append(t[i++]).append(' ');
                pos = codec.fromText(text.toString().trim());
            } else {
                throw new IllegalArgumentException("Expected startpos or text, got: " + kind);
            }

            /* optional action list */
            if (i < t.length && "actions".equals(t[i])) {
                for (int k = i + 1; k < t.length; k++) {
                    pos = pos.apply(codec.parseAction(t[k]));
                }
            }
            session.setPosition(pos);
        }
    }

    private void cmdPlay(String[] t) {
        Action action = codec.parseAction(arg(t, 1, "action"));
        synchronized (searchLock) {
            cancelRunningSearch();
            session.playHuman(action);
            replyWithBots();
        }
    }

    private void cmdBots() {
        synchronized (searchLock) {
            cancelRunningSearch();
            replyWithBots();
        }
    }

    private void replyWithBots() {
        for (GameSession.Turn turn : session.playBots()) {
            out.println("botaction " + turn.player() + " " + turn.action().name());
        }
        if (session.state().isTerminal()) {
            out.println("gameover " + joinScore(session.score()));
        }
    }

    private void cmdGo(String[] t) {
        /* 1) build SearchSpec ---------------------------------- */
        SearchSpec.Builder b = new SearchSpec.Builder().seed(opts.seed());
        for (int i = 1; i < t.length; i++)
            switch (t[i]) {
                case "movetime"   -> b.moveTimeMs(Long.parseLong(arg(t, ++i, "movetime")));
                case "time"       -> b.timeMs(Long.parseLong(arg(t, ++i, "time")));
                case "inc"        -> b.incMs(Long.parseLong(arg(t, ++i, "inc")));
                case "movestogo"  -> b.movesToGo(Integer.parseInt(arg(t, ++i, "movestogo")));
                case "iterations" -> b.iterations(Long.parseLong(arg(t, ++i, "iterations")));
                case "infinite"   -> b.infinite(true);
                case "seed"       -> b.seed(Long.parseLong(arg(t, ++i, "seed")));
                default -> throw new IllegalArgumentException("Unknown go parameter: " + t[i]);
            }
        SearchSpec spec = b.build();
        if (spec.hasNoClock() && spec.iterations() == 0 && !spec.infinite()) {
            spec = new SearchSpec.Builder().moveTimeMs(session.settings().botThinkTimeMs())
                    .seed(spec.seed()).build();
        }

        final int myId;
        final CompletableFuture<SearchResult> future;
        synchronized (searchLock) {
            cancelRunningSearch();

            myId = ++searchId;
            future = search.searchAsync(
                    session.state(),
                    spec,
                    info -> { if (myId == searchId) printInfo(info); });
            searchFuture = future;
        }

        /* handle completion asynchronously */
        future.thenAccept(r -> {
            synchronized (searchLock) {
                if (myId == searchId) printResult(r);
            }
        }).exceptionally(ex -> {
            LOG.error("Search failed", ex);
            out.println("info string search error: " + ex);
            return null;
        });
    }

    private void cmdStop() {
        synchronized (searchLock) { cancelRunningSearch(); }
    }

    private void cmdUndo() {
        synchronized (searchLock) {
            cancelRunningSearch();
            session.undo();
        }
    }

    private void cmdLegal() {
        GameState state = session.state();
        out.println("legal " + state.legalActions().stream()
                .map(Action::name)
                .collect(Collectors.joining(" ")));
    }

    private void cmdScore() {
        out.println("score " + joinScore(session.score()));
    }

    /**
     * Board picture: {@code [p]} a stone of p, {@code  p } an empty cell settled for p,
     * {@code (p)} a cell p claims that is still in play, {@code  . } a neutral cell.
     */
    private void cmdShow() {
        GameState state = session.state();
        Board board = state.board();
        Influence[] map = state.influenceMap();
        boolean[] open = state.volatileCells();

        StringBuilder sb = new StringBuilder("   ");
        for (int x = 0; x < board.width(); x++) sb.append(' ').append((char) ('A' + x)).append(' ');
        out.println(sb);
        for (int y = 0; y < board.height(); y++) {
            sb.setLength(0);
            sb.append(String.format("%2d ", y));
            for (int x = 0; x < board.width(); x++) {
                int i = board.index(new Coord(x, y));
                Influence inf = map[i];
                char p = Character.forDigit(inf.player(), 36);
                if (inf.occupied())        sb.append('[').append(p).append(']');
                else if (!inf.hasPlayer()) sb.append(" . ");
                else if (open[i])          sb.append('(').append(p).append(')');
                else                       sb.append(' ').append(p).append(' ');
            }
            out.println(sb);
        }

        if (state.isTerminal()) {
            out.println("Game over");
        } else {
            out.println("Next: " + session.playerName(state.nextPlayer()));
        }
        out.println("Score: " + joinScore(session.score()));
        out.println("Text: " + codec.toText(state));
    }

    private void cmdBench() {
        synchronized (searchLock) {
            cancelRunningSearch();
            runBench();
        }
    }

    private void runBench() {
        long totalIterations = 0, totalTimeMs = 0;

        for (String text : BENCH_POSITIONS) {
            GameState pos = codec.fromText(text);
            SearchSpec spec = SearchSpec.ofIterations(BENCH_ITERATIONS, BENCH_SEED);

            long t0 = System.nanoTime();
            SearchResult res = search.search(pos, spec, info -> {});
            long ms = (System.nanoTime() - t0) / 1_000_000;

            LOG.debug("bench {} -> {} in {} ms", text, res.bestAction().map(Action::name).orElse("none"), ms);
            totalIterations += res.iterations();
            totalTimeMs += ms;
        }

        long totalIps = totalTimeMs > 0 ? (1000L * totalIterations) / totalTimeMs : 0;

        out.println("==========================");
        out.printf("Total time (ms)   : %d%n", totalTimeMs);
        out.printf("Iterations        : %d%n", totalIterations);
        out.printf("Iterations/second : %d%n", totalIps);
        out.println("==========================");
        out.println("benchok");
    }

    /* ── helpers ─────────────────────────────────────────────── */

    /**
     * Stop and wait for any running search. The stop request is repeated because it
     * can land before the workers of an asynchronous search have started.
     */
    private void cancelRunningSearch() {
        if (searchFuture != null) {
            while (!searchFuture.isDone()) {
                search.stop();
                try {
                    searchFuture.get(STOP_POLL_MS, TimeUnit.MILLISECONDS);
                } catch (TimeoutException e) {
                    LOG.debug("Search still running, repeating stop");
                } catch (ExecutionException e) {
                    LOG.debug("Cancelled search had failed: {}", String.valueOf(e.getCause()));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
        }
        searchFuture = null;
    }

    private void printInfo(SearchInfo si) {
        StringBuilder sb = new StringBuilder("info");
        sb.append(" iterations ").append(si.iterations());
        sb.append(" nodes ").append(si.treeSize());
        sb.append(" time ").append(si.timeMs());
        sb.append(" ips ").append(si.ips());
        if (si.bestAction() != null) {
            sb.append(" share ").append(String.format(Locale.ROOT, "%.3f", si.expectedShare()));
            sb.append(" best ").append(si.bestAction().name());
            sb.append(" visits ").append(si.bestVisits());
        }
        out.println(sb);
    }

    private void printResult(SearchResult r) {
        out.println("bestaction " + r.bestAction().map(Action::name).orElse("none"));
    }

    private static String joinScore(int[] score) {
        return Arrays.stream(score).mapToObj(Integer::toString).collect(Collectors.joining(" "));
    }

    private static String arg(String[] t, int i, String what) {
        if (i >= t.length) throw new IllegalArgumentException("Missing " + what);
        return t[i];
    }
}
