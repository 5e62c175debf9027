// File: Main.java
package main;

import hobogo.contracts.EngineOptions;
import hobogo.contracts.PositionCodec;
import hobogo.contracts.ProtocolHandler;
import hobogo.contracts.Search;
import hobogo.contracts.TimeManager;
import hobogo.contracts.WorkerPool;
import hobogo.impl.EngineOptionsImpl;
import hobogo.impl.GameSession;
import hobogo.impl.PositionCodecImpl;
import hobogo.impl.ProtocolHandlerImpl;
import hobogo.impl.SearchImpl;
import hobogo.impl.TimeManagerImpl;
import hobogo.impl.WorkerPoolImpl;
import hobogo.records.Action;
import hobogo.rules.GameState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;

/**
 * Wire everything together and run the protocol loop on stdin / stdout.
 * {@code perft [depth]} counts the action tree of the bench positions instead.
 */
public final class Main {

    private static final Logger LOG = LoggerFactory.getLogger(Main.class);

    private static final int DEFAULT_PERFT_DEPTH = 3;

    public static void main(String[] args) {
        if (args.length > 0 && "perft".equalsIgnoreCase(args[0])) {
            int depth = (args.length > 1) ? Integer.parseInt(args[1]) : DEFAULT_PERFT_DEPTH;
            runPerftBench(depth);
            return;
        }

        LOG.info("Hobogo engine starting");

        PositionCodec codec = new PositionCodecImpl();
        WorkerPool pool = new WorkerPoolImpl(1);
        TimeManager tm = new TimeManagerImpl();
        Search search = new SearchImpl(pool, tm);

        EngineOptions opts = new EngineOptionsImpl(null, System.out);
        opts.attachSearch(search);

        GameSession session = new GameSession(search, codec, opts.settings());
        BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        ProtocolHandler handler = new ProtocolHandlerImpl(search, codec, opts, session, in, System.out);

        try {
            handler.runLoop();
        } finally {
            search.close();
            LOG.info("Hobogo engine stopped");
        }
    }

    // Single-threaded: walks every legal action sequence to the given depth.
    private static void runPerftBench(int depth) {
        PositionCodec codec = new PositionCodecImpl();

        long totalNodes = 0, totalTimeMs = 0;

        for (String text : ProtocolHandlerImpl.BENCH_POSITIONS) {
            GameState root = codec.fromText(text);
            long t0 = System.nanoTime();
            long nodes = perft(root, depth);
            long ms = (System.nanoTime() - t0) / 1_000_000;

            LOG.debug("perft({}) {} = {}", depth, text, nodes);
            totalNodes += nodes;
            totalTimeMs += ms;
        }

        long totalNps = totalTimeMs > 0 ? (1000L * totalNodes) / totalTimeMs : 0;
        System.out.printf("Nodes searched: %d%n", totalNodes);
        System.out.printf("nps: %d%n", totalNps);
        System.out.println("perftok");
    }

    /** A finished game counts as a single leaf whatever the remaining depth. */
    static long perft(GameState state, int depth) {
        if (depth == 0 || state.isTerminal()) return 1;

        long nodes = 0;
        for (Action action : state.legalActions()) {
            nodes += perft(state.apply(action), depth - 1);
        }
        return nodes;
    }
}
