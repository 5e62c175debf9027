package bench;

import hobogo.impl.MctsTree;
import hobogo.impl.PositionCodecImpl;
import hobogo.rules.Board;
import hobogo.rules.GameState;
import org.openjdk.jmh.annotations.*;

import java.util.SplittableRandom;
import java.util.concurrent.TimeUnit;

/** Micro-benchmark: territory queries, a full rollout and one search iteration on a half-filled 9x9 board */
@BenchmarkMode(Mode.Throughput)            // higher = better
@OutputTimeUnit(TimeUnit.MILLISECONDS)
@Warmup(iterations = 5,  time = 400, timeUnit = TimeUnit.MILLISECONDS)
@Measurement(iterations = 10, time = 400, timeUnit = TimeUnit.MILLISECONDS)
@Fork(value = 2)
public class BoardBench {

    /** Same mid-game position for every method. */
    @State(Scope.Thread)
    public static class TestData {
        GameState state;
        Board board;
        MctsTree tree;
        SplittableRandom rng;
        boolean[] open;
        Board.Scratch scratch;

        @Setup(Level.Trial)
        public void init() {
            state = new PositionCodecImpl().fromText(
                    "..0....1./.00...11./..0..1.../...0.1.../....2..../...2.0.../..2...1../.2.....1./......... 0 3");
            board = state.board();
            rng = new SplittableRandom(1);
            open = new boolean[board.cellCount()];
            scratch = new Board.Scratch(board.cellCount());
        }

        // the tree keeps growing, so start it over for each measurement iteration
        @Setup(Level.Iteration)
        public void freshTree() {
            tree = new MctsTree(state);
        }
    }

    @Benchmark
    public boolean[] volatileCells(TestData td) {
        return td.board.volatileCells(3);
    }

    @Benchmark
    public int[] points(TestData td) {
        return td.board.points(3);
    }

    /** Random play to the end on reused buffers, the way a search rollout runs. */
    @Benchmark
    public int[] rollout(TestData td) {
        GameState sim = td.state.copy();
        Board b = sim.board();
        int n = sim.numPlayers();
        int count;
        while ((count = b.volatileCells(n, td.open, td.scratch)) > 0) {
            int pick = td.rng.nextInt(count);
            for (int i = 0; i < td.open.length; i++) {
                if (td.open[i] && pick-- == 0) {
                    sim.advanceAt(i);
                    break;
                }
            }
        }
        return b.points(n, td.scratch);
    }

    @Benchmark
    public long mctsIteration(TestData td) {
        td.tree.iterate(td.rng);
        return td.tree.iterations();
    }
}
