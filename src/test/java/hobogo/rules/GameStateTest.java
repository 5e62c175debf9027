package hobogo.rules;

import hobogo.impl.PositionCodecImpl;
import hobogo.records.Action;
import hobogo.records.Coord;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.SplittableRandom;

import static org.junit.jupiter.api.Assertions.*;

class GameStateTest {

    @Test
    void applyLeavesTheOriginalUntouched() {
        GameState start = GameState.newGame(3, 2, 0);
        GameState next = start.apply(Action.move(1, 1));

        assertTrue(start.board().isEmpty());
        assertEquals(0, start.nextPlayer());
        assertEquals(0, next.board().stoneAt(new Coord(1, 1)));
        assertEquals(1, next.nextPlayer());
    }

    @Test
    void rolloutStepMatchesApplyOnVolatileCells() {
        GameState s = GameState.newGame(4, 2, 1);
        GameState viaIndex = s.copy();
        int i = s.board().index(new Coord(2, 1));
        viaIndex.advanceAt(i);
        assertEquals(s.apply(Action.move(2, 1)), viaIndex);

        assertThrows(IllegalActionException.class, () -> viaIndex.advanceAt(i));
    }

    @Test
    void turnOrderIsCyclic() {
        for (int n = 2; n <= 5; n++) {
            for (int first = 0; first < n; first++) {
                GameState s = GameState.newGame(5, n, first).apply(Action.move(0, 0));
                for (int k = 0; k < n - 1; k++) s = s.apply(Action.PASS);
                assertEquals(first, s.nextPlayer(), "n=" + n + " first=" + first);
            }
        }
    }

    @Test
    void passOnlyMovesTheTurn() {
        GameState s = GameState.newGame(3, 3, 2);
        GameState p = s.apply(Action.PASS);
        assertEquals(0, p.nextPlayer());
        assertEquals(s.board(), p.board());
    }

    @Test
    void legalActionsOnFreshBoardAreAllCellsRowMajor() {
        GameState s = GameState.newGame(3, 2, 0);
        List<Action> actions = s.legalActions();
        assertEquals(9, actions.size());
        assertEquals(Action.move(0, 0), actions.get(0));
        assertEquals(Action.move(2, 0), actions.get(2));
        assertEquals(Action.move(2, 2), actions.get(8));
        assertFalse(actions.contains(Action.PASS));
        assertFalse(s.isLegal(Action.PASS));
    }

    @Test
    void illegalMovesThrow() {
        GameState s = new PositionCodecImpl().fromText(".0./0../..1 1 2");
        assertThrows(IllegalActionException.class, () -> s.apply(Action.move(1, 0)));  // occupied
        assertThrows(IllegalActionException.class, () -> s.apply(Action.move(0, 0)));  // settled
        assertThrows(IllegalActionException.class, () -> s.apply(Action.move(3, 3)));  // off board
        assertFalse(s.isLegal(Action.move(0, 0)));
        assertTrue(s.isLegal(Action.move(2, 0)));
    }

    @Test
    void constructorValidates() {
        Board b = Board.square(3);
        assertThrows(IllegalArgumentException.class, () -> new GameState(b, 0, 1));
        assertThrows(IllegalArgumentException.class, () -> new GameState(b, 2, 2));
        assertThrows(IllegalArgumentException.class, () -> new GameState(b, -1, 2));

        Board withThirdPlayer = Board.of(2, 1, new int[]{2, -1});
        assertThrows(IllegalArgumentException.class, () -> new GameState(withThirdPlayer, 0, 2));
    }

    @Test
    void randomPlayoutsEndWithPassOnlyAndNeverReopenCells() {
        SplittableRandom rng = new SplittableRandom(7);
        for (int game = 0; game < 50; game++) {
            int n = 2 + rng.nextInt(3);
            GameState s = GameState.newGame(4 + rng.nextInt(3), n, rng.nextInt(n));
            boolean[] before = s.volatileCells();
            while (!s.isTerminal()) {
                List<Action> actions = s.legalActions();
                assertFalse(actions.contains(Action.PASS));
                s = s.apply(actions.get(rng.nextInt(actions.size())));

                boolean[] after = s.volatileCells();
                boolean everyoneHasStone = true;
                for (int p = 0; p < n; p++) everyoneHasStone &= s.board().stoneCount(p) > 0;
                if (everyoneHasStone) {
                    for (int i = 0; i < after.length; i++) {
                        assertFalse(after[i] && !before[i], "cell " + i + " became volatile again");
                    }
                }
                before = after;
            }
            assertEquals(List.of(Action.PASS), s.legalActions());
            assertTrue(s.apply(Action.PASS).isTerminal());
        }
    }

    @Test
    void copyEqualsButIsIndependent() {
        GameState s = GameState.newGame(3, 2, 1);
        GameState c = s.copy();
        assertEquals(s, c);
        assertEquals(s.hashCode(), c.hashCode());
        c.advance(Action.move(0, 0));
        assertNotEquals(s, c);
        assertTrue(s.board().isEmpty());
    }
}
