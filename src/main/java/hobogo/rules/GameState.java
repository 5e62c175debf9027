package hobogo.rules;

import hobogo.records.Action;
import hobogo.records.Coord;
import hobogo.records.Influence;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import static hobogo.constants.CoreConstants.*;

/**
 * A simulateable world: the board, whose turn it is and how many players take part.
 *
 * <p>{@link #apply(Action)} is the pure transition used by the search tree and by
 * front-ends; {@link #advance(Action)} performs the same transition in place and is
 * reserved for throw-away copies such as rollouts.</p>
 */
public final class GameState {

    private final Board board;
    private final int numPlayers;
    private int nextPlayer;

    public GameState(Board board, int nextPlayer, int numPlayers) {
        Objects.requireNonNull(board, "board");
        if (numPlayers < MIN_PLAYERS || numPlayers > MAX_PLAYERS) {
            throw new IllegalArgumentException("Player count out of range: " + numPlayers);
        }
        if (nextPlayer < 0 || nextPlayer >= numPlayers) {
            throw new IllegalArgumentException("Next player " + nextPlayer + " not in 0.." + (numPlayers - 1));
        }
        if (board.highestPlayer() >= numPlayers) {
            throw new IllegalArgumentException("Board holds stones of player " + board.highestPlayer()
                    + " but the game has " + numPlayers + " players");
        }
        this.board = board;
        this.nextPlayer = nextPlayer;
        this.numPlayers = numPlayers;
    }

    /** Fresh square board. */
    public static GameState newGame(int boardSize, int numPlayers, int startingPlayer) {
        return new GameState(Board.square(boardSize), startingPlayer, numPlayers);
    }

    public GameState copy() {
        return new GameState(board.copy(), nextPlayer, numPlayers);
    }

    /** Read access to the board. Writing goes through {@link #apply} / {@link #advance} only. */
    public Board board()      { return board; }
    public int nextPlayer()   { return nextPlayer; }
    public int numPlayers()   { return numPlayers; }

    /* ── transitions ─────────────────────────────────────────────── */

    /**
     * Returns the state after {@code action}; this state is left untouched.
     *
     * @throws IllegalActionException when a {@code Move} targets a cell that is not a valid move
     */
    public GameState apply(Action action) {
        GameState next = copy();
        next.advance(action);
        return next;
    }

    /** In-place form of {@link #apply(Action)}. */
    public void advance(Action action) {
        Objects.requireNonNull(action, "action");
        if (action instanceof Action.Move move) {
            Coord c = move.coord();
            if (!board.isValidMove(c, nextPlayer, numPlayers)) {
                throw new IllegalActionException("Illegal move " + c + " for player " + nextPlayer);
            }
            board.place(c, nextPlayer);
        }
        nextPlayer = (nextPlayer + 1) % numPlayers;
    }

    /**
     * Rollout step: places the mover's stone on the cell at {@code index} without the
     * volatility check. The caller takes the index from a fresh volatile-cell scan.
     */
    public void advanceAt(int index) {
        board.place(index, nextPlayer);
        nextPlayer = (nextPlayer + 1) % numPlayers;
    }

    /** Every valid {@code Move} for the player to move, or exactly {@code [Pass]} when there is none. */
    public List<Action> legalActions() {
        boolean[] open = board.volatileCells(numPlayers);
        List<Action> actions = new ArrayList<>();
        for (int i = 0; i < open.length; i++) {
            if (open[i]) actions.add(new Action.Move(board.coordOf(i)));
        }
        if (actions.isEmpty()) actions.add(Action.PASS);
        return actions;
    }

    /** Membership in {@link #legalActions()}: a pass is legal only once no move is left. */
    public boolean isLegal(Action action) {
        if (action instanceof Action.Move move) return isValidMove(move.coord());
        return action != null && isTerminal();
    }

    /* ── queries ─────────────────────────────────────────────────── */

    public boolean isTerminal()             { return board.isGameOver(numPlayers); }
    public int[] points()                   { return board.points(numPlayers); }
    public Influence influence(Coord c)     { return board.influence(c, numPlayers); }
    public Influence[] influenceMap()       { return board.influenceMap(numPlayers); }
    public boolean[] volatileCells()        { return board.volatileCells(numPlayers); }
    public boolean isValidMove(Coord c)     { return board.isValidMove(c, nextPlayer, numPlayers); }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof GameState other)) return false;
        return nextPlayer == other.nextPlayer && numPlayers == other.numPlayers && board.equals(other.board);
    }

    @Override
    public int hashCode() {
        return Objects.hash(board, nextPlayer, numPlayers);
    }

    @Override
    public String toString() {
        return "GameState{" + board.width() + "x" + board.height()
                + ", next=" + nextPlayer + ", players=" + numPlayers + "}";
    }
}
