package hobogo.rules;

import hobogo.records.Coord;
import hobogo.records.Influence;

import java.util.Arrays;
import java.util.Iterator;
import java.util.NoSuchElementException;

import static hobogo.constants.CoreConstants.*;

/**
 * Grid of cells plus the territory rules.
 *
 * <p>Cells are stored row-major in a flat {@code byte[]}: {@code EMPTY} or the id of the
 * player whose stone sits there. Stones are never removed. Everything territorial
 * (influence, volatility, score) is derived on demand from the stones, so a board is
 * copied with a single array clone.</p>
 *
 * <p>Territory model:</p>
 * <ul>
 *   <li>A player <em>reaches</em> an empty cell when a 4-connected path leads from one of its
 *       stones to the cell over empty cells and its own stones. Equivalently, the player has a
 *       stone bordering the empty region that contains the cell.</li>
 *   <li>Once every player has a stone, an empty cell is <em>claimed</em> by the player with the
 *       strictly smallest such distance. Ties and unreachable cells are neutral. Before that only
 *       stones are claimed.</li>
 *   <li>An empty cell is <em>volatile</em> while two or more players reach it, or while some
 *       player has not placed a stone yet. Otherwise it is settled territory of the single
 *       player that reaches it.</li>
 *   <li>Only volatile cells are legal targets, so settled territory stays settled.</li>
 * </ul>
 */
public final class Board {

    private final int width;
    private final int height;
    private final byte[] cells;

    public Board(int width, int height) {
        if (width < 1 || height < 1 || width > MAX_BOARD_SIDE || height > MAX_BOARD_SIDE) {
            throw new IllegalArgumentException("Board dimensions out of range: " + width + "x" + height);
        }
        this.width = width;
        this.height = height;
        this.cells = new byte[width * height];
        Arrays.fill(cells, (byte) EMPTY);
    }

    public static Board square(int size) {
        return new Board(size, size);
    }

    /**
     * Restores a board from a row-major cell dump ({@code EMPTY} or player id per cell),
     * as read back from a saved position.
     */
    public static Board of(int width, int height, int[] stones) {
        Board board = new Board(width, height);
        if (stones.length != board.cells.length) {
            throw new IllegalArgumentException("Expected " + board.cells.length + " cells, got " + stones.length);
        }
        for (int i = 0; i < stones.length; i++) {
            int v = stones[i];
            if (v != EMPTY && (v < 0 || v >= MAX_PLAYERS)) {
                throw new IllegalArgumentException("Invalid cell value " + v + " at index " + i);
            }
            board.cells[i] = (byte) v;
        }
        return board;
    }

    private Board(Board other) {
        this.width = other.width;
        this.height = other.height;
        this.cells = other.cells.clone();
    }

    public Board copy() {
        return new Board(this);
    }

    public int width()     { return width; }
    public int height()    { return height; }
    public int cellCount() { return cells.length; }

    /* ── addressing ─────────────────────────────────────────────── */

    /** All cells in row-major order. Every call to {@code iterator()} starts over. */
    public Iterable<Coord> coords() {
        return () -> new Iterator<>() {
            private int next = 0;

            @Override public boolean hasNext() { return next < cells.length; }

            @Override public Coord next() {
                if (next >= cells.length) throw new NoSuchElementException();
                Coord c = coordOf(next);
                next++;
                return c;
            }
        };
    }

    public boolean contains(Coord c) {
        return c != null && c.x() >= 0 && c.x() < width && c.y() >= 0 && c.y() < height;
    }

    /** Linear index of {@code c}, or {@link hobogo.constants.CoreConstants#NO_INDEX} when off the board. */
    public int index(Coord c) {
        return contains(c) ? c.y() * width + c.x() : NO_INDEX;
    }

    public Coord coordOf(int index) {
        return new Coord(index % width, index / width);
    }

    /* ── cells ──────────────────────────────────────────────────── */

    /** Occupant of {@code c}: a player id, {@code EMPTY}, or {@code OFF_BOARD}. */
    public int stoneAt(Coord c) {
        int i = index(c);
        return i == NO_INDEX ? OFF_BOARD : cells[i];
    }

    public int stoneAt(int index) {
        return cells[index];
    }

    /**
     * Puts a stone down. Only {@link GameState} transitions and position decoding write
     * cells; rule checks are the caller's job.
     */
    void place(Coord c, int player) {
        int i = index(c);
        if (i == NO_INDEX) {
            throw new IllegalActionException("Cell " + c + " is off the " + width + "x" + height + " board");
        }
        place(i, player);
    }

    void place(int i, int player) {
        if (cells[i] != EMPTY) {
            throw new IllegalActionException("Cell " + coordOf(i) + " is already occupied by player " + cells[i]);
        }
        if (player < 0 || player >= MAX_PLAYERS) {
            throw new IllegalActionException("Invalid player id " + player);
        }
        cells[i] = (byte) player;
    }

    /** No stone has been placed yet. */
    public boolean isEmpty() {
        for (byte b : cells) if (b != EMPTY) return false;
        return true;
    }

    public boolean isFull() {
        for (byte b : cells) if (b == EMPTY) return false;
        return true;
    }

    public int stoneCount(int player) {
        int n = 0;
        for (byte b : cells) if (b == player) n++;
        return n;
    }

    /** Highest player id with a stone on the board, or {@code NO_PLAYER}. */
    public int highestPlayer() {
        int max = NO_PLAYER;
        for (byte b : cells) if (b > max) max = b;
        return max;
    }

    /* ── territory ──────────────────────────────────────────────── */

    /**
     * Buffers for the region scans of one board geometry. Each search worker keeps its
     * own; sharing one between threads is unsafe.
     */
    public static final class Scratch {
        final boolean[] seen;
        final int[] region;
        final int[] nb = new int[4];
        long border;

        public Scratch(int cellCount) {
            this.seen = new boolean[cellCount];
            this.region = new int[cellCount];
        }
    }

    /**
     * For every cell, whether its territory claim can still change.
     * Occupied cells are never volatile.
     *
     * @return flags indexed like {@link #index(Coord)}
     */
    public boolean[] volatileCells(int numPlayers) {
        boolean[] out = new boolean[cells.length];
        volatileCells(numPlayers, out, new Scratch(cells.length));
        return out;
    }

    /**
     * Allocation-free form of {@link #volatileCells(int)} used by rollouts.
     *
     * @param out     receives the flags, indexed like {@link #index(Coord)}
     * @param scratch buffers sized for at least {@link #cellCount()} cells
     * @return number of volatile cells
     */
    public int volatileCells(int numPlayers, boolean[] out, Scratch scratch) {
        checkPlayerCount(numPlayers);
        checkBuffers(out.length, scratch);

        int count = 0;
        if (someoneHasNoStone(numPlayers)) {
            for (int i = 0; i < cells.length; i++) {
                out[i] = cells[i] == EMPTY;
                if (out[i]) count++;
            }
            return count;
        }

        Arrays.fill(out, 0, cells.length, false);
        Arrays.fill(scratch.seen, 0, cells.length, false);
        for (int start = 0; start < cells.length; start++) {
            if (cells[start] != EMPTY || scratch.seen[start]) continue;
            int len = floodRegion(start, scratch);
            if (Long.bitCount(scratch.border) >= 2) {
                for (int k = 0; k < len; k++) out[scratch.region[k]] = true;
                count += len;
            }
        }
        return count;
    }

    public boolean isVolatile(Coord c, int numPlayers) {
        checkPlayerCount(numPlayers);
        int i = index(c);
        if (i == NO_INDEX || cells[i] != EMPTY) return false;
        if (someoneHasNoStone(numPlayers)) return true;
        Scratch scratch = new Scratch(cells.length);
        floodRegion(i, scratch);
        return Long.bitCount(scratch.border) >= 2;
    }

    /**
     * A player may only place on an empty cell whose claim is still open: never inside
     * settled territory, whether a rival's or its own.
     */
    public boolean isValidMove(Coord c, int player, int numPlayers) {
        if (player < 0 || player >= numPlayers) return false;
        return isVolatile(c, numPlayers);
    }

    /** No empty cell is volatile any more (a full board included). */
    public boolean isGameOver(int numPlayers) {
        checkPlayerCount(numPlayers);
        if (isFull()) return true;
        if (someoneHasNoStone(numPlayers)) return false;

        Scratch scratch = new Scratch(cells.length);
        for (int start = 0; start < cells.length; start++) {
            if (cells[start] != EMPTY || scratch.seen[start]) continue;
            floodRegion(start, scratch);
            if (Long.bitCount(scratch.border) >= 2) return false;
        }
        return true;
    }

    /**
     * Score vector: each player's stones plus the empty cells it claims.
     * Neutral cells count for nobody.
     */
    public int[] points(int numPlayers) {
        return points(numPlayers, new Scratch(cells.length));
    }

    /**
     * {@link #points(int)} on caller-owned buffers. Distances are only computed for regions
     * that several players reach, so a finished game is scored without any.
     */
    public int[] points(int numPlayers, Scratch scratch) {
        checkPlayerCount(numPlayers);
        checkBuffers(cells.length, scratch);
        int[] points = new int[numPlayers];
        for (byte b : cells) {
            if (b != EMPTY && b < numPlayers) points[b]++;
        }
        if (someoneHasNoStone(numPlayers)) return points;

        int[][] dist = new int[Long.SIZE][];
        Arrays.fill(scratch.seen, 0, cells.length, false);
        for (int start = 0; start < cells.length; start++) {
            if (cells[start] != EMPTY || scratch.seen[start]) continue;
            int len = floodRegion(start, scratch);
            long border = scratch.border;
            if (Long.bitCount(border) == 1) {
                points[Long.numberOfTrailingZeros(border)] += len;
            } else if (border != 0) {
                for (int k = 0; k < len; k++) {
                    int owner = nearest(dist, border, scratch.region[k]);
                    if (owner != NO_PLAYER) points[owner]++;
                }
            }
        }
        return points;
    }

    /** Territory status of one cell; {@link Influence#NONE} for coordinates off the board. */
    public Influence influence(Coord c, int numPlayers) {
        checkPlayerCount(numPlayers);
        int i = index(c);
        if (i == NO_INDEX) return Influence.NONE;
        if (cells[i] != EMPTY) return Influence.stone(cells[i]);
        if (someoneHasNoStone(numPlayers)) return Influence.NONE;

        Scratch scratch = new Scratch(cells.length);
        floodRegion(i, scratch);
        return Influence.open(owner(new int[Long.SIZE][], scratch.border, i));
    }

    /**
     * Influence of every cell at once, indexed like {@link #index(Coord)}. Shares the
     * region and distance passes, so rendering a board costs one call instead of one per cell.
     */
    public Influence[] influenceMap(int numPlayers) {
        checkPlayerCount(numPlayers);
        Influence[] out = new Influence[cells.length];
        boolean open = someoneHasNoStone(numPlayers);

        int[][] dist = new int[Long.SIZE][];
        Scratch scratch = new Scratch(cells.length);
        for (int start = 0; start < cells.length; start++) {
            if (cells[start] != EMPTY) {
                out[start] = Influence.stone(cells[start]);
                continue;
            }
            if (open) {
                out[start] = Influence.NONE;
                continue;
            }
            if (scratch.seen[start]) continue;
            int len = floodRegion(start, scratch);
            for (int k = 0; k < len; k++) {
                int cell = scratch.region[k];
                out[cell] = Influence.open(owner(dist, scratch.border, cell));
            }
        }
        return out;
    }

    /**
     * Distance of every cell from {@code player}'s nearest stone: 4-connected steps over
     * empty cells and the player's own stones. Rival stones block.
     *
     * @return distances indexed like {@link #index(Coord)}; {@code UNREACHABLE} where no path exists
     */
    public int[] distances(int player) {
        int[] dist = new int[cells.length];
        Arrays.fill(dist, UNREACHABLE);
        int[] queue = new int[cells.length];
        int head = 0, tail = 0;
        for (int i = 0; i < cells.length; i++) {
            if (cells[i] == player) {
                dist[i] = 0;
                queue[tail++] = i;
            }
        }
        int[] nb = new int[4];
        while (head < tail) {
            int cur = queue[head++];
            int n = neighbours(cur, nb);
            for (int k = 0; k < n; k++) {
                int next = nb[k];
                if (dist[next] != UNREACHABLE) continue;
                if (cells[next] != EMPTY && cells[next] != player) continue;
                dist[next] = dist[cur] + 1;
                queue[tail++] = next;
            }
        }
        return dist;
    }

    /* ── internals ──────────────────────────────────────────────── */

    /** Claimant of an empty cell whose region is bordered by the players in {@code border}. */
    private int owner(int[][] dist, long border, int cell) {
        if (Long.bitCount(border) == 1) return Long.numberOfTrailingZeros(border);
        return nearest(dist, border, cell);
    }

    /**
     * Strictly nearest of {@code players} to {@code cell}; {@code NO_PLAYER} on a tie or if
     * unreachable. Fills {@code dist} for a player the first time it is needed.
     */
    private int nearest(int[][] dist, long players, int cell) {
        int best = NO_PLAYER;
        int bestDist = UNREACHABLE;
        boolean tie = false;
        for (long m = players; m != 0; m &= m - 1) {
            int p = Long.numberOfTrailingZeros(m);
            if (dist[p] == null) dist[p] = distances(p);
            int d = dist[p][cell];
            if (d < bestDist) {
                best = p;
                bestDist = d;
                tie = false;
            } else if (d == bestDist && d != UNREACHABLE) {
                tie = true;
            }
        }
        return tie ? NO_PLAYER : best;
    }

    /**
     * Collects the empty region containing {@code start} into {@code scratch.region} and the
     * set of players with a stone on its border into {@code scratch.border} (bit per player).
     *
     * @return number of cells in the region
     */
    private int floodRegion(int start, Scratch scratch) {
        boolean[] seen = scratch.seen;
        int[] region = scratch.region;
        int[] nb = scratch.nb;
        long mask = 0;
        int head = 0, tail = 0;
        region[tail++] = start;
        seen[start] = true;
        while (head < tail) {
            int cur = region[head++];
            int n = neighbours(cur, nb);
            for (int k = 0; k < n; k++) {
                int next = nb[k];
                byte v = cells[next];
                if (v != EMPTY) {
                    mask |= 1L << v;
                } else if (!seen[next]) {
                    seen[next] = true;
                    region[tail++] = next;
                }
            }
        }
        scratch.border = mask;
        return tail;
    }

    private int neighbours(int i, int[] out) {
        int x = i % width;
        int y = i / width;
        int n = 0;
        if (y > 0)          out[n++] = i - width;
        if (x > 0)          out[n++] = i - 1;
        if (x < width - 1)  out[n++] = i + 1;
        if (y < height - 1) out[n++] = i + width;
        return n;
    }

    private long playersWithStones() {
        long mask = 0;
        for (byte b : cells) if (b != EMPTY) mask |= 1L << b;
        return mask;
    }

    /** While a participant has no stone it may still land anywhere, so nothing is settled. */
    private boolean someoneHasNoStone(int numPlayers) {
        long all = (1L << numPlayers) - 1;
        return (playersWithStones() & all) != all;
    }

    private void checkBuffers(int outLength, Scratch scratch) {
        if (outLength < cells.length || scratch.seen.length < cells.length) {
            throw new IllegalArgumentException("Buffers too small for " + cells.length + " cells");
        }
    }

    private static void checkPlayerCount(int numPlayers) {
        if (numPlayers < MIN_PLAYERS || numPlayers > MAX_PLAYERS) {
            throw new IllegalArgumentException("Player count out of range: " + numPlayers);
        }
    }

    /* ── identity ───────────────────────────────────────────────── */

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Board other)) return false;
        return width == other.width && height == other.height && Arrays.equals(cells, other.cells);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * width + height) + Arrays.hashCode(cells);
    }
}
