package hobogo.records;

/**
 * A grid cell address. Whether it is on a given board is decided by the board.
 *
 * @param x column, 0-based
 * @param y row, 0-based
 */
public record Coord(int x, int y) {

    /** Chess-style name: column letter followed by the 0-based row, e.g. {@code C2}. */
    public String name() {
        return "" + (char) ('A' + x) + y;
    }

    @Override
    public String toString() {
        return name();
    }
}
