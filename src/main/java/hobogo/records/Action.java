package hobogo.records;

/**
 * A turn choice: skip the turn, or place the mover's stone on a cell.
 */
public sealed interface Action permits Action.Pass, Action.Move {

    Pass PASS = new Pass();

    static Move move(int x, int y) {
        return new Move(new Coord(x, y));
    }

    /** Protocol name: {@code pass} or the coordinate name. */
    String name();

    record Pass() implements Action {
        @Override public String name() { return "pass"; }
        @Override public String toString() { return name(); }
    }

    record Move(Coord coord) implements Action {
        public Move {
            if (coord == null) throw new IllegalArgumentException("coord must not be null");
        }
        @Override public String name() { return coord.name(); }
        @Override public String toString() { return name(); }
    }
}
