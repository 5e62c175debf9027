package hobogo.records;

import static hobogo.constants.CoreConstants.NO_PLAYER;

/**
 * Territory status of one cell.
 *
 * @param player   the claimant: the occupant of a stone, or the player strictly nearest to an
 *                 empty cell; {@code NO_PLAYER} on a tie, while someone has no stone yet, or
 *                 when nobody can reach the cell
 * @param occupied a stone physically sits on the cell
 */
public record Influence(int player, boolean occupied) {

    /** Reported for coordinates off the board and for neutral cells. */
    public static final Influence NONE = new Influence(NO_PLAYER, false);

    public static Influence stone(int player) {
        return new Influence(player, true);
    }

    public static Influence open(int player) {
        return player == NO_PLAYER ? NONE : new Influence(player, false);
    }

    public boolean hasPlayer() {
        return player != NO_PLAYER;
    }
}
