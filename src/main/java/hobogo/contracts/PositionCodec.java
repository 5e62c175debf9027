package hobogo.contracts;

import hobogo.rules.GameState;
import hobogo.records.Action;
import hobogo.records.Coord;

/**
 * Text form of positions, coordinates and actions.
 *
 * <p>Position notation: rows top to bottom separated by {@code /}, one character per
 * cell ({@code .} empty, {@code 0-9a-z} player 0-35), then the next player and the
 * player count, e.g. {@code "..../.0../..1./.... 0 2"}.</p>
 */
public interface PositionCodec {

    /** @throws IllegalArgumentException on malformed notation */
    GameState fromText(String text);

    String toText(GameState state);

    /** Chess-style cell name, column letter then 0-based row: {@code C2}. Case-insensitive. */
    Coord parseCoord(String name);

    /** {@code pass} or a cell name. */
    Action parseAction(String name);
}
