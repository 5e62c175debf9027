package hobogo.impl;

import hobogo.contracts.PositionCodec;
import hobogo.records.Action;
import hobogo.records.Coord;
import hobogo.rules.Board;
import hobogo.rules.GameState;

import static hobogo.constants.CoreConstants.*;

/**
 * Reads and writes the one-line position notation, e.g.
 * <pre>
 *   ..../.0../..1./.... 0 2
 * </pre>
 * Rows run top (y = 0) to bottom; the last two fields are the next player and the
 * player count. Everything needed to rebuild a {@link GameState} exactly is in the line.
 */
public final class PositionCodecImpl implements PositionCodec {

    private static final char EMPTY_CHAR = '.';

    @Override
    public GameState fromText(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Empty position");
        }
        String[] fields = text.trim().split("\\s+");
        if (fields.length != 3) {
            throw new IllegalArgumentException("Expected '<rows> <next> <players>', got: " + text);
        }

        String[] rows = fields[0].split("/", -1);
        int height = rows.length;
        int width = rows[0].length();
        if (width == 0) {
            throw new IllegalArgumentException("Empty first row in: " + fields[0]);
        }
        for (int y = 0; y < height; y++) {
            if (rows[y].length() != width) {
                throw new IllegalArgumentException("Row " + y + " has " + rows[y].length()
                        + " cells, expected " + width);
            }
        }

        int next = parseNumber(fields[1], "next player");
        int players = parseNumber(fields[2], "player count");
        if (players < MIN_PLAYERS || players > MAX_PLAYERS) {
            throw new IllegalArgumentException("Player count out of range: " + players);
        }

        int[] cells = new int[width * height];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                char ch = rows[y].charAt(x);
                if (ch == EMPTY_CHAR) {
                    cells[y * width + x] = EMPTY;
                    continue;
                }
                int player = Character.digit(ch, MAX_PLAYERS);
                if (player < 0) {
                    throw new IllegalArgumentException("Bad cell '" + ch + "' at " + new Coord(x, y).name());
                }
                if (player >= players) {
                    throw new IllegalArgumentException("Stone of player " + player + " at "
                            + new Coord(x, y).name() + " but only " + players + " players");
                }
                cells[y * width + x] = player;
            }
        }
        return new GameState(Board.of(width, height, cells), next, players);
    }

    @Override
    public String toText(GameState state) {
        Board board = state.board();
        StringBuilder sb = new StringBuilder(board.cellCount() + board.height() + 8);
        for (int y = 0; y < board.height(); y++) {
            if (y > 0) sb.append('/');
            for (int x = 0; x < board.width(); x++) {
                int v = board.stoneAt(new Coord(x, y));
                sb.append(v == EMPTY ? EMPTY_CHAR : Character.forDigit(v, MAX_PLAYERS));
            }
        }
        return sb.append(' ').append(state.nextPlayer())
                 .append(' ').append(state.numPlayers())
                 .toString();
    }

    @Override
    public Coord parseCoord(String name) {
        if (name == null || name.length() < 2) {
            throw new IllegalArgumentException("Bad coordinate: " + name);
        }
        char col = Character.toUpperCase(name.charAt(0));
        if (col < 'A' || col > 'Z') {
            throw new IllegalArgumentException("Bad column in coordinate: " + name);
        }
        int row = parseNumber(name.substring(1), "row in " + name);
        return new Coord(col - 'A', row);
    }

    @Override
    public Action parseAction(String name) {
        if ("pass".equalsIgnoreCase(name)) return Action.PASS;
        return new Action.Move(parseCoord(name));
    }

    private static int parseNumber(String s, String what) {
        try {
            int v = Integer.parseInt(s);
            if (v < 0) throw new IllegalArgumentException("Negative " + what + ": " + s);
            return v;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Bad " + what + ": " + s, e);
        }
    }
}
