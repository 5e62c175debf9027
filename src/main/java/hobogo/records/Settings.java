package hobogo.records;

import static hobogo.constants.CoreConstants.*;

/**
 * Game setup chosen before a game starts.
 *
 * @param boardSize      side length of the square board
 * @param numHumans      players {@code 0 .. numHumans-1} are human
 * @param numBots        the remaining players are driven by the search
 * @param humansFirst    humans move first; otherwise the first bot does
 * @param botThinkTimeMs wall-clock budget for one bot decision
 */
public record Settings(
        int     boardSize,
        int     numHumans,
        int     numBots,
        boolean humansFirst,
        long    botThinkTimeMs
) {
    public static Settings defaults() {
        return new Settings(DEFAULT_BOARD_SIZE, DEFAULT_HUMANS, DEFAULT_BOTS, true, DEFAULT_THINK_TIME_MS);
    }

    public int numPlayers() {
        return numHumans + numBots;
    }

    public boolean isHuman(int player) {
        return player < numHumans;
    }

    /** The first player to move: player 0, or the first bot when humans go second. */
    public int firstPlayer() {
        return humansFirst ? 0 : numHumans % numPlayers();
    }

    /** Adds humans until there are at least two players. */
    public Settings normalized() {
        int humans = Math.max(0, numHumans);
        int bots = Math.max(0, numBots);
        while (humans + bots < MIN_PLAYERS) humans++;
        return new Settings(boardSize, humans, bots, humansFirst, Math.max(1, botThinkTimeMs));
    }

    public Settings withBoardSize(int v)      { return new Settings(v, numHumans, numBots, humansFirst, botThinkTimeMs); }
    public Settings withHumans(int v)         { return new Settings(boardSize, v, numBots, humansFirst, botThinkTimeMs); }
    public Settings withBots(int v)           { return new Settings(boardSize, numHumans, v, humansFirst, botThinkTimeMs); }
    public Settings withHumansFirst(boolean v){ return new Settings(boardSize, numHumans, numBots, v, botThinkTimeMs); }
    public Settings withThinkTimeMs(long v)   { return new Settings(boardSize, numHumans, numBots, humansFirst, v); }
}
