package hobogo.impl;

import hobogo.constants.CoreConstants;
import hobogo.contracts.TimeManager;
import hobogo.records.SearchSpec;
import hobogo.records.TimeAllocation;
import hobogo.rules.GameState;

/**
 * Turns a {@link SearchSpec} into soft and hard time limits.
 *
 * <p>Bot turns only ever pass a fixed think time. The clock branch serves {@code go time …}
 * from an analysing front-end: it splits the mover's remaining clock over the turns it can
 * still expect to play. The number of open (volatile) cells bounds how long the game can
 * last, so it replaces a fixed moves-to-go horizon as the game fills up.</p>
 */
public final class TimeManagerImpl implements TimeManager {

    public TimeManagerImpl() {}

    @Override
    public TimeAllocation calculate(SearchSpec spec, GameState state) {
        if (spec.infinite()) {
            return TimeAllocation.UNLIMITED;
        }

        if (spec.moveTimeMs() > 0) {
            long time = Math.max(1, spec.moveTimeMs() - CoreConstants.TM_OVERHEAD_MS);
            return new TimeAllocation(time, time);
        }

        if (spec.timeMs() <= 0) {
            // no clock: only the iteration budget or stop() ends the search
            return TimeAllocation.UNLIMITED;
        }

        long playerTime = Math.max(1, spec.timeMs() - CoreConstants.TM_OVERHEAD_MS);
        int movesToGo = spec.movesToGo() > 0 ? spec.movesToGo() : expectedOwnTurns(state);
        long softTimeMs = playerTime / movesToGo + spec.incMs();

        // The hard limit lets an undecided search run on, capped well inside the clock.
        long hardTimeMs = softTimeMs * CoreConstants.TM_MAX_FACTOR;
        hardTimeMs = Math.min(hardTimeMs, playerTime / 4 + spec.incMs());
        hardTimeMs = Math.min(hardTimeMs, playerTime - 10);

        softTimeMs = Math.min(softTimeMs, hardTimeMs);
        return new TimeAllocation(Math.max(1, softTimeMs), Math.max(1, hardTimeMs));
    }

    static int expectedOwnTurns(GameState state) {
        int open = 0;
        for (boolean b : state.volatileCells()) if (b) open++;
        int turns = (open + state.numPlayers() - 1) / state.numPlayers();
        return Math.max(1, Math.min(CoreConstants.TM_MOVE_HORIZON, turns));
    }
}
