package hobogo.contracts;

import hobogo.rules.GameState;
import hobogo.records.SearchSpec;
import hobogo.records.TimeAllocation;

/**
 * Calculates the soft and maximum thinking time for a single decision.
 */
public interface TimeManager {

    /**
     * Calculates the time allocation for the upcoming search.
     * @param spec The search limits (fixed move time, remaining clock, etc.).
     * @param state The position the decision is made for.
     * @return A {@link TimeAllocation} record containing the soft and maximum times.
     */
    TimeAllocation calculate(SearchSpec spec, GameState state);
}
