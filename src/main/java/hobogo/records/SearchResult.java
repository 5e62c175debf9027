package hobogo.records;

import java.util.Map;
import java.util.Optional;

/**
 * Final result produced when a search completes normally or is stopped.
 *
 * <p>All fields are immutable so callers can freely cache or forward
 * the object across threads.</p>
 *
 * @param bestAction     Chosen action; empty when no decision exists (no iteration ran,
 *                       or the root was already terminal). Callers skip the turn.
 * @param iterations     Total iterations completed by all workers.
 * @param treeSize       Nodes in the main worker's tree.
 * @param rootVisits     Merged visit count per root action, in expansion order.
 * @param expectedShare  Mover's average territory share below {@code bestAction}.
 * @param timeMs         Wall-clock time consumed by the search.
 */
public record SearchResult(
        Optional<Action>  bestAction,
        long              iterations,
        int               treeSize,
        Map<Action, Long> rootVisits,
        double            expectedShare,
        long              timeMs
) {
    public static SearchResult none(long timeMs) {
        return new SearchResult(Optional.empty(), 0, 0, Map.of(), 0.0, timeMs);
    }
}
