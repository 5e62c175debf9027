package hobogo.records;

/**
 * Immutable snapshot of a single progress report that the search feeds to
 * a {@link hobogo.contracts.InfoHandler}.
 *
 * @param iterations     Completed iterations so far (all workers).
 * @param treeSize       Nodes in the main worker's tree.
 * @param timeMs         Wall-clock time elapsed (milliseconds).
 * @param ips            Average speed in iterations per second.
 * @param bestAction     Currently most visited root action ({@code null} before the first expansion).
 * @param bestVisits     Visits of that action.
 * @param expectedShare  Mover's average territory share below that action, in [0,1].
 */
public record SearchInfo(
        long   iterations,
        int    treeSize,
        long   timeMs,
        long   ips,
        Action bestAction,
        long   bestVisits,
        double expectedShare
) {}
