package hobogo.impl;

import hobogo.contracts.InfoHandler;
import hobogo.records.Action;
import hobogo.records.SearchInfo;
import hobogo.records.SearchSpec;
import hobogo.records.TimeAllocation;
import hobogo.rules.GameState;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.random.RandomGenerator;

import static hobogo.constants.CoreConstants.CHECK_EVERY_ITERATIONS;
import static hobogo.constants.CoreConstants.TM_UNSTABLE_RATIO;

/**
 * One worker's share of a decision: grows a private {@link MctsTree} over its own
 * copy of the root until the pool's stop flag, the iteration budget or the clock
 * says otherwise. Limits are checked between iterations only.
 */
final class SearchWorkerImpl {

    /** What a worker hands back to the pool once it is done. */
    record Outcome(Map<Action, Long> rootVisits, Map<Action, Double> rootRewards,
                   long iterations, int treeSize) {}

    private final WorkerPoolImpl pool;
    private final boolean isMainThread;
    private final double exploration;

    SearchWorkerImpl(WorkerPoolImpl pool, boolean isMainThread, double exploration) {
        this.pool = pool;
        this.isMainThread = isMainThread;
        this.exploration = exploration;
    }

    Outcome run(GameState root, SearchSpec spec, long iterationBudget, TimeAllocation limits,
                RandomGenerator rng, InfoHandler ih, long infoIntervalMs, long startMs) {
        MctsTree tree = new MctsTree(root, exploration);
        long lastInfoMs = startMs;

        while (true) {
            tree.iterate(rng);
            pool.countIteration();

            if (iterationBudget > 0 && tree.iterations() >= iterationBudget) break;
            if (tree.iterations() % CHECK_EVERY_ITERATIONS != 0) continue;

            if (pool.isStopped()) break;
            long now = System.currentTimeMillis();
            long elapsed = now - startMs;
            if (!limits.isUnlimited()) {
                if (elapsed >= limits.maximum()) break;
                if (elapsed >= limits.soft() && !isUndecided(tree)) break;
            }
            if (isMainThread && now - lastInfoMs >= infoIntervalMs) {
                ih.onInfo(snapshot(tree, elapsed));
                lastInfoMs = now;
            }
        }

        if (isMainThread) {
            ih.onInfo(snapshot(tree, System.currentTimeMillis() - startMs));
        }

        Map<Action, Long> visits = tree.rootVisits();
        Map<Action, Double> rewards = new LinkedHashMap<>();
        for (Action a : visits.keySet()) rewards.put(a, tree.averageReward(a));
        return new Outcome(visits, rewards, tree.iterations(), tree.size());
    }

    /** The runner-up is still close enough to the leader that more time may change the choice. */
    private static boolean isUndecided(MctsTree tree) {
        long first = 0, second = 0;
        for (long v : tree.rootVisits().values()) {
            if (v > first) {
                second = first;
                first = v;
            } else if (v > second) {
                second = v;
            }
        }
        return first > 0 && second >= TM_UNSTABLE_RATIO * first;
    }

    private SearchInfo snapshot(MctsTree tree, long elapsedMs) {
        long total = pool.totalIterations();
        long ips = elapsedMs > 0 ? (1000L * total) / elapsedMs : 0;
        Optional<Action> best = tree.bestAction();
        long bestVisits = best.map(a -> tree.rootVisits().get(a)).orElse(0L);
        double share = best.map(tree::averageReward).orElse(0.0);
        return new SearchInfo(total, tree.size(), elapsedMs, ips, best.orElse(null), bestVisits, share);
    }
}
