package hobogo.contracts;

import hobogo.records.Action;

import java.util.Map;
import java.util.Optional;
import java.util.random.RandomGenerator;

/**
 * A decision tree grown over one root position by repeated simulations.
 *
 * <p>Life-cycle: construct over a root state, call {@link #iterate} any number of
 * times, then query {@link #bestAction()}. A tree is confined to one thread.</p>
 */
public interface TreeSearch {

    /**
     * Runs one complete simulation (selection, expansion, rollout, backpropagation).
     * Never suspends and always finishes the rollout it started.
     *
     * @param rng source for every random choice made during this iteration
     */
    void iterate(RandomGenerator rng);

    /**
     * Most visited root action, or empty when nothing has been expanded yet
     * (no iteration ran, or the root is terminal).
     */
    Optional<Action> bestAction();

    /** Visits per expanded root action, in expansion order. */
    Map<Action, Long> rootVisits();

    /** Average reward of the player to move at the root, below {@code action}. */
    double averageReward(Action action);

    long iterations();

    int size();
}
