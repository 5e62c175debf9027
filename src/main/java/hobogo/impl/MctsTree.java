package hobogo.impl;

import hobogo.contracts.TreeSearch;
import hobogo.records.Action;
import hobogo.rules.Board;
import hobogo.rules.GameState;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.random.RandomGenerator;

import static hobogo.constants.CoreConstants.DEFAULT_EXPLORATION;

/**
 * Multiplayer UCT over {@link GameState}.
 *
 * <p>Nodes live in an arena list, the root at index 0. Each node keeps the state it
 * stands for, the actions not yet expanded and the expanded children by index, keyed
 * by action. Rewards are vectors: every node accumulates one total per player, and
 * selection at a node maximises the reward of the player to move there.</p>
 *
 * <p>Reward of player p at the end of a rollout = p's score / number of cells.</p>
 */
public final class MctsTree implements TreeSearch {

    private final List<Node> arena = new ArrayList<>();
    private final double exploration;
    private final int cellCount;
    private long iterations;

    /* scratch for the selection path, grown on demand */
    private int[] path = new int[64];

    /* rollout buffers, reused by every iteration */
    private final boolean[] open;
    private final Board.Scratch scratch;

    private static final class Node {
        final GameState state;
        final int player;
        final boolean terminal;
        final List<Action> untried;
        final Map<Action, Integer> children = new LinkedHashMap<>();
        final double[] rewardSums;
        long visits;

        Node(GameState state) {
            this.state = state;
            this.player = state.nextPlayer();
            this.terminal = state.isTerminal();
            this.untried = terminal ? new ArrayList<>(0) : state.legalActions();
            this.rewardSums = new double[state.numPlayers()];
        }

        double mean(int p) {
            return visits == 0 ? 0.0 : rewardSums[p] / visits;
        }
    }

    public MctsTree(GameState root) {
        this(root, DEFAULT_EXPLORATION);
    }

    public MctsTree(GameState root, double exploration) {
        if (exploration < 0) throw new IllegalArgumentException("Exploration constant must be >= 0");
        this.exploration = exploration;
        this.cellCount = root.board().cellCount();
        this.open = new boolean[cellCount];
        this.scratch = new Board.Scratch(cellCount);
        arena.add(new Node(root.copy()));
    }

    /* ── one simulation ─────────────────────────────────────────── */

    @Override
    public void iterate(RandomGenerator rng) {
        int depth = 0;
        int current = 0;
        Node node = arena.get(0);
        depth = push(depth, current);

        // 1. selection
        while (!node.terminal && node.untried.isEmpty()) {
            current = select(node, rng);
            node = arena.get(current);
            depth = push(depth, current);
        }

        // 2. expansion
        if (!node.terminal) {
            Action action = takeRandom(node.untried, rng);
            Node child = new Node(node.state.apply(action));
            int index = arena.size();
            arena.add(child);
            node.children.put(action, index);
            node = child;
            depth = push(depth, index);
        }

        // 3. rollout
        int[] points = rollout(node.state, rng);

        // 4. backpropagation
        double[] reward = new double[points.length];
        for (int p = 0; p < points.length; p++) reward[p] = points[p] / (double) cellCount;
        for (int k = 0; k < depth; k++) {
            Node n = arena.get(path[k]);
            n.visits++;
            for (int p = 0; p < reward.length; p++) n.rewardSums[p] += reward[p];
        }
        iterations++;
    }

    /** UCB1 from the point of view of the player to move at {@code parent}. */
    private int select(Node parent, RandomGenerator rng) {
        double logN = Math.log(parent.visits);
        int player = parent.player;
        int best = -1;
        double bestScore = Double.NEGATIVE_INFINITY;
        int ties = 0;
        for (int index : parent.children.values()) {
            Node child = arena.get(index);
            double score = child.mean(player) + exploration * Math.sqrt(logN / child.visits);
            if (score > bestScore) {
                bestScore = score;
                best = index;
                ties = 1;
            } else if (score == bestScore && rng.nextInt(++ties) == 0) {
                best = index;
            }
        }
        return best;
    }

    /**
     * Plays uniformly random legal actions until the game is over. Legality does not depend
     * on the mover, so "no volatile cell" is both the end of the game and the only time a
     * pass would be forced; rollouts therefore never pass.
     */
    private int[] rollout(GameState from, RandomGenerator rng) {
        GameState sim = from.copy();
        Board board = sim.board();
        int n = sim.numPlayers();
        while (true) {
            int count = board.volatileCells(n, open, scratch);
            if (count == 0) break;

            int pick = rng.nextInt(count);
            for (int i = 0; i < open.length; i++) {
                if (open[i] && pick-- == 0) {
                    sim.advanceAt(i);
                    break;
                }
            }
        }
        return board.points(n, scratch);
    }

    private static Action takeRandom(List<Action> actions, RandomGenerator rng) {
        int k = rng.nextInt(actions.size());
        int last = actions.size() - 1;
        Collections.swap(actions, k, last);
        return actions.remove(last);
    }

    private int push(int depth, int index) {
        if (depth == path.length) {
            int[] grown = new int[path.length * 2];
            System.arraycopy(path, 0, grown, 0, path.length);
            path = grown;
        }
        path[depth] = index;
        return depth + 1;
    }

    /* ── queries ────────────────────────────────────────────────── */

    /** Ties go to the child expanded first; expansion order is itself random. */
    @Override
    public Optional<Action> bestAction() {
        Action best = null;
        long bestVisits = -1;
        for (Map.Entry<Action, Integer> e : arena.get(0).children.entrySet()) {
            long v = arena.get(e.getValue()).visits;
            if (v > bestVisits) {
                bestVisits = v;
                best = e.getKey();
            }
        }
        return Optional.ofNullable(best);
    }

    @Override
    public Map<Action, Long> rootVisits() {
        Map<Action, Long> out = new LinkedHashMap<>();
        arena.get(0).children.forEach((a, i) -> out.put(a, arena.get(i).visits));
        return out;
    }

    @Override
    public double averageReward(Action action) {
        Node root = arena.get(0);
        Integer index = root.children.get(action);
        return index == null ? 0.0 : arena.get(index).mean(root.player);
    }

    @Override public long iterations() { return iterations; }
    @Override public int size()        { return arena.size(); }

    public long rootVisitCount() {
        return arena.get(0).visits;
    }
}
