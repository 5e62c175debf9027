package hobogo.impl;

import hobogo.contracts.InfoHandler;
import hobogo.contracts.PositionCodec;
import hobogo.contracts.Search;
import hobogo.records.Action;
import hobogo.records.SearchResult;
import hobogo.records.SearchSpec;
import hobogo.records.Settings;
import hobogo.rules.GameState;
import hobogo.rules.IllegalActionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Owns the authoritative game: the settings it was started with, the current state
 * and the undo history. Humans act through {@link #playHuman(Action)}; bots are
 * asked for their decisions by {@link #playBots()}, which hands each of them a
 * snapshot of the state and applies whatever comes back.
 */
public final class GameSession {

    private static final Logger LOG = LoggerFactory.getLogger(GameSession.class);

    private static final List<String> COLOUR_NAMES = List.of("Yellow", "Pink", "Green", "Purple");

    /** One turn taken by a bot. */
    public record Turn(int player, Action action) {}

    /** Everything needed to put the session back exactly where it was. */
    public record Snapshot(Settings settings, String position) {}

    private record Saved(Settings settings, GameState state) {}

    private final Search search;
    private final PositionCodec codec;
    private final Deque<Saved> undoStack = new ArrayDeque<>();

    private Settings settings;
    private GameState state;
    private Long seed;

    public GameSession(Search search, PositionCodec codec, Settings settings) {
        this.search = Objects.requireNonNull(search, "search");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.settings = settings.normalized();
        this.state = freshState(this.settings);
    }

    public Settings settings() { return settings; }
    public GameState state()   { return state; }
    public boolean canUndo()   { return !undoStack.isEmpty(); }

    /** Fixed seed for bot searches; {@code null} draws fresh entropy per decision. */
    public void setSeed(Long seed) { this.seed = seed; }

    /**
     * Starts over with {@code newSettings}. The abandoned game is kept for undo unless
     * nobody had placed a stone yet.
     */
    public void newGame(Settings newSettings) {
        Settings normalized = newSettings.normalized();
        if (!state.board().isEmpty()) {
            undoStack.push(new Saved(settings, state));
        }
        settings = normalized;
        state = freshState(normalized);
        LOG.info("New game: {}x{}, {} human(s), {} bot(s), {} starts",
                normalized.boardSize(), normalized.boardSize(), normalized.numHumans(),
                normalized.numBots(), playerName(state.nextPlayer()));
    }

    /**
     * Replaces the current game by an arbitrary position, keeping the old one for undo.
     * The board size follows the position. When the player count differs, the humans keep
     * the low indices and the rest become bots.
     */
    public void setPosition(GameState position) {
        Objects.requireNonNull(position, "position");
        if (!state.board().isEmpty()) {
            undoStack.push(new Saved(settings, state));
        }
        int n = position.numPlayers();
        if (n != settings.numPlayers()) {
            int humans = Math.min(settings.numHumans(), n);
            settings = settings.withHumans(humans).withBots(n - humans);
        }
        settings = settings.withBoardSize(position.board().width());
        state = position;
    }

    /**
     * Plays a human action for the player to move.
     *
     * @throws IllegalStateException  when the game is over or a bot is to move
     * @throws IllegalActionException when the action is not legal here
     */
    public void playHuman(Action action) {
        Objects.requireNonNull(action, "action");
        if (state.isTerminal()) {
            throw new IllegalStateException("Game over");
        }
        int player = state.nextPlayer();
        if (!settings.isHuman(player)) {
            throw new IllegalStateException(playerName(player) + " is not a human player");
        }
        if (!state.isLegal(action)) {
            throw new IllegalActionException("Illegal action " + action.name() + " for " + playerName(player));
        }
        undoStack.push(new Saved(settings, state));
        state = state.apply(action);
        LOG.info("{} plays {}", playerName(player), action.name());
        logIfOver();
    }

    /** Lets bots move until a human is to move or the game ends. */
    public List<Turn> playBots() {
        return playBots(InfoHandler.NONE);
    }

    public List<Turn> playBots(InfoHandler ih) {
        List<Turn> turns = new ArrayList<>();
        while (!state.isTerminal() && !settings.isHuman(state.nextPlayer())) {
            int player = state.nextPlayer();
            SearchSpec spec = new SearchSpec.Builder()
                    .moveTimeMs(settings.botThinkTimeMs())
                    .seed(seed)
                    .build();
            SearchResult result = search.search(state, spec, ih);
            // no decision: the bot skips its turn
            Action action = result.bestAction().orElse(Action.PASS);
            state = state.apply(action);
            turns.add(new Turn(player, action));
            LOG.info("{} plays {} ({} iterations, expected share {})", playerName(player), action.name(),
                    result.iterations(), String.format("%.3f", result.expectedShare()));
        }
        logIfOver();
        return turns;
    }

    /**
     * Steps back to the state before the last human action or the last new game.
     *
     * @throws IllegalStateException when there is nothing to undo
     */
    public void undo() {
        Saved saved = undoStack.poll();
        if (saved == null) {
            throw new IllegalStateException("Nothing to undo");
        }
        settings = saved.settings();
        state = saved.state();
        LOG.debug("Undo: back to {}", codec.toText(state));
    }

    /** Yellow, Pink, Green, Purple, then the index; bots carry a {@code (bot)} suffix. */
    public String playerName(int player) {
        String base = player < COLOUR_NAMES.size() ? COLOUR_NAMES.get(player) : Integer.toString(player);
        return settings.isHuman(player) ? base : base + " (bot)";
    }

    public int[] score() {
        return state.points();
    }

    public Snapshot snapshot() {
        return new Snapshot(settings, codec.toText(state));
    }

    /** @throws IllegalArgumentException when the notation does not fit the settings */
    public void restore(Snapshot snapshot) {
        Settings restored = snapshot.settings().normalized();
        GameState position = codec.fromText(snapshot.position());
        if (position.numPlayers() != restored.numPlayers()) {
            throw new IllegalArgumentException("Snapshot position has " + position.numPlayers()
                    + " players, settings have " + restored.numPlayers());
        }
        if (position.board().width() != restored.boardSize()) {
            throw new IllegalArgumentException("Snapshot position is " + position.board().width()
                    + " wide, settings say " + restored.boardSize());
        }
        undoStack.clear();
        settings = restored;
        state = position;
    }

    private void logIfOver() {
        if (state.isTerminal()) {
            LOG.info("Game over, score {}", Arrays.toString(state.points()));
        }
    }

    private static GameState freshState(Settings s) {
        return GameState.newGame(s.boardSize(), s.numPlayers(), s.firstPlayer());
    }
}
