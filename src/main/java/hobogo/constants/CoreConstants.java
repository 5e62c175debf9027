package hobogo.constants;

/**
 * Central place for engine-wide compile-time constants.
 */
public final class CoreConstants {

    private CoreConstants() {}

    /* ────────────── Cells / players ────────────── */
    public static final int EMPTY = -1;
    /** Returned by cell reads for coordinates outside the board. */
    public static final int OFF_BOARD = -2;
    public static final int NO_PLAYER = -1;
    public static final int NO_INDEX = -1;

    /** Player ids are written as a single base-36 digit in the position notation. */
    public static final int MAX_PLAYERS = 36;
    public static final int MIN_PLAYERS = 2;

    public static final int MAX_BOARD_SIDE = 64;

    /** Distance value for cells a player cannot reach. */
    public static final int UNREACHABLE = Integer.MAX_VALUE;

    /* ────────────── Session defaults ────────────── */
    public static final int DEFAULT_BOARD_SIZE = 9;
    public static final int DEFAULT_HUMANS = 1;
    public static final int DEFAULT_BOTS = 1;
    public static final long DEFAULT_THINK_TIME_MS = 1000;

    /* Option ranges for board size and player counts */
    public static final int MIN_BOARD_SIZE = 5;
    public static final int MAX_BOARD_SIZE = 17;
    public static final int MAX_HUMANS = 4;
    public static final int MAX_BOTS = 4;

    /* ────────────── Tree search ────────────── */
    public static final double DEFAULT_EXPLORATION = Math.sqrt(2.0);

    /** Iterations between two clock / stop-flag checks. */
    public static final int CHECK_EVERY_ITERATIONS = 16;

    public static final long DEFAULT_INFO_INTERVAL_MS = 500;

    /* ────────────── Time management ────────────── */
    public static final int TM_OVERHEAD_MS = 20;
    /** Upper bound for the expected number of remaining own turns. */
    public static final int TM_MOVE_HORIZON = 40;
    /** Hard limit as a multiple of the soft limit. */
    public static final int TM_MAX_FACTOR = 3;
    /** Keep thinking past the soft limit while the runner-up has at least this share of the leader's visits. */
    public static final double TM_UNSTABLE_RATIO = 0.85;
}
