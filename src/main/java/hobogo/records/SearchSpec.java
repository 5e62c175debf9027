package hobogo.records;

/**
 * Immutable set of <em>search limits / directives</em> for one bot decision.
 *
 * Use the nested {@link Builder} to construct an instance of this record.
 *
 * @param iterations  Hard iteration budget (0 = unlimited).
 * @param moveTimeMs  Exact think time (0 = unused).
 * @param timeMs      Mover's remaining clock time (0 = no clock).
 * @param incMs       Mover's increment per turn.
 * @param movesToGo   Own turns until the next time control (0 = estimate).
 * @param infinite    Run until {@code stop()}, ignoring time limits.
 * @param seed        Random seed for reproducible searches ({@code null} = fresh entropy).
 */
public record SearchSpec(
        long    iterations,
        long    moveTimeMs,
        long    timeMs,
        long    incMs,
        int     movesToGo,
        boolean infinite,
        Long    seed
) {
    public static SearchSpec ofMoveTime(long ms) {
        return new Builder().moveTimeMs(ms).build();
    }

    public static SearchSpec ofIterations(long iterations, long seed) {
        return new Builder().iterations(iterations).seed(seed).build();
    }

    /** True when nothing but {@code stop()} (or the iteration budget) ends the search. */
    public boolean hasNoClock() {
        return infinite || (moveTimeMs <= 0 && timeMs <= 0);
    }

    /**
     * A builder for creating {@link SearchSpec} instances. This provides a fluent API
     * for setting search parameters and is more readable than a large constructor.
     */
    public static class Builder {
        private long iterations = 0;
        private long moveTimeMs = 0;
        private long timeMs = 0;
        private long incMs = 0;
        private int movesToGo = 0;
        private boolean infinite = false;
        private Long seed = null;

        public Builder iterations(long iterations) { this.iterations = iterations; return this; }
        public Builder moveTimeMs(long moveTimeMs) { this.moveTimeMs = moveTimeMs; return this; }
        public Builder timeMs(long timeMs) { this.timeMs = timeMs; return this; }
        public Builder incMs(long incMs) { this.incMs = incMs; return this; }
        public Builder movesToGo(int movesToGo) { this.movesToGo = movesToGo; return this; }
        public Builder infinite(boolean infinite) { this.infinite = infinite; return this; }
        public Builder seed(Long seed) { this.seed = seed; return this; }

        public SearchSpec build() {
            return new SearchSpec(iterations, moveTimeMs, timeMs, incMs, movesToGo, infinite, seed);
        }
    }
}
