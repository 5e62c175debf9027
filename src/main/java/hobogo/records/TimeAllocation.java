package hobogo.records;

/**
 * A record to hold the calculated soft and maximum thinking time for a decision.
 *
 * @param soft The target time in milliseconds the search should aim for (soft limit).
 * @param maximum The hard limit in milliseconds the search must not exceed.
 */
public record TimeAllocation(long soft, long maximum) {

    public static final TimeAllocation UNLIMITED = new TimeAllocation(Long.MAX_VALUE, Long.MAX_VALUE);

    public boolean isUnlimited() {
        return soft >= Long.MAX_VALUE / 2;
    }
}
