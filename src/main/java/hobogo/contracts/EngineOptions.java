package hobogo.contracts;

import hobogo.records.Settings;

/**
 * Defines the contract for a class that manages engine options. An implementation
 * is responsible for parsing and applying option settings received as
 * {@code setoption name <Name> value <Value>} lines.
 */
public interface EngineOptions {

    /**
     * Parses a "setoption" command line and applies the given value
     * to the corresponding engine parameter.
     *
     * @param line The full "setoption ..." command line.
     * @throws IllegalArgumentException for unknown options or values out of range
     */
    void setOption(String line);

    /**
     * Prints all available options in the format
     * {@code option name X type spin default D min A max B}.
     */
    void printOptions();

    /** Current value of an option as text, or {@code null} if there is no such option. */
    String getOptionValue(String name);

    /** Game setup assembled from the BoardSize, Humans, Bots, HumansFirst and ThinkTime options. */
    Settings settings();

    /** Fixed seed for bot searches, or {@code null} for fresh entropy. */
    Long seed();

    long infoIntervalMs();

    void attachSearch(Search s);
}
