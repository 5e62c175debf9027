package hobogo.impl;

import hobogo.contracts.EngineOptions;
import hobogo.contracts.Search;
import hobogo.records.Settings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Consumer;

import static hobogo.constants.CoreConstants.*;

/**
 * Implements the EngineOptions contract: game setup and search knobs, set with
 * {@code setoption name <Name> value <Value>}.
 */
public class EngineOptionsImpl implements EngineOptions {

    private static final Logger LOG = LoggerFactory.getLogger(EngineOptionsImpl.class);

    private Search search;
    private final PrintStream out;

    private Settings settings = Settings.defaults();
    private Long seed = null;
    private long infoIntervalMs = DEFAULT_INFO_INTERVAL_MS;

    private record Option(String type, String defaultValue, Long min, Long max, Consumer<String> onSet) {
        void print(PrintStream out, String name) {
            StringBuilder sb = new StringBuilder("option name ").append(name).append(" type ").append(type);
            if (defaultValue != null) sb.append(" default ").append(defaultValue);
            if (min != null) sb.append(" min ").append(min);
            if (max != null) sb.append(" max ").append(max);
            out.println(sb);
        }
    }

    private final Map<String, Option> options = new LinkedHashMap<>();
    private final Map<String, String> values = new LinkedHashMap<>();

    public EngineOptionsImpl(Search search, PrintStream out) {
        this.search = search;
        this.out = out;
        initializeOptions();
    }

    private void initializeOptions() {
        spin("ThinkTime", DEFAULT_THINK_TIME_MS, 10, 600_000,
                v -> settings = settings.withThinkTimeMs(v));
        spin("Threads", 1, 1, 128,
                v -> { if (search != null) search.setThreads((int) v); });
        spin("Exploration", Math.round(DEFAULT_EXPLORATION * 100), 0, 1000,
                v -> { if (search != null) search.setExploration(v / 100.0); });
        spin("BoardSize", DEFAULT_BOARD_SIZE, MIN_BOARD_SIZE, MAX_BOARD_SIZE,
                v -> settings = settings.withBoardSize((int) v));
        spin("Humans", DEFAULT_HUMANS, 0, MAX_HUMANS,
                v -> settings = settings.withHumans((int) v));
        spin("Bots", DEFAULT_BOTS, 0, MAX_BOTS,
                v -> settings = settings.withBots((int) v));
        check("HumansFirst", true,
                v -> settings = settings.withHumansFirst(v));
        spin("Seed", 0, 0, Integer.MAX_VALUE,
                v -> seed = v == 0 ? null : v);
        spin("InfoInterval", DEFAULT_INFO_INTERVAL_MS, 10, 60_000,
                v -> {
                    infoIntervalMs = v;
                    if (search != null) search.setInfoIntervalMs(v);
                });
    }

    private void spin(String name, long def, long min, long max, LongSetter onSet) {
        options.put(name, new Option("spin", Long.toString(def), min, max, raw -> {
            long v;
            try {
                v = Long.parseLong(raw.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Option " + name + " expects a number, got '" + raw + "'", e);
            }
            if (v < min || v > max) {
                throw new IllegalArgumentException("Option " + name + " must be in " + min + ".." + max + ", got " + v);
            }
            onSet.accept(v);
        }));
        values.put(name, Long.toString(def));
    }

    private void check(String name, boolean def, Consumer<Boolean> onSet) {
        options.put(name, new Option("check", Boolean.toString(def), null, null, raw -> {
            String v = raw.trim().toLowerCase();
            if (!v.equals("true") && !v.equals("false")) {
                throw new IllegalArgumentException("Option " + name + " expects true or false, got '" + raw + "'");
            }
            onSet.accept(Boolean.parseBoolean(v));
        }));
        values.put(name, Boolean.toString(def));
    }

    @FunctionalInterface
    private interface LongSetter {
        void accept(long v);
    }

    @Override
    public void setOption(String line) {
        String[] parts = line.split(" value ", 2);
        String namePart = parts[0].replaceFirst("^\\s*setoption\\s+name\\s+", "").trim();
        String valuePart = parts.length > 1 ? parts[1].trim() : "";

        String key = resolve(namePart);
        if (key == null) {
            throw new IllegalArgumentException("Unknown option: " + namePart);
        }
        options.get(key).onSet().accept(valuePart);
        values.put(key, valuePart);
        LOG.debug("Option {} set to {}", key, valuePart);
    }

    /** Option names are matched case-insensitively. */
    private String resolve(String name) {
        for (String key : options.keySet()) {
            if (key.equalsIgnoreCase(name)) return key;
        }
        return null;
    }

    @Override
    public void printOptions() {
        for (Map.Entry<String, Option> entry : options.entrySet()) {
            entry.getValue().print(out, entry.getKey());
        }
    }

    @Override
    public String getOptionValue(String name) {
        String key = resolve(name);
        return key != null ? values.get(key) : null;
    }

    @Override public Settings settings()     { return settings.normalized(); }
    @Override public Long seed()             { return seed; }
    @Override public long infoIntervalMs()   { return infoIntervalMs; }

    @Override
    public void attachSearch(Search s) { this.search = s; }
}
