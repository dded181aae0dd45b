package io.giantt.model;

import java.util.Locale;
import java.util.Map;

public enum DurationUnit {
    SECOND("s", 1L),
    MINUTE("min", 60L),
    HOUR("h", 3_600L),
    DAY("d", 86_400L),
    WEEK("w", 604_800L),
    // Fixed-length approximations, never calendar arithmetic.
    MONTH("mo", 2_592_000L),
    YEAR("y", 31_536_000L);

    private static final Map<String, DurationUnit> ALIASES = Map.ofEntries(
            Map.entry("hr", HOUR),
            Map.entry("minute", MINUTE),
            Map.entry("minutes", MINUTE),
            Map.entry("hour", HOUR),
            Map.entry("hours", HOUR),
            Map.entry("day", DAY),
            Map.entry("days", DAY),
            Map.entry("week", WEEK),
            Map.entry("weeks", WEEK),
            Map.entry("month", MONTH),
            Map.entry("months", MONTH),
            Map.entry("year", YEAR),
            Map.entry("years", YEAR)
    );

    private final String symbol;
    private final long seconds;

    DurationUnit(String symbol, long seconds) {
        this.symbol = symbol;
        this.seconds = seconds;
    }

    public String symbol() {
        return symbol;
    }

    public long seconds() {
        return seconds;
    }

    public static DurationUnit fromSymbol(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Duration unit cannot be empty");
        }
        String value = raw.toLowerCase(Locale.ROOT);
        for (DurationUnit unit : values()) {
            if (unit.symbol.equals(value)) {
                return unit;
            }
        }
        DurationUnit alias = ALIASES.get(value);
        if (alias == null) {
            throw new IllegalArgumentException("Invalid duration unit: " + raw);
        }
        return alias;
    }
}
