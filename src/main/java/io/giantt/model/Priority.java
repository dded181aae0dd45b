package io.giantt.model;

import java.util.List;

public enum Priority {
    LOWEST(",,,"),
    LOW("..."),
    NEUTRAL(""),
    UNSURE("?"),
    MEDIUM("!"),
    HIGH("!!"),
    CRITICAL("!!!");

    // Longest glyphs first so "!!!" is never read as "!" followed by "!!".
    private static final List<Priority> MATCH_ORDER = List.of(CRITICAL, HIGH, MEDIUM, UNSURE, LOW, LOWEST);

    private final String symbol;

    Priority(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    public static Priority fromSymbol(String symbol) {
        String value = symbol == null ? "" : symbol;
        for (Priority priority : values()) {
            if (priority.symbol.equals(value)) {
                return priority;
            }
        }
        throw new IllegalArgumentException("Unknown priority symbol: " + symbol);
    }

    /**
     * Returns the priority whose glyph starts {@code text} at {@code offset},
     * or {@link #NEUTRAL} when no glyph is present there.
     */
    public static Priority glyphAt(CharSequence text, int offset) {
        for (Priority priority : MATCH_ORDER) {
            String glyph = priority.symbol;
            if (offset + glyph.length() <= text.length()
                    && text.subSequence(offset, offset + glyph.length()).toString().equals(glyph)) {
                return priority;
            }
        }
        return NEUTRAL;
    }

    public static Priority fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return NEUTRAL;
        }
        String value = raw.trim();
        for (Priority priority : values()) {
            if (priority.name().equalsIgnoreCase(value) || priority.symbol.equals(value)) {
                return priority;
            }
        }
        throw new IllegalArgumentException("Unknown priority: " + raw);
    }
}
