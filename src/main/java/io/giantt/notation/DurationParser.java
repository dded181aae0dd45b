package io.giantt.notation;

import io.giantt.model.CompoundDuration;
import io.giantt.model.DurationPart;
import io.giantt.model.DurationUnit;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses compound durations such as {@code 3mo}, {@code 2w3d} or {@code 6mo8d3.5s}.
 */
public final class DurationParser {
    private DurationParser() {
    }

    public static CompoundDuration parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new ItemParseException("Empty duration", raw);
        }
        NotationReader reader = new NotationReader(raw.trim());
        CompoundDuration duration = read(reader);
        if (!reader.atEnd()) {
            throw reader.error("Unexpected text after duration");
        }
        return duration;
    }

    static CompoundDuration read(NotationReader reader) {
        List<DurationPart> parts = new ArrayList<>();
        while (!reader.atEnd() && isDigit(reader.peek())) {
            String number = reader.readWhile(DurationParser::isDigit);
            if (reader.peekIs('.')) {
                reader.advance(1);
                String fraction = reader.readWhile(DurationParser::isDigit);
                if (fraction.isEmpty()) {
                    throw reader.error("Expected digits after decimal point in duration");
                }
                number = number + "." + fraction;
            }
            int unitStart = reader.position();
            String unit = reader.readWhile(Character::isLetter);
            if (unit.isEmpty()) {
                throw reader.error("Missing unit after duration amount " + number);
            }
            try {
                parts.add(new DurationPart(Double.parseDouble(number), DurationUnit.fromSymbol(unit)));
            } catch (IllegalArgumentException e) {
                throw new ItemParseException("Invalid duration unit: " + unit, reader.text(), unitStart, e);
            }
        }
        if (parts.isEmpty()) {
            throw reader.error("Missing duration");
        }
        return new CompoundDuration(parts);
    }

    private static boolean isDigit(int ch) {
        return ch >= '0' && ch <= '9';
    }
}
