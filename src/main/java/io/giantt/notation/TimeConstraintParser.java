package io.giantt.notation;

import io.giantt.model.CompoundDuration;
import io.giantt.model.Consequence;
import io.giantt.model.Priority;
import io.giantt.model.TimeConstraint;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;

/**
 * Recursive-descent parser for {@code window(...)}, {@code due(...)} and {@code every(...)} expressions.
 */
public final class TimeConstraintParser {
    private TimeConstraintParser() {
    }

    public static TimeConstraint parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new ItemParseException("Empty time constraint", raw);
        }
        NotationReader reader = new NotationReader(raw.trim());
        TimeConstraint constraint = read(reader);
        if (!reader.atEnd()) {
            throw reader.error("Unexpected text after time constraint");
        }
        return constraint;
    }

    static TimeConstraint read(NotationReader reader) {
        int start = reader.position();
        String keyword = reader.readWhile(Character::isLetter);
        TimeConstraint.Kind kind = switch (keyword) {
            case "window" -> TimeConstraint.Kind.WINDOW;
            case "due" -> TimeConstraint.Kind.DEADLINE;
            case "every" -> TimeConstraint.Kind.RECURRING;
            default -> throw new ItemParseException("Unknown time constraint '" + keyword + "'", reader.text(), start);
        };
        reader.expect('(', "after " + keyword);

        CompoundDuration span = null;
        LocalDate dueDate = null;
        if (kind == TimeConstraint.Kind.DEADLINE) {
            dueDate = readDate(reader);
        } else {
            span = DurationParser.read(reader);
        }
        CompoundDuration grace = null;
        if (reader.peekIs(':')) {
            reader.advance(1);
            grace = DurationParser.read(reader);
        }
        reader.expect(',', "before consequence in " + keyword);
        Consequence consequence = readConsequence(reader);

        boolean stack = false;
        if (reader.peekIs(',')) {
            reader.advance(1);
            int flagAt = reader.position();
            String flag = reader.readWhile(Character::isLetter);
            if (!"stack".equals(flag) || kind != TimeConstraint.Kind.RECURRING) {
                throw new ItemParseException("Unexpected flag '" + flag + "' in " + keyword, reader.text(), flagAt);
            }
            stack = true;
        }
        reader.expect(')', "to close " + keyword);
        return new TimeConstraint(kind, span, dueDate, grace, consequence, stack);
    }

    private static LocalDate readDate(NotationReader reader) {
        int start = reader.position();
        String raw = reader.readWhile(ch -> (ch >= '0' && ch <= '9') || ch == '-');
        try {
            return LocalDate.parse(raw);
        } catch (DateTimeParseException e) {
            throw new ItemParseException("Invalid due date '" + raw + "'", reader.text(), start, e);
        }
    }

    private static Consequence readConsequence(NotationReader reader) {
        int start = reader.position();
        String word = reader.readWhile(Character::isLetter);
        switch (word) {
            case "severe":
                return Consequence.SEVERE;
            case "warn":
                return Consequence.WARN;
            case "escalating":
                return Consequence.escalating(Priority.NEUTRAL);
            case "escalate":
                reader.expect(':', "after escalate");
                Priority rate = Priority.glyphAt(reader.text(), reader.position());
                reader.advance(rate.symbol().length());
                return Consequence.escalating(rate);
            default:
                throw new ItemParseException("Unknown consequence '" + word + "'", reader.text(), start);
        }
    }
}
