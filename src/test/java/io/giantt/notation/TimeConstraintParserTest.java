package io.giantt.notation;

import io.giantt.model.CompoundDuration;
import io.giantt.model.Consequence;
import io.giantt.model.DurationUnit;
import io.giantt.model.Priority;
import io.giantt.model.TimeConstraint;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TimeConstraintParserTest {
    @Test
    void windowWithGraceParses() {
        TimeConstraint constraint = TimeConstraintParser.parse("window(5d:2d,severe)");

        assertEquals(TimeConstraint.Kind.WINDOW, constraint.kind());
        assertEquals(CompoundDuration.of(5, DurationUnit.DAY), constraint.span());
        assertEquals(CompoundDuration.of(2, DurationUnit.DAY), constraint.grace());
        assertEquals(Consequence.SEVERE, constraint.consequence());
        assertEquals("window(5d:2d,severe)", constraint.toString());
    }

    @Test
    void deadlineParsesIsoDate() {
        TimeConstraint constraint = TimeConstraintParser.parse("due(2025-03-01,warn)");

        assertEquals(LocalDate.of(2025, 3, 1), constraint.dueDate());
        assertNull(constraint.span());
        assertNull(constraint.grace());
        assertEquals(Consequence.WARN, constraint.consequence());
    }

    @Test
    void recurringAcceptsStackAndEscalationRate() {
        TimeConstraint constraint = TimeConstraintParser.parse("every(1w:1d,escalate:!!,stack)");

        assertEquals(TimeConstraint.Kind.RECURRING, constraint.kind());
        assertEquals(Consequence.escalating(Priority.HIGH), constraint.consequence());
        assertTrue(constraint.stack());
        assertEquals("every(1w:1d,escalate:!!,stack)", constraint.toString());
    }

    @Test
    void legacyEscalatingKeywordUsesNeutralRate() {
        TimeConstraint constraint = TimeConstraintParser.parse("every(1d,escalating)");

        assertEquals(Consequence.escalating(Priority.NEUTRAL), constraint.consequence());
        assertFalse(constraint.stack());
        assertEquals("every(1d,escalate:)", constraint.toString());
    }

    @Test
    void lowestRateIsNotSplitOnCommas() {
        TimeConstraint constraint = TimeConstraintParser.parse("window(1d,escalate:,,,)");

        assertEquals(Priority.LOWEST, constraint.consequence().rate());
    }

    @Test
    void malformedExpressionsFail() {
        assertThrows(ItemParseException.class, () -> TimeConstraintParser.parse("window(5d)"));
        assertThrows(ItemParseException.class, () -> TimeConstraintParser.parse("soon(5d,warn)"));
        assertThrows(ItemParseException.class, () -> TimeConstraintParser.parse("due(2025-13-40,warn)"));
        assertThrows(ItemParseException.class, () -> TimeConstraintParser.parse("window(5d,warn,stack)"));
        assertThrows(ItemParseException.class, () -> TimeConstraintParser.parse("every(1d,panic)"));
        assertThrows(ItemParseException.class, () -> TimeConstraintParser.parse("every(1d,warn"));
    }
}
