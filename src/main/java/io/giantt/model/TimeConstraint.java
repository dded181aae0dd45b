package io.giantt.model;

import java.time.LocalDate;
import java.util.Objects;

/**
 * One of three constraint shapes: a completion window, a due date, or a recurrence.
 * Fields that do not apply to {@link #kind()} are {@code null} (or {@code false} for {@code stack}).
 */
public record TimeConstraint(
        Kind kind,
        CompoundDuration span,
        LocalDate dueDate,
        CompoundDuration grace,
        Consequence consequence,
        boolean stack
) {
    public enum Kind {
        WINDOW("window"),
        DEADLINE("due"),
        RECURRING("every");

        private final String keyword;

        Kind(String keyword) {
            this.keyword = keyword;
        }

        public String keyword() {
            return keyword;
        }
    }

    public TimeConstraint {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(consequence, "consequence");
        if (kind == Kind.DEADLINE) {
            Objects.requireNonNull(dueDate, "dueDate");
            span = null;
        } else {
            Objects.requireNonNull(span, "span");
            dueDate = null;
        }
        if (kind != Kind.RECURRING) {
            stack = false;
        }
    }

    public static TimeConstraint window(CompoundDuration span, CompoundDuration grace, Consequence consequence) {
        return new TimeConstraint(Kind.WINDOW, span, null, grace, consequence, false);
    }

    public static TimeConstraint deadline(LocalDate dueDate, CompoundDuration grace, Consequence consequence) {
        return new TimeConstraint(Kind.DEADLINE, null, dueDate, grace, consequence, false);
    }

    public static TimeConstraint recurring(CompoundDuration interval, CompoundDuration grace, Consequence consequence, boolean stack) {
        return new TimeConstraint(Kind.RECURRING, interval, null, grace, consequence, stack);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(kind.keyword()).append('(');
        sb.append(kind == Kind.DEADLINE ? dueDate.toString() : span.toString());
        if (grace != null) {
            sb.append(':').append(grace);
        }
        sb.append(',').append(consequence);
        if (stack) {
            sb.append(",stack");
        }
        return sb.append(')').toString();
    }
}
