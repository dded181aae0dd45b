package io.giantt.model;

import java.util.ArrayList;
import java.util.List;

/**
 * A duration written as concatenated parts such as {@code 6mo8d3.5s}.
 *
 * <p>Equality is structural (same parts in the same order); use
 * {@link #compareTo(CompoundDuration)} or {@link #totalSeconds()} to compare lengths.
 * Zero-amount parts are dropped, so the zero duration has no parts and prints as {@code 0s}.
 */
public record CompoundDuration(List<DurationPart> parts) implements Comparable<CompoundDuration> {
    public static final CompoundDuration ZERO = new CompoundDuration(List.of());

    private static final List<DurationUnit> LARGEST_FIRST = List.of(
            DurationUnit.YEAR,
            DurationUnit.MONTH,
            DurationUnit.WEEK,
            DurationUnit.DAY,
            DurationUnit.HOUR,
            DurationUnit.MINUTE,
            DurationUnit.SECOND
    );

    public CompoundDuration {
        List<DurationPart> kept = new ArrayList<>();
        if (parts != null) {
            for (DurationPart part : parts) {
                if (part != null && part.amount() != 0) {
                    kept.add(part);
                }
            }
        }
        parts = List.copyOf(kept);
    }

    public static CompoundDuration of(double amount, DurationUnit unit) {
        return new CompoundDuration(List.of(new DurationPart(amount, unit)));
    }

    public double totalSeconds() {
        double total = 0;
        for (DurationPart part : parts) {
            total += part.totalSeconds();
        }
        return total;
    }

    public boolean isZero() {
        return parts.isEmpty();
    }

    /**
     * Sums both durations and expresses the result in the largest unit that fits at least once.
     */
    public CompoundDuration plus(CompoundDuration other) {
        double total = totalSeconds() + (other == null ? 0 : other.totalSeconds());
        if (total == 0) {
            return ZERO;
        }
        for (DurationUnit unit : LARGEST_FIRST) {
            if (total >= unit.seconds()) {
                return of(total / unit.seconds(), unit);
            }
        }
        return of(total, DurationUnit.SECOND);
    }

    @Override
    public int compareTo(CompoundDuration other) {
        return Double.compare(totalSeconds(), other.totalSeconds());
    }

    @Override
    public String toString() {
        if (parts.isEmpty()) {
            return "0s";
        }
        StringBuilder sb = new StringBuilder();
        for (DurationPart part : parts) {
            sb.append(part);
        }
        return sb.toString();
    }
}
