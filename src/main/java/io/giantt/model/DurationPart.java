package io.giantt.model;

import java.math.BigDecimal;
import java.util.Objects;

public record DurationPart(double amount, DurationUnit unit) {
    public DurationPart {
        Objects.requireNonNull(unit, "unit");
        if (amount < 0 || Double.isNaN(amount) || Double.isInfinite(amount)) {
            throw new IllegalArgumentException("Duration amount must be a finite non-negative number: " + amount);
        }
    }

    public double totalSeconds() {
        return amount * unit.seconds();
    }

    @Override
    public String toString() {
        return formatAmount(amount) + unit.symbol();
    }

    static String formatAmount(double amount) {
        return BigDecimal.valueOf(amount).stripTrailingZeros().toPlainString();
    }
}
