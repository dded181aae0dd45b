package io.giantt.model;

import java.util.Objects;

public record Consequence(Type type, Priority rate) {
    public static final Consequence SEVERE = new Consequence(Type.SEVERE, Priority.NEUTRAL);
    public static final Consequence WARN = new Consequence(Type.WARN, Priority.NEUTRAL);

    public enum Type {
        SEVERE,
        WARN,
        ESCALATING
    }

    public Consequence {
        Objects.requireNonNull(type, "type");
        rate = type == Type.ESCALATING && rate != null ? rate : Priority.NEUTRAL;
    }

    public static Consequence escalating(Priority rate) {
        return new Consequence(Type.ESCALATING, rate == null ? Priority.NEUTRAL : rate);
    }

    @Override
    public String toString() {
        return switch (type) {
            case SEVERE -> "severe";
            case WARN -> "warn";
            case ESCALATING -> "escalate:" + rate.symbol();
        };
    }
}
