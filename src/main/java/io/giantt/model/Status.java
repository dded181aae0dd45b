package io.giantt.model;

public enum Status {
    NOT_STARTED("○"),
    IN_PROGRESS("◑"),
    BLOCKED("⊘"),
    COMPLETED("●");

    private final String symbol;

    Status(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    public static Status fromSymbol(String symbol) {
        for (Status value : values()) {
            if (value.symbol.equals(symbol)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown status symbol: " + symbol);
    }

    public static Status fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Status cannot be empty");
        }
        String value = raw.trim();
        for (Status status : values()) {
            if (status.name().equalsIgnoreCase(value)
                    || status.name().replace("_", "-").equalsIgnoreCase(value)
                    || status.symbol.equals(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown status: " + raw);
    }
}
