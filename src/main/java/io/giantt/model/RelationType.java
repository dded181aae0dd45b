package io.giantt.model;

public enum RelationType {
    REQUIRES("⊢"),
    ANYOF("⋲"),
    SUPERCHARGES("≫"),
    INDICATES("∴"),
    TOGETHER("∪"),
    CONFLICTS("⊟"),
    BLOCKS("►"),
    SUFFICIENT("≻");

    private final String symbol;

    RelationType(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    /**
     * The relation written on the target item whenever this one is written on the source.
     */
    public RelationType mirror() {
        return switch (this) {
            case REQUIRES -> BLOCKS;
            case BLOCKS -> REQUIRES;
            case ANYOF -> SUFFICIENT;
            case SUFFICIENT -> ANYOF;
            case SUPERCHARGES, INDICATES, TOGETHER, CONFLICTS -> this;
        };
    }

    public boolean isStrict() {
        return this == REQUIRES || this == ANYOF;
    }

    public boolean isSymmetric() {
        return mirror() == this;
    }

    public static RelationType fromSymbol(String symbol) {
        for (RelationType type : values()) {
            if (type.symbol.equals(symbol)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown relation symbol: " + symbol);
    }

    public static RelationType fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Relation type cannot be empty");
        }
        String value = raw.trim();
        for (RelationType type : values()) {
            if (type.name().equalsIgnoreCase(value) || type.symbol.equals(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown relation type: " + raw);
    }
}
