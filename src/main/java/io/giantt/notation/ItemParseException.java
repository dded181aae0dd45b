package io.giantt.notation;

import io.giantt.GianttException;

public class ItemParseException extends GianttException {
    private final String input;
    private final int position;

    public ItemParseException(String message, String input) {
        this(message, input, -1);
    }

    public ItemParseException(String message, String input, int position) {
        super(describe(message, input, position));
        this.input = input;
        this.position = position;
    }

    public ItemParseException(String message, String input, int position, Throwable cause) {
        super(describe(message, input, position), cause);
        this.input = input;
        this.position = position;
    }

    public String input() {
        return input;
    }

    public int position() {
        return position;
    }

    private static String describe(String message, String input, int position) {
        StringBuilder sb = new StringBuilder("Parse error: ").append(message);
        if (position >= 0) {
            sb.append(" (at column ").append(position + 1).append(')');
        }
        if (input != null) {
            sb.append(System.lineSeparator()).append("Input: ").append(input);
        }
        return sb.toString();
    }
}
