package io.giantt.notation;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.giantt.util.Jsons;

import java.util.function.IntPredicate;

/**
 * Cursor over a single line of item notation. Every failure is reported as an
 * {@link ItemParseException} pointing at the current column.
 */
final class NotationReader {
    private final String text;
    private int pos;

    NotationReader(String text) {
        this.text = text;
        this.pos = 0;
    }

    String text() {
        return text;
    }

    int position() {
        return pos;
    }

    boolean atEnd() {
        return pos >= text.length();
    }

    int peek() {
        return atEnd() ? -1 : text.codePointAt(pos);
    }

    boolean startsWith(String prefix) {
        return text.startsWith(prefix, pos);
    }

    boolean peekIs(char ch) {
        return !atEnd() && text.charAt(pos) == ch;
    }

    int skipWhitespace() {
        int start = pos;
        while (!atEnd() && Character.isWhitespace(text.charAt(pos))) {
            pos++;
        }
        return pos - start;
    }

    void requireWhitespace(String after) {
        if (atEnd()) {
            throw error("Unexpected end of line after " + after);
        }
        if (skipWhitespace() == 0) {
            throw error("Expected whitespace after " + after + " but found '" + rest(1) + "'");
        }
    }

    void advance(int count) {
        pos = Math.min(text.length(), pos + count);
    }

    String readCodePoint() {
        if (atEnd()) {
            throw error("Unexpected end of line");
        }
        int cp = text.codePointAt(pos);
        String out = new String(Character.toChars(cp));
        pos += out.length();
        return out;
    }

    String readWhile(IntPredicate accept) {
        int start = pos;
        while (!atEnd() && accept.test(text.charAt(pos))) {
            pos++;
        }
        return text.substring(start, pos);
    }

    String readUntilWhitespace() {
        return readWhile(ch -> !Character.isWhitespace(ch));
    }

    String readRest() {
        String out = text.substring(pos);
        pos = text.length();
        return out;
    }

    void expect(char ch, String what) {
        if (!peekIs(ch)) {
            throw error("Expected '" + ch + "' " + what + (atEnd() ? " but the line ended" : " but found '" + rest(1) + "'"));
        }
        pos++;
    }

    /**
     * Reads a JSON string literal starting at the current opening quote and returns its decoded value.
     */
    String readJsonString(String what) {
        int start = pos;
        expect('"', "to open " + what);
        boolean escaped = false;
        while (!atEnd()) {
            char ch = text.charAt(pos++);
            if (escaped) {
                escaped = false;
            } else if (ch == '\\') {
                escaped = true;
            } else if (ch == '"') {
                String literal = text.substring(start, pos);
                try {
                    return Jsons.compact().readValue(literal, String.class);
                } catch (JsonProcessingException e) {
                    throw new ItemParseException("Invalid JSON string for " + what + ": " + literal, text, start, e);
                }
            }
        }
        throw new ItemParseException("Unbalanced quotes in " + what, text, start);
    }

    ItemParseException error(String message) {
        return new ItemParseException(message, text, pos);
    }

    private String rest(int max) {
        if (atEnd()) {
            return "";
        }
        int cp = text.codePointAt(pos);
        return max <= 1 ? new String(Character.toChars(cp)) : text.substring(pos, Math.min(text.length(), pos + max));
    }
}
