package io.giantt.notation;

import io.giantt.model.CompoundDuration;
import io.giantt.model.Item;
import io.giantt.model.Priority;
import io.giantt.model.RelationType;
import io.giantt.model.Status;
import io.giantt.model.TimeConstraint;
import io.giantt.util.Jsons;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Reads and writes the one-line item notation:
 * <pre>status id&lt;priority&gt; duration "title" {charts} [tags] [&gt;&gt;&gt; rel[ids]...] [@@@ constraint...] [# comment] [### auto]</pre>
 * The description and occlude flag are not part of the line; occlude is decided by the file an item lives in.
 */
public final class ItemNotation {
    public static final String RELATIONS_MARKER = ">>>";
    public static final String CONSTRAINTS_MARKER = "@@@";
    public static final String AUTO_COMMENT_MARKER = "###";

    private ItemNotation() {
    }

    public static Item parse(String line) {
        return parse(line, false);
    }

    public static Item parse(String line, boolean occlude) {
        if (line == null) {
            throw new ItemParseException("Empty item line", null);
        }
        String trimmed = line.strip();
        if (trimmed.isEmpty() || trimmed.startsWith("#")) {
            throw new ItemParseException("Not an item line", line);
        }
        NotationReader reader = new NotationReader(trimmed);

        Status status = readStatus(reader);
        reader.requireWhitespace("status");

        int idStart = reader.position();
        String id = reader.readWhile(ch -> Character.isLetterOrDigit(ch) && ch < 128 || ch == '_');
        if (id.isEmpty()) {
            throw new ItemParseException("Missing item id", trimmed, idStart);
        }
        Priority priority = Priority.glyphAt(trimmed, reader.position());
        reader.advance(priority.symbol().length());
        if (!reader.atEnd() && !Character.isWhitespace(reader.peek())) {
            throw reader.error("Unknown priority symbol after id '" + id + "'");
        }
        reader.requireWhitespace("id");

        if (reader.peekIs('"')) {
            throw reader.error("Missing duration before title");
        }
        CompoundDuration duration = DurationParser.read(reader);
        reader.requireWhitespace("duration");

        if (!reader.peekIs('"')) {
            throw reader.error("Missing title");
        }
        String title = reader.readJsonString("title");
        reader.skipWhitespace();

        List<String> charts = reader.peekIs('{') ? readCharts(reader) : List.of();
        reader.skipWhitespace();

        List<String> tags = List.of();
        if (!reader.atEnd() && !reader.startsWith(RELATIONS_MARKER)
                && !reader.startsWith(CONSTRAINTS_MARKER) && !reader.peekIs('#')) {
            tags = readTags(reader);
            reader.skipWhitespace();
        }

        Map<RelationType, List<String>> relations = new EnumMap<>(RelationType.class);
        if (reader.startsWith(RELATIONS_MARKER)) {
            reader.advance(RELATIONS_MARKER.length());
            readRelations(reader, relations);
        }

        List<TimeConstraint> constraints = new ArrayList<>();
        if (reader.startsWith(CONSTRAINTS_MARKER)) {
            reader.advance(CONSTRAINTS_MARKER.length());
            readConstraints(reader, constraints);
        }

        String userComment = null;
        String autoComment = null;
        reader.skipWhitespace();
        if (reader.startsWith(AUTO_COMMENT_MARKER)) {
            reader.advance(AUTO_COMMENT_MARKER.length());
            autoComment = reader.readRest();
        } else if (reader.peekIs('#')) {
            reader.advance(1);
            String rest = reader.readRest();
            int auto = rest.indexOf(AUTO_COMMENT_MARKER);
            if (auto >= 0) {
                userComment = rest.substring(0, auto);
                autoComment = rest.substring(auto + AUTO_COMMENT_MARKER.length());
            } else {
                userComment = rest;
            }
        } else if (!reader.atEnd()) {
            throw reader.error("Unexpected text");
        }

        return new Item(id, title, "", status, priority, duration, charts, tags, relations,
                constraints, userComment, autoComment, occlude);
    }

    public static String serialize(Item item) {
        StringBuilder sb = new StringBuilder();
        sb.append(item.status().symbol()).append(' ')
                .append(item.id()).append(item.priority().symbol()).append(' ')
                .append(item.duration()).append(' ')
                .append(Jsons.quote(item.title())).append(' ')
                .append(item.charts().stream().map(Jsons::quote).collect(Collectors.joining(",", "{", "}")));
        if (!item.tags().isEmpty()) {
            sb.append(' ').append(String.join(",", item.tags()));
        }
        if (!item.relations().isEmpty()) {
            sb.append(' ').append(RELATIONS_MARKER);
            for (Map.Entry<RelationType, List<String>> entry : item.relations().entrySet()) {
                sb.append(' ').append(entry.getKey().symbol())
                        .append('[').append(String.join(",", entry.getValue())).append(']');
            }
        }
        if (!item.timeConstraints().isEmpty()) {
            sb.append(' ').append(CONSTRAINTS_MARKER);
            for (TimeConstraint constraint : item.timeConstraints()) {
                sb.append(' ').append(constraint);
            }
        }
        if (item.userComment() != null) {
            sb.append(" # ").append(item.userComment());
        }
        if (item.autoComment() != null) {
            sb.append(' ').append(AUTO_COMMENT_MARKER).append(' ').append(item.autoComment());
        }
        return sb.toString();
    }

    /**
     * True for lines a file scanner should skip: blank lines and lines starting with {@code #}.
     */
    public static boolean isCommentLine(String line) {
        String trimmed = line == null ? "" : line.strip();
        return trimmed.isEmpty() || trimmed.startsWith("#");
    }

    private static Status readStatus(NotationReader reader) {
        int start = reader.position();
        String glyph = reader.readCodePoint();
        try {
            return Status.fromSymbol(glyph);
        } catch (IllegalArgumentException e) {
            throw new ItemParseException("Unknown status symbol '" + glyph + "'", reader.text(), start, e);
        }
    }

    private static List<String> readCharts(NotationReader reader) {
        reader.expect('{', "to open charts");
        List<String> charts = new ArrayList<>();
        reader.skipWhitespace();
        if (reader.peekIs('}')) {
            reader.advance(1);
            return charts;
        }
        while (true) {
            reader.skipWhitespace();
            String chart = reader.readJsonString("chart name");
            if (!chart.isEmpty() && !charts.contains(chart)) {
                charts.add(chart);
            }
            reader.skipWhitespace();
            if (reader.peekIs('}')) {
                reader.advance(1);
                return charts;
            }
            reader.expect(',', "between chart names");
        }
    }

    private static List<String> readTags(NotationReader reader) {
        int start = reader.position();
        String raw = reader.readUntilWhitespace();
        List<String> tags = new ArrayList<>();
        for (String tag : raw.split(",", -1)) {
            if (!Item.isValidTag(tag)) {
                throw new ItemParseException("Invalid tag '" + tag + "'", reader.text(), start);
            }
            if (!tags.contains(tag)) {
                tags.add(tag);
            }
        }
        return tags;
    }

    private static void readRelations(NotationReader reader, Map<RelationType, List<String>> relations) {
        while (true) {
            reader.skipWhitespace();
            if (reader.atEnd() || reader.startsWith(CONSTRAINTS_MARKER) || reader.peekIs('#')) {
                return;
            }
            int start = reader.position();
            String symbol = reader.readCodePoint();
            RelationType type;
            try {
                type = RelationType.fromSymbol(symbol);
            } catch (IllegalArgumentException e) {
                throw new ItemParseException("Unknown relation symbol '" + symbol + "'", reader.text(), start, e);
            }
            if (relations.containsKey(type)) {
                throw new ItemParseException("Duplicate relation " + type + " on one line", reader.text(), start);
            }
            reader.expect('[', "after relation symbol " + symbol);
            int targetsAt = reader.position();
            String body = reader.readWhile(ch -> ch != ']');
            reader.expect(']', "to close relation targets");
            List<String> targets = new ArrayList<>();
            for (String raw : body.split(",", -1)) {
                String target = raw.trim();
                if (!Item.isValidId(target)) {
                    throw new ItemParseException(target.isEmpty()
                            ? "Empty relation target list for " + type
                            : "Invalid relation target '" + target + "'", reader.text(), targetsAt);
                }
                targets.add(target);
            }
            relations.put(type, targets);
        }
    }

    private static void readConstraints(NotationReader reader, List<TimeConstraint> constraints) {
        while (true) {
            reader.skipWhitespace();
            if (reader.atEnd() || reader.peekIs('#')) {
                break;
            }
            constraints.add(TimeConstraintParser.read(reader));
        }
        if (constraints.isEmpty()) {
            throw reader.error("Empty time constraint block");
        }
    }
}
