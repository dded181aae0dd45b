package io.giantt.logs;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.giantt.model.LogEntry;
import io.giantt.util.Jsons;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * One log entry per JSONL line: {@code {"s":..,"t":..,"m":..,"tags":[..],"meta":{..}}}.
 */
public final class LogSerializer {
    private LogSerializer() {
    }

    public static String toLine(LogEntry entry) {
        ObjectNode node = Jsons.compact().createObjectNode();
        node.put("s", entry.session());
        node.put("t", entry.timestamp().toString());
        node.put("m", entry.message());
        ArrayNode tags = node.putArray("tags");
        entry.tags().forEach(tags::add);
        ObjectNode meta = node.putObject("meta");
        entry.metadata().forEach(meta::put);
        return Jsons.toCompactJson(node);
    }

    public static LogEntry fromLine(String line, boolean occlude) {
        JsonNode node;
        try {
            node = Jsons.compact().readTree(line);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid JSON: " + e.getOriginalMessage(), e);
        }
        if (node == null || !node.isObject()) {
            throw new IllegalArgumentException("Log line is not a JSON object");
        }
        String session = requiredText(node, "s");
        String rawTimestamp = requiredText(node, "t");
        String message = requiredText(node, "m");
        Instant timestamp;
        try {
            timestamp = Instant.parse(rawTimestamp);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid timestamp: " + rawTimestamp, e);
        }

        Set<String> tags = new TreeSet<>();
        JsonNode tagsNode = node.path("tags");
        if (tagsNode.isArray()) {
            tagsNode.forEach(tag -> tags.add(tag.asText()));
        }
        Map<String, String> metadata = new LinkedHashMap<>();
        JsonNode metaNode = node.path("meta");
        if (metaNode.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = metaNode.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                metadata.put(field.getKey(), field.getValue().asText());
            }
        }
        return new LogEntry(session, timestamp, message, tags, metadata, occlude);
    }

    private static String requiredText(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual()) {
            throw new IllegalArgumentException("Missing or non-string field '" + field + "'");
        }
        return value.asText();
    }
}
