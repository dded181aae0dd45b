package io.giantt.model;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

public record LogEntry(
        String session,
        Instant timestamp,
        String message,
        Set<String> tags,
        Map<String, String> metadata,
        boolean occlude
) {
    public LogEntry {
        Objects.requireNonNull(session, "session");
        Objects.requireNonNull(timestamp, "timestamp");
        message = message == null ? "" : message;
        tags = tags == null ? Set.of() : Collections.unmodifiableSet(new TreeSet<>(tags));
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static LogEntry create(String session, String message, Collection<String> extraTags, Map<String, String> metadata) {
        Set<String> tags = new TreeSet<>();
        tags.add(session);
        if (extraTags != null) {
            tags.addAll(extraTags);
        }
        return new LogEntry(session, Instant.now().truncatedTo(ChronoUnit.MILLIS), message, tags, metadata, false);
    }

    public boolean hasTag(String tag) {
        return tags.contains(tag);
    }

    public boolean hasAnyTag(Collection<String> candidates) {
        for (String candidate : candidates) {
            if (tags.contains(candidate)) {
                return true;
            }
        }
        return false;
    }

    public boolean hasAllTags(Collection<String> candidates) {
        return tags.containsAll(candidates);
    }

    public LogEntry withOcclude(boolean value) {
        return new LogEntry(session, timestamp, message, tags, metadata, value);
    }

    public LogEntry withTags(Set<String> value) {
        return new LogEntry(session, timestamp, message, value, metadata, occlude);
    }
}
