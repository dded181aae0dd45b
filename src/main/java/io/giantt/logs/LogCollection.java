package io.giantt.logs;

import io.giantt.model.LogEntry;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Log entries kept in timestamp order; entries with equal timestamps keep insertion order.
 */
public final class LogCollection {
    private final List<LogEntry> entries = new ArrayList<>();

    public LogCollection() {
    }

    public LogCollection(Collection<LogEntry> initial) {
        initial.forEach(this::add);
    }

    public void add(LogEntry entry) {
        int index = entries.size();
        while (index > 0 && entries.get(index - 1).timestamp().isAfter(entry.timestamp())) {
            index--;
        }
        entries.add(index, entry);
    }

    public LogEntry create(String session, String message, Collection<String> tags, Map<String, String> metadata) {
        LogEntry entry = LogEntry.create(session, message, tags, metadata);
        add(entry);
        return entry;
    }

    /**
     * Replaces the first entry equal to {@code existing}. Returns false if there is none.
     */
    public boolean replace(LogEntry existing, LogEntry replacement) {
        int index = entries.indexOf(existing);
        if (index < 0) {
            return false;
        }
        entries.remove(index);
        add(replacement);
        return true;
    }

    public List<LogEntry> entries() {
        return List.copyOf(entries);
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public Set<String> sessions() {
        Set<String> sessions = new LinkedHashSet<>();
        entries.forEach(entry -> sessions.add(entry.session()));
        return sessions;
    }

    public List<LogEntry> bySession(String session) {
        return filter(entry -> entry.session().equals(session));
    }

    public List<LogEntry> byTags(Collection<String> tags, boolean requireAll) {
        return filter(entry -> requireAll ? entry.hasAllTags(tags) : entry.hasAnyTag(tags));
    }

    public List<LogEntry> bySubstring(String text) {
        String needle = text.toLowerCase(Locale.ROOT);
        return filter(entry -> entry.message().toLowerCase(Locale.ROOT).contains(needle));
    }

    /**
     * Entries with {@code start <= timestamp < end}; a null bound is open.
     */
    public List<LogEntry> between(Instant start, Instant end) {
        return filter(entry -> (start == null || !entry.timestamp().isBefore(start))
                && (end == null || entry.timestamp().isBefore(end)));
    }

    public List<LogEntry> included() {
        return filter(entry -> !entry.occlude());
    }

    public List<LogEntry> occluded() {
        return filter(LogEntry::occlude);
    }

    private List<LogEntry> filter(Predicate<LogEntry> predicate) {
        return entries.stream().filter(predicate).toList();
    }
}
