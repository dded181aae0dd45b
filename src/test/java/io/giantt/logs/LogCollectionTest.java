package io.giantt.logs;

import io.giantt.model.LogEntry;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LogCollectionTest {
    private static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");

    @Test
    void entriesStayInTimestampOrder() {
        LogCollection logs = new LogCollection();
        logs.add(entry("s1", 20, "late", Set.of()));
        logs.add(entry("s1", 0, "early", Set.of()));
        logs.add(entry("s2", 20, "late too", Set.of()));
        logs.add(entry("s2", 10, "middle", Set.of()));

        assertEquals(List.of("early", "middle", "late", "late too"),
                logs.entries().stream().map(LogEntry::message).toList());
        assertEquals(Set.of("s1", "s2"), logs.sessions());
    }

    @Test
    void queriesFilterEntries() {
        LogCollection logs = new LogCollection(List.of(
                entry("plan", 0, "Drafted the roadmap", Set.of("plan", "roadmap")),
                entry("plan", 10, "Reviewed budget", Set.of("plan", "budget")),
                entry("dev", 20, "Fixed the ROADMAP parser", Set.of("dev"))
        ));

        assertEquals(2, logs.bySession("plan").size());
        assertEquals(2, logs.byTags(List.of("roadmap", "dev"), false).size());
        assertEquals(1, logs.byTags(List.of("plan", "budget"), true).size());
        assertEquals(2, logs.bySubstring("roadmap").size());
        assertEquals(List.of("Reviewed budget"),
                logs.between(T0.plusSeconds(10), T0.plusSeconds(20)).stream().map(LogEntry::message).toList());
        assertEquals(3, logs.between(null, null).size());
    }

    @Test
    void createTagsEntryWithItsSession() {
        LogCollection logs = new LogCollection();

        LogEntry created = logs.create("standup", "Talked", List.of("team"), Map.of("mood", "good"));

        assertEquals(Set.of("standup", "team"), created.tags());
        assertEquals("good", created.metadata().get("mood"));
        assertFalse(created.occlude());
        assertEquals(1, logs.size());
    }

    @Test
    void occluderMovesEntriesBetweenViews() {
        LogCollection logs = new LogCollection(List.of(
                entry("a", 0, "one", Set.of("x")),
                entry("a", 1, "two", Set.of("y")),
                entry("b", 2, "three", Set.of("x"))
        ));

        List<LogEntry> preview = LogOccluder.occludeByTags(logs, List.of("x"), true);

        assertEquals(2, preview.size());
        assertTrue(logs.occluded().isEmpty());

        LogOccluder.occludeBySession(logs, "a", false);

        assertEquals(List.of("one", "two"), logs.occluded().stream().map(LogEntry::message).toList());
        assertEquals(List.of("three"), logs.included().stream().map(LogEntry::message).toList());

        List<LogEntry> restored = LogOccluder.includeByTags(logs, List.of("y"), false);

        assertEquals(1, restored.size());
        assertEquals(List.of("two", "three"), logs.included().stream().map(LogEntry::message).toList());
        assertTrue(LogOccluder.includeBySession(logs, "b", false).isEmpty());
    }

    private static LogEntry entry(String session, long offsetSeconds, String message, Set<String> tags) {
        return new LogEntry(session, T0.plusSeconds(offsetSeconds), message, tags, Map.of(), false);
    }
}
