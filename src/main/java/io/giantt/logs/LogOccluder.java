package io.giantt.logs;

import io.giantt.model.LogEntry;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.function.Predicate;

public final class LogOccluder {
    private LogOccluder() {
    }

    public static List<LogEntry> occludeBySession(LogCollection logs, String session, boolean dryRun) {
        return setFlag(logs, entry -> entry.session().equals(session), true, dryRun);
    }

    public static List<LogEntry> occludeByTags(LogCollection logs, Collection<String> tags, boolean dryRun) {
        return setFlag(logs, entry -> entry.hasAnyTag(tags), true, dryRun);
    }

    public static List<LogEntry> includeBySession(LogCollection logs, String session, boolean dryRun) {
        return setFlag(logs, entry -> entry.session().equals(session), false, dryRun);
    }

    public static List<LogEntry> includeByTags(LogCollection logs, Collection<String> tags, boolean dryRun) {
        return setFlag(logs, entry -> entry.hasAnyTag(tags), false, dryRun);
    }

    /**
     * Returns the entries whose flag changed (or would change, with {@code dryRun}).
     */
    private static List<LogEntry> setFlag(LogCollection logs, Predicate<LogEntry> match, boolean occlude, boolean dryRun) {
        List<LogEntry> changed = new ArrayList<>();
        for (LogEntry entry : logs.entries()) {
            if (entry.occlude() != occlude && match.test(entry)) {
                changed.add(entry);
            }
        }
        if (!dryRun) {
            changed.forEach(entry -> logs.replace(entry, entry.withOcclude(occlude)));
        }
        return changed;
    }
}
