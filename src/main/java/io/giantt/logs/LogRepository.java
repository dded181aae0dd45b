package io.giantt.logs;

import io.giantt.model.LogEntry;
import io.giantt.storage.AtomicFileWriter;
import io.giantt.storage.BannerGenerator;
import io.giantt.storage.GraphException;
import io.giantt.storage.StorageIoException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class LogRepository {
    private static final Logger LOG = LoggerFactory.getLogger(LogRepository.class);

    private final AtomicFileWriter writer;

    public LogRepository(AtomicFileWriter writer) {
        this.writer = writer;
    }

    /**
     * Loads both log files. A missing file contributes no entries; a malformed line aborts the load.
     */
    public LogCollection loadLogs(Path includePath, Path occludePath) {
        LogCollection logs = new LogCollection();
        read(includePath, false, logs);
        read(occludePath, true, logs);
        LOG.debug("Loaded {} log entries from {} and {}", logs.size(), includePath, occludePath);
        return logs;
    }

    public void saveLogs(Path includePath, Path occludePath, LogCollection logs) {
        Map<Path, String> contents = new LinkedHashMap<>();
        contents.put(includePath, render(BannerGenerator.FileKind.LOGS, logs.included()));
        contents.put(occludePath, render(BannerGenerator.FileKind.OCCLUDED_LOGS, logs.occluded()));
        writer.writeFiles(contents);
    }

    private static String render(BannerGenerator.FileKind kind, List<LogEntry> entries) {
        StringBuilder sb = new StringBuilder(BannerGenerator.banner(kind, entries.size()));
        sb.append('\n');
        entries.forEach(entry -> sb.append(LogSerializer.toLine(entry)).append('\n'));
        return sb.toString();
    }

    private static void read(Path file, boolean occlude, LogCollection into) {
        if (!Files.isRegularFile(file)) {
            LOG.debug("No log file at {}", file);
            return;
        }
        List<String> lines;
        try {
            lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new StorageIoException("Failed to read " + file, e);
        }
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i).strip();
            if (line.isEmpty() || line.startsWith("#")) {
                continue;
            }
            try {
                into.add(LogSerializer.fromLine(line, occlude));
            } catch (IllegalArgumentException e) {
                throw new GraphException("Malformed log entry at " + file + ":" + (i + 1) + ": " + e.getMessage(), e);
            }
        }
    }
}
