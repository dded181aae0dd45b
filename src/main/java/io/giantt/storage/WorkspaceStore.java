package io.giantt.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.giantt.config.GianttConfig;
import io.giantt.config.WorkspaceMetadata;
import io.giantt.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Workspace layout: {@code include/} and {@code occlude/}, each holding items, logs and metadata.
 */
public final class WorkspaceStore {
    private static final Logger LOG = LoggerFactory.getLogger(WorkspaceStore.class);

    private WorkspaceStore() {
    }

    /**
     * Creates missing directories and banner-only files. Existing files are left alone.
     * Returns the files created.
     */
    public static List<Path> initialize(GianttConfig config) {
        Map<Path, String> missing = new LinkedHashMap<>();
        putIfMissing(missing, config.includeItems(), BannerGenerator.banner(BannerGenerator.FileKind.ITEMS, 0));
        putIfMissing(missing, config.includeLogs(), BannerGenerator.banner(BannerGenerator.FileKind.LOGS, 0));
        putIfMissing(missing, config.includeMetadata(), renderMetadata(WorkspaceMetadata.defaults()));
        putIfMissing(missing, config.occludeItems(), BannerGenerator.banner(BannerGenerator.FileKind.OCCLUDED_ITEMS, 0));
        putIfMissing(missing, config.occludeLogs(), BannerGenerator.banner(BannerGenerator.FileKind.OCCLUDED_LOGS, 0));
        putIfMissing(missing, config.occludeMetadata(), renderMetadata(WorkspaceMetadata.defaults()));
        try {
            Files.createDirectories(config.includeDir());
            Files.createDirectories(config.occludeDir());
        } catch (IOException e) {
            throw new StorageIoException("Failed to create workspace at " + config.rootDir(), e);
        }
        if (!missing.isEmpty()) {
            AtomicFileWriter.withoutBackups().writeFiles(missing);
        }
        LOG.debug("Initialized workspace {} ({} file(s) created)", config.rootDir(), missing.size());
        return new ArrayList<>(missing.keySet());
    }

    public static void validate(GianttConfig config) {
        List<Path> problems = config.workspaceFiles().stream()
                .filter(path -> !Files.isRegularFile(path) || !Files.isReadable(path))
                .toList();
        if (!problems.isEmpty()) {
            throw new GraphException("Invalid workspace " + config.rootDir() + ", missing or unreadable: "
                    + problems.stream().map(Path::toString).collect(Collectors.joining(", "))
                    + ". Run 'giantt init' first.");
        }
    }

    public static WorkspaceMetadata readMetadata(GianttConfig config) {
        Path file = config.includeMetadata();
        if (!Files.isRegularFile(file)) {
            return WorkspaceMetadata.defaults();
        }
        String json;
        try {
            json = Files.readAllLines(file, StandardCharsets.UTF_8).stream()
                    .filter(line -> !line.strip().startsWith("#"))
                    .collect(Collectors.joining("\n"));
        } catch (IOException e) {
            throw new StorageIoException("Failed to read " + file, e);
        }
        if (json.isBlank()) {
            return WorkspaceMetadata.defaults();
        }
        try {
            return Jsons.mapper().readValue(json, WorkspaceMetadata.class);
        } catch (JsonProcessingException e) {
            throw new GraphException("Malformed metadata in " + file + ": " + e.getOriginalMessage(), e);
        }
    }

    public static void writeMetadata(GianttConfig config, WorkspaceMetadata metadata) {
        new AtomicFileWriter(config.backupRetention()).writeFile(config.includeMetadata(), renderMetadata(metadata));
    }

    /**
     * Retention from the explicit option if given, else from metadata, else the default.
     */
    public static GianttConfig resolveRetention(GianttConfig config, Integer explicit) {
        if (explicit != null) {
            return config.withBackupRetention(explicit);
        }
        Integer stored = readMetadata(config).backupRetention();
        return config.withBackupRetention(stored == null ? GianttConfig.DEFAULT_BACKUP_RETENTION : stored);
    }

    static String renderMetadata(WorkspaceMetadata metadata) {
        return BannerGenerator.banner(BannerGenerator.FileKind.METADATA, 1) + "\n" + Jsons.toJson(metadata) + "\n";
    }

    private static void putIfMissing(Map<Path, String> into, Path path, String content) {
        if (!Files.exists(path)) {
            into.put(path, content);
        }
    }
}
