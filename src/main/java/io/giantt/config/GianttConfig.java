package io.giantt.config;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * Workspace paths derived from a single root directory, plus the backup retention count.
 */
public final class GianttConfig {
    public static final String WORKSPACE_DIR = ".giantt";
    public static final String INCLUDE_DIR = "include";
    public static final String OCCLUDE_DIR = "occlude";
    public static final String ITEMS_FILE = "items.txt";
    public static final String LOGS_FILE = "logs.jsonl";
    public static final String METADATA_FILE = "metadata.json";
    public static final int DEFAULT_BACKUP_RETENTION = 3;

    private final Path rootDir;
    private final int backupRetention;

    public GianttConfig(Path rootDir, int backupRetention) {
        if (backupRetention < 0) {
            throw new IllegalArgumentException("backupRetention must be >= 0");
        }
        this.rootDir = rootDir;
        this.backupRetention = backupRetention;
    }

    public static GianttConfig fromRoot(String root) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get(WORKSPACE_DIR)
                : Paths.get(root);
        return new GianttConfig(resolved.toAbsolutePath().normalize(), DEFAULT_BACKUP_RETENTION);
    }

    /**
     * Nearest {@code .giantt} directory at or above {@code start}, falling back to {@code <home>/.giantt}.
     */
    public static GianttConfig discover(Path start, Path home) {
        Path current = start.toAbsolutePath().normalize();
        while (current != null) {
            Path candidate = current.resolve(WORKSPACE_DIR);
            if (Files.isDirectory(candidate)) {
                return new GianttConfig(candidate, DEFAULT_BACKUP_RETENTION);
            }
            current = current.getParent();
        }
        return new GianttConfig(home.toAbsolutePath().normalize().resolve(WORKSPACE_DIR), DEFAULT_BACKUP_RETENTION);
    }

    public GianttConfig withBackupRetention(int value) {
        return new GianttConfig(rootDir, value);
    }

    public Path rootDir() {
        return rootDir;
    }

    public int backupRetention() {
        return backupRetention;
    }

    public Path includeDir() {
        return rootDir.resolve(INCLUDE_DIR);
    }

    public Path occludeDir() {
        return rootDir.resolve(OCCLUDE_DIR);
    }

    public Path includeItems() {
        return includeDir().resolve(ITEMS_FILE);
    }

    public Path occludeItems() {
        return occludeDir().resolve(ITEMS_FILE);
    }

    public Path includeLogs() {
        return includeDir().resolve(LOGS_FILE);
    }

    public Path occludeLogs() {
        return occludeDir().resolve(LOGS_FILE);
    }

    public Path includeMetadata() {
        return includeDir().resolve(METADATA_FILE);
    }

    public Path occludeMetadata() {
        return occludeDir().resolve(METADATA_FILE);
    }

    public List<Path> workspaceFiles() {
        return List.of(
                includeItems(),
                includeLogs(),
                includeMetadata(),
                occludeItems(),
                occludeLogs(),
                occludeMetadata()
        );
    }
}
