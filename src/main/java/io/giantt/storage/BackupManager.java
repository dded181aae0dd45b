package io.giantt.storage;

import io.giantt.config.GianttConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Numbered backups named {@code <file>.<N>.backup}, N increasing with each backup.
 */
public final class BackupManager {
    public static final int DEFAULT_RETENTION = GianttConfig.DEFAULT_BACKUP_RETENTION;

    private static final Logger LOG = LoggerFactory.getLogger(BackupManager.class);

    private BackupManager() {
    }

    public static Path backupPath(Path file, int number) {
        return file.resolveSibling(file.getFileName() + "." + number + ".backup");
    }

    /**
     * Backups of {@code file}, oldest first.
     */
    public static List<Path> listBackups(Path file) {
        Path dir = file.toAbsolutePath().getParent();
        List<Path> backups = new ArrayList<>();
        if (dir == null || !Files.isDirectory(dir)) {
            return backups;
        }
        Pattern pattern = Pattern.compile(Pattern.quote(file.getFileName().toString()) + "\\.(\\d+)\\.backup");
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir)) {
            for (Path candidate : stream) {
                if (pattern.matcher(candidate.getFileName().toString()).matches()) {
                    backups.add(candidate);
                }
            }
        } catch (IOException e) {
            throw new StorageIoException("Failed to list backups for " + file, e);
        }
        backups.sort(Comparator.comparingLong(path -> backupNumber(pattern, path)));
        return backups;
    }

    public static Optional<Path> mostRecentBackup(Path file) {
        List<Path> backups = listBackups(file);
        return backups.isEmpty() ? Optional.empty() : Optional.of(backups.get(backups.size() - 1));
    }

    /**
     * Copies {@code file} to the next numbered backup unless the most recent backup already holds
     * identical bytes, then prunes to {@code keep} backups. Returns the new backup, if one was made.
     */
    public static Optional<Path> createBackup(Path file, int keep) {
        Optional<Path> created = backup(file);
        prune(file, keep);
        return created;
    }

    /**
     * Like {@link #createBackup(Path, int)} but leaves older backups alone.
     */
    public static Optional<Path> backup(Path file) {
        if (!Files.isRegularFile(file)) {
            throw new GraphException("Cannot back up missing file: " + file);
        }
        try {
            byte[] current = Files.readAllBytes(file);
            List<Path> backups = listBackups(file);
            if (!backups.isEmpty() && Arrays.equals(current, Files.readAllBytes(backups.get(backups.size() - 1)))) {
                LOG.debug("Skipping backup of {}: identical to {}", file, backups.get(backups.size() - 1));
                return Optional.empty();
            }
            int next = backups.isEmpty() ? 1 : numberOf(backups.get(backups.size() - 1)) + 1;
            Path created = backupPath(file, next);
            Files.copy(file, created, StandardCopyOption.REPLACE_EXISTING);
            LOG.debug("Backed up {} to {}", file, created);
            return Optional.of(created);
        } catch (IOException e) {
            throw new StorageIoException("Failed to create backup of " + file, e);
        }
    }

    /**
     * Deletes all but the {@code keep} most recent backups. A backup that cannot be deleted is logged and skipped.
     */
    public static List<Path> prune(Path file, int keep) {
        return prune(file, keep, false);
    }

    /**
     * Prunes the backups of every file; with {@code dryRun} only reports what would be deleted.
     */
    public static List<Path> cleanup(List<Path> files, int keep, boolean dryRun) {
        List<Path> removed = new ArrayList<>();
        for (Path file : files) {
            removed.addAll(prune(file, keep, dryRun));
        }
        return removed;
    }

    private static List<Path> prune(Path file, int keep, boolean dryRun) {
        List<Path> backups = listBackups(file);
        int excess = backups.size() - Math.max(0, keep);
        List<Path> removed = new ArrayList<>();
        for (int i = 0; i < excess; i++) {
            Path old = backups.get(i);
            if (dryRun) {
                removed.add(old);
                continue;
            }
            try {
                Files.deleteIfExists(old);
                removed.add(old);
                LOG.debug("Pruned backup {}", old);
            } catch (IOException e) {
                LOG.warn("Failed to delete old backup {}: {}", old, e.getMessage());
            }
        }
        return removed;
    }

    private static int numberOf(Path backup) {
        String name = backup.getFileName().toString();
        String withoutSuffix = name.substring(0, name.length() - ".backup".length());
        return Integer.parseInt(withoutSuffix.substring(withoutSuffix.lastIndexOf('.') + 1));
    }

    private static long backupNumber(Pattern pattern, Path path) {
        Matcher matcher = pattern.matcher(path.getFileName().toString());
        return matcher.matches() ? Long.parseLong(matcher.group(1)) : -1L;
    }
}
