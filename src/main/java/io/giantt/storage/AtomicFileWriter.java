package io.giantt.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * All-or-nothing writes. Every target is first written to a temp file next to it; originals
 * are backed up and replaced only after the whole batch is staged, and restored if a replacement
 * fails. Old backups are pruned once every replacement has landed.
 */
public final class AtomicFileWriter {
    private static final Logger LOG = LoggerFactory.getLogger(AtomicFileWriter.class);

    private final boolean createBackups;
    private final int backupRetention;

    public AtomicFileWriter(int backupRetention) {
        this(true, backupRetention);
    }

    public AtomicFileWriter(boolean createBackups, int backupRetention) {
        this.createBackups = createBackups;
        this.backupRetention = backupRetention;
    }

    public static AtomicFileWriter withoutBackups() {
        return new AtomicFileWriter(false, 0);
    }

    public void writeFile(Path target, String content) {
        writeFiles(Map.of(target, content));
    }

    public void writeFiles(Map<Path, String> contents) {
        Map<Path, Path> staged = new LinkedHashMap<>();
        Map<Path, byte[]> originals = new LinkedHashMap<>();
        List<Path> backups = new ArrayList<>();
        List<Path> replaced = new ArrayList<>();
        try {
            for (Map.Entry<Path, String> entry : contents.entrySet()) {
                Path target = entry.getKey().toAbsolutePath().normalize();
                Files.createDirectories(target.getParent());
                originals.put(target, Files.exists(target) ? Files.readAllBytes(target) : null);
                Path temp = Files.createTempFile(target.getParent(), target.getFileName() + ".", ".tmp");
                staged.put(target, temp);
                Files.writeString(temp, entry.getValue(), StandardCharsets.UTF_8);
            }
            if (createBackups) {
                for (Map.Entry<Path, byte[]> entry : originals.entrySet()) {
                    if (entry.getValue() != null) {
                        BackupManager.backup(entry.getKey()).ifPresent(backups::add);
                    }
                }
            }
            for (Map.Entry<Path, Path> entry : staged.entrySet()) {
                move(entry.getValue(), entry.getKey());
                replaced.add(entry.getKey());
            }
        } catch (IOException e) {
            rollback(staged, originals, replaced, backups);
            throw new StorageIoException("Failed to write " + contents.keySet() + ": " + e.getMessage(), e);
        } catch (GraphException e) {
            rollback(staged, originals, replaced, backups);
            throw e;
        }
        if (createBackups) {
            for (Path target : originals.keySet()) {
                BackupManager.prune(target, backupRetention);
            }
        }
    }

    private static void move(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void rollback(Map<Path, Path> staged, Map<Path, byte[]> originals, List<Path> replaced, List<Path> backups) {
        LOG.warn("Rolling back write batch of {} file(s)", staged.size());
        for (Path backup : backups) {
            try {
                Files.deleteIfExists(backup);
            } catch (IOException e) {
                LOG.warn("Failed to delete backup {}: {}", backup, e.getMessage());
            }
        }
        for (Path temp : staged.values()) {
            try {
                Files.deleteIfExists(temp);
            } catch (IOException e) {
                LOG.warn("Failed to delete temp file {}: {}", temp, e.getMessage());
            }
        }
        for (Path target : replaced) {
            byte[] original = originals.get(target);
            try {
                if (original == null) {
                    Files.deleteIfExists(target);
                } else {
                    Files.write(target, original);
                }
            } catch (IOException e) {
                LOG.warn("Failed to restore {}: {}", target, e.getMessage());
            }
        }
    }
}
