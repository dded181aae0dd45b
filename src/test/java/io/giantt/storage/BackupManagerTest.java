package io.giantt.storage;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

class BackupManagerTest {

    @Test
    void repeatedWritesKeepOnlyNewestBackups() throws Exception {
        Path root = Files.createTempDirectory("giantt-backup-test-");
        try {
            Path file = root.resolve("items.txt");
            Files.writeString(file, "v0", StandardCharsets.UTF_8);
            AtomicFileWriter writer = new AtomicFileWriter(3);

            for (int i = 1; i <= 5; i++) {
                writer.writeFile(file, "v" + i);
            }

            List<Path> backups = BackupManager.listBackups(file);
            Assertions.assertEquals(List.of(
                    BackupManager.backupPath(file, 3),
                    BackupManager.backupPath(file, 4),
                    BackupManager.backupPath(file, 5)
            ), backups);
            Assertions.assertEquals("v2", Files.readString(backups.get(0), StandardCharsets.UTF_8));
            Assertions.assertEquals("v3", Files.readString(backups.get(1), StandardCharsets.UTF_8));
            Assertions.assertEquals("v4", Files.readString(backups.get(2), StandardCharsets.UTF_8));
            Assertions.assertEquals("v5", Files.readString(file, StandardCharsets.UTF_8));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void identicalContentIsNotBackedUpTwice() throws Exception {
        Path root = Files.createTempDirectory("giantt-backup-test-");
        try {
            Path file = root.resolve("items.txt");
            Files.writeString(file, "same", StandardCharsets.UTF_8);

            Optional<Path> first = BackupManager.createBackup(file, 3);
            Optional<Path> second = BackupManager.createBackup(file, 3);

            Assertions.assertEquals(Optional.of(BackupManager.backupPath(file, 1)), first);
            Assertions.assertTrue(second.isEmpty());
            Assertions.assertEquals(1, BackupManager.listBackups(file).size());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void backupsSortNumericallyNotLexically() throws Exception {
        Path root = Files.createTempDirectory("giantt-backup-test-");
        try {
            Path file = root.resolve("logs.jsonl");
            Files.writeString(file, "current", StandardCharsets.UTF_8);
            Files.writeString(BackupManager.backupPath(file, 10), "ten", StandardCharsets.UTF_8);
            Files.writeString(BackupManager.backupPath(file, 2), "two", StandardCharsets.UTF_8);
            Files.writeString(root.resolve("logs.jsonl.x.backup"), "noise", StandardCharsets.UTF_8);

            Assertions.assertEquals(List.of(
                    BackupManager.backupPath(file, 2),
                    BackupManager.backupPath(file, 10)
            ), BackupManager.listBackups(file));
            Assertions.assertEquals(Optional.of(BackupManager.backupPath(file, 10)), BackupManager.mostRecentBackup(file));

            Assertions.assertEquals(Optional.of(BackupManager.backupPath(file, 11)), BackupManager.createBackup(file, 5));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void cleanupDryRunReportsWithoutDeleting() throws Exception {
        Path root = Files.createTempDirectory("giantt-backup-test-");
        try {
            Path file = root.resolve("items.txt");
            for (int i = 1; i <= 4; i++) {
                Files.writeString(BackupManager.backupPath(file, i), "b" + i, StandardCharsets.UTF_8);
            }

            List<Path> wouldRemove = BackupManager.cleanup(List.of(file), 1, true);

            Assertions.assertEquals(3, wouldRemove.size());
            Assertions.assertEquals(4, BackupManager.listBackups(file).size());

            List<Path> removed = BackupManager.cleanup(List.of(file), 1, false);

            Assertions.assertEquals(wouldRemove, removed);
            Assertions.assertEquals(List.of(BackupManager.backupPath(file, 4)), BackupManager.listBackups(file));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void missingFileCannotBeBackedUp() throws Exception {
        Path root = Files.createTempDirectory("giantt-backup-test-");
        try {
            Assertions.assertThrows(GraphException.class,
                    () -> BackupManager.createBackup(root.resolve("absent.txt"), 3));
        } finally {
            deleteRecursively(root);
        }
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
