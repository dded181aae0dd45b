package io.giantt.config;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

class GianttConfigTest {

    @Test
    void pathsDeriveFromRoot() {
        GianttConfig config = GianttConfig.fromRoot("/tmp/ws/.giantt");

        Assertions.assertEquals(Path.of("/tmp/ws/.giantt/include/items.txt"), config.includeItems());
        Assertions.assertEquals(Path.of("/tmp/ws/.giantt/occlude/logs.jsonl"), config.occludeLogs());
        Assertions.assertEquals(Path.of("/tmp/ws/.giantt/include/metadata.json"), config.includeMetadata());
        Assertions.assertEquals(6, config.workspaceFiles().size());
        Assertions.assertEquals(GianttConfig.DEFAULT_BACKUP_RETENTION, config.backupRetention());
    }

    @Test
    void discoverWalksUpToNearestWorkspace() throws Exception {
        Path root = Files.createTempDirectory("giantt-config-test-");
        try {
            Path workspace = Files.createDirectories(root.resolve("project").resolve(".giantt"));
            Path nested = Files.createDirectories(root.resolve("project").resolve("src").resolve("deep"));
            Path home = Files.createDirectories(root.resolve("home"));

            Assertions.assertEquals(workspace, GianttConfig.discover(nested, home).rootDir());
            Assertions.assertEquals(home.resolve(".giantt"), GianttConfig.discover(home, home).rootDir());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void negativeRetentionIsRejected() {
        GianttConfig config = GianttConfig.fromRoot("/tmp/ws");

        Assertions.assertEquals(0, config.withBackupRetention(0).backupRetention());
        Assertions.assertThrows(IllegalArgumentException.class, () -> config.withBackupRetention(-1));
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
