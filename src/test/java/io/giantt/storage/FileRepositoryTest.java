package io.giantt.storage;

import io.giantt.graph.ItemGraph;
import io.giantt.model.CompoundDuration;
import io.giantt.model.DurationUnit;
import io.giantt.model.Item;
import io.giantt.model.RelationType;
import io.giantt.notation.ItemParseException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

class FileRepositoryTest {

    @Test
    void circularIncludeFailsLoad() throws Exception {
        Path root = Files.createTempDirectory("giantt-repo-test-");
        try {
            Path a = write(root.resolve("a.txt"), "#include b.txt", "○ a 1d \"A\" {}");
            write(root.resolve("b.txt"), "#include a.txt", "○ b 1d \"B\" {}");
            Path occluded = write(root.resolve("occluded.txt"));
            FileRepository repository = new FileRepository(AtomicFileWriter.withoutBackups());

            GraphException error = Assertions.assertThrows(GraphException.class,
                    () -> repository.loadGraph(a, occluded));

            Assertions.assertTrue(error.getMessage().contains("Circular include"));
            Assertions.assertTrue(error.getMessage().contains("a.txt -> "));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void includesResolveRelativeToContainingFile() throws Exception {
        Path root = Files.createTempDirectory("giantt-repo-test-");
        try {
            Path main = write(root.resolve("main.txt"),
                    "# banner line",
                    "#include shared/common.txt",
                    "",
                    "○ app 2d \"App\" {} >>> ⊢[lib]");
            write(root.resolve("shared").resolve("common.txt"),
                    "#include ../base.txt",
                    "○ lib 1d \"Lib\" {}");
            write(root.resolve("base.txt"), "● base 1w \"Base\" {}");
            Path occluded = write(root.resolve("occluded.txt"), "○ old 1d \"Old\" {}");

            ItemGraph graph = new FileRepository(AtomicFileWriter.withoutBackups()).loadGraph(main, occluded);

            Assertions.assertEquals(4, graph.size());
            Assertions.assertEquals(CompoundDuration.of(1, DurationUnit.WEEK), graph.require("base").duration());
            Assertions.assertEquals(List.of("lib"), graph.require("app").targets(RelationType.REQUIRES));
            Assertions.assertTrue(graph.require("old").occlude());
            Assertions.assertFalse(graph.require("lib").occlude());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void missingIncludeNamesTheFile() throws Exception {
        Path root = Files.createTempDirectory("giantt-repo-test-");
        try {
            Path main = write(root.resolve("main.txt"), "#include nowhere.txt");
            Path occluded = write(root.resolve("occluded.txt"));
            FileRepository repository = new FileRepository(AtomicFileWriter.withoutBackups());

            GraphException error = Assertions.assertThrows(GraphException.class,
                    () -> repository.loadGraph(main, occluded));

            Assertions.assertTrue(error.getMessage().startsWith("Included file not found"));
            Assertions.assertTrue(error.getMessage().contains("nowhere.txt"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void malformedLineReportsLocation() throws Exception {
        Path root = Files.createTempDirectory("giantt-repo-test-");
        try {
            Path main = write(root.resolve("main.txt"), "○ a 1d \"A\" {}", "not an item");
            Path occluded = write(root.resolve("occluded.txt"));
            FileRepository repository = new FileRepository(AtomicFileWriter.withoutBackups());

            GraphException error = Assertions.assertThrows(GraphException.class,
                    () -> repository.loadGraph(main, occluded));

            Assertions.assertTrue(error.getMessage().contains("main.txt:2"));
            Assertions.assertInstanceOf(ItemParseException.class, error.getCause());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void includeAfterFirstItemIsIgnored() throws Exception {
        Path root = Files.createTempDirectory("giantt-repo-test-");
        try {
            Path main = write(root.resolve("main.txt"),
                    "#include first.txt",
                    "○ a 1d \"A\" {}",
                    "#include late.txt");

            Assertions.assertEquals(List.of("first.txt"), FileRepository.parseIncludeDirectives(main));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void saveThenLoadPreservesGraph() throws Exception {
        Path root = Files.createTempDirectory("giantt-repo-test-");
        try {
            Path items = root.resolve("include").resolve("items.txt");
            Path occluded = root.resolve("occlude").resolve("items.txt");
            ItemGraph graph = new ItemGraph();
            graph.addItem(Item.of("b", "Second", CompoundDuration.of(2, DurationUnit.DAY)));
            graph.addItem(Item.of("a", "First", CompoundDuration.of(1, DurationUnit.DAY)));
            graph.addItem(Item.of("z", "Hidden", CompoundDuration.ZERO).withOcclude(true));
            graph.addRelation("b", RelationType.REQUIRES, "a");
            FileRepository repository = new FileRepository(AtomicFileWriter.withoutBackups());

            repository.saveGraph(items, occluded, graph);
            ItemGraph loaded = repository.loadGraph(items, occluded);

            Assertions.assertEquals(graph.asMap(), loaded.asMap());
            List<String> itemLines = Files.readAllLines(items, StandardCharsets.UTF_8).stream()
                    .filter(line -> line.startsWith("○"))
                    .toList();
            Assertions.assertEquals(2, itemLines.size());
            Assertions.assertTrue(itemLines.get(0).startsWith("○ a "));
            Assertions.assertTrue(Files.readString(occluded, StandardCharsets.UTF_8).contains("○ z 0s \"Hidden\" {}"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void saveKeepsDirectivesAndSkipsUnchangedIncludedItems() throws Exception {
        Path root = Files.createTempDirectory("giantt-repo-test-");
        try {
            Path main = write(root.resolve("main.txt"), "#include lib.txt", "○ app 1d \"App\" {}");
            write(root.resolve("lib.txt"), "○ lib 1d \"Lib\" {}", "○ tool 1d \"Tool\" {}");
            Path occluded = write(root.resolve("occluded.txt"));
            FileRepository repository = new FileRepository(AtomicFileWriter.withoutBackups());
            ItemGraph graph = repository.loadGraph(main, occluded);
            graph.addItem(graph.require("tool").withTitle("Tool v2"));

            repository.saveGraph(main, occluded, graph);

            String saved = Files.readString(main, StandardCharsets.UTF_8);
            Assertions.assertTrue(saved.contains("#include lib.txt\n"));
            Assertions.assertTrue(saved.contains("○ app 1d \"App\" {}"));
            Assertions.assertTrue(saved.contains("○ tool 1d \"Tool v2\" {}"));
            Assertions.assertFalse(saved.contains("\"Lib\""));
            Assertions.assertEquals("Tool v2", repository.loadGraph(main, occluded).require("tool").title());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void includeStructureMarksMissingAndCircularFiles() throws Exception {
        Path root = Files.createTempDirectory("giantt-repo-test-");
        try {
            Path main = write(root.resolve("main.txt"), "#include sub.txt", "#include gone.txt");
            write(root.resolve("sub.txt"), "#include main.txt");

            IncludeNode tree = new FileRepository(AtomicFileWriter.withoutBackups()).showIncludeStructure(main);

            Assertions.assertEquals(IncludeNode.Status.OK, tree.status());
            Assertions.assertEquals(2, tree.children().size());
            IncludeNode sub = tree.children().get(0);
            Assertions.assertEquals(IncludeNode.Status.OK, sub.status());
            Assertions.assertEquals(IncludeNode.Status.CIRCULAR, sub.children().get(0).status());
            Assertions.assertEquals(IncludeNode.Status.MISSING, tree.children().get(1).status());
        } finally {
            deleteRecursively(root);
        }
    }

    private static Path write(Path file, String... lines) throws IOException {
        Files.createDirectories(file.getParent());
        Files.write(file, List.of(lines), StandardCharsets.UTF_8);
        return file;
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
