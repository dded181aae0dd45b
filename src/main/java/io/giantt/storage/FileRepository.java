package io.giantt.storage;

import io.giantt.graph.ItemGraph;
import io.giantt.model.Item;
import io.giantt.notation.ItemNotation;
import io.giantt.notation.ItemParseException;
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
 * Loads and saves the include/occlude item files, resolving {@code #include} directives
 * recursively. Directives must precede the first item line; banner, comment and blank
 * lines may sit between them.
 */
public final class FileRepository {
    public static final String INCLUDE_DIRECTIVE = "#include ";

    private static final Logger LOG = LoggerFactory.getLogger(FileRepository.class);

    private final AtomicFileWriter writer;

    public FileRepository(AtomicFileWriter writer) {
        this.writer = writer;
    }

    public static List<String> parseIncludeDirectives(Path file) {
        return parseIncludeDirectives(readLines(file), file);
    }

    static List<String> parseIncludeDirectives(List<String> lines, Path source) {
        List<String> includes = new ArrayList<>();
        boolean inItems = false;
        for (int i = 0; i < lines.size(); i++) {
            String trimmed = lines.get(i).strip();
            if (trimmed.startsWith(INCLUDE_DIRECTIVE)) {
                if (inItems) {
                    LOG.warn("Ignoring #include after first item at {}:{}", source, i + 1);
                    continue;
                }
                String target = trimmed.substring(INCLUDE_DIRECTIVE.length()).trim();
                if (!target.isEmpty()) {
                    includes.add(target);
                }
            } else if (!ItemNotation.isCommentLine(trimmed)) {
                inItems = true;
            }
        }
        return includes;
    }

    public ItemGraph loadGraph(Path includePath, Path occludePath) {
        Map<String, Item> active = collect(includePath, false, new ArrayList<>());
        Map<String, Item> occluded = collect(occludePath, true, new ArrayList<>());
        List<Item> loaded = new ArrayList<>(active.values());
        loaded.addAll(occluded.values());
        ItemGraph graph = new ItemGraph(loaded);
        LOG.debug("Loaded {} item(s), {} occluded, from {} and {}", graph.size(), occluded.size(), includePath, occludePath);
        return graph;
    }

    /**
     * Writes both files in one atomic batch, in topological order. Each file keeps its own
     * {@code #include} directives; items whose line matches the included definition are not repeated.
     */
    public void saveGraph(Path includePath, Path occludePath, ItemGraph graph) {
        List<Item> sorted = graph.topologicalSort();
        Map<Path, String> contents = new LinkedHashMap<>();
        contents.put(includePath, render(includePath, BannerGenerator.FileKind.ITEMS,
                sorted.stream().filter(item -> !item.occlude()).toList()));
        contents.put(occludePath, render(occludePath, BannerGenerator.FileKind.OCCLUDED_ITEMS,
                sorted.stream().filter(Item::occlude).toList()));
        writer.writeFiles(contents);
    }

    public IncludeNode showIncludeStructure(Path file) {
        return structure(file.toAbsolutePath().normalize(), new ArrayList<>());
    }

    private IncludeNode structure(Path file, List<Path> chain) {
        if (chain.contains(file)) {
            return new IncludeNode(file, IncludeNode.Status.CIRCULAR, List.of());
        }
        if (!Files.isRegularFile(file)) {
            return new IncludeNode(file, IncludeNode.Status.MISSING, List.of());
        }
        chain.add(file);
        List<IncludeNode> children = new ArrayList<>();
        for (String target : parseIncludeDirectives(file)) {
            children.add(structure(PathResolver.resolve(file, target), chain));
        }
        chain.remove(chain.size() - 1);
        return new IncludeNode(file, IncludeNode.Status.OK, children);
    }

    private String render(Path file, BannerGenerator.FileKind kind, List<Item> items) {
        List<String> directives = Files.isRegularFile(file) ? parseIncludeDirectives(file) : List.of();
        Map<String, String> provided = new LinkedHashMap<>();
        if (!directives.isEmpty()) {
            Path normalized = file.toAbsolutePath().normalize();
            List<Path> chain = new ArrayList<>(List.of(normalized));
            Map<String, Item> included = new LinkedHashMap<>();
            for (String target : directives) {
                included.putAll(collect(PathResolver.resolve(normalized, target), false, chain));
            }
            included.forEach((id, item) -> provided.put(id, ItemNotation.serialize(item)));
        }
        List<String> lines = new ArrayList<>();
        for (Item item : items) {
            String line = ItemNotation.serialize(item);
            if (!line.equals(provided.get(item.id()))) {
                lines.add(line);
            }
        }

        StringBuilder sb = new StringBuilder(BannerGenerator.banner(kind, lines.size()));
        if (!directives.isEmpty()) {
            sb.append('\n');
            directives.forEach(target -> sb.append(INCLUDE_DIRECTIVE).append(target).append('\n'));
        }
        sb.append('\n');
        lines.forEach(line -> sb.append(line).append('\n'));
        return sb.toString();
    }

    private Map<String, Item> collect(Path file, boolean occlude, List<Path> chain) {
        Path normalized = file.toAbsolutePath().normalize();
        if (chain.contains(normalized)) {
            List<Path> cycle = new ArrayList<>(chain.subList(chain.indexOf(normalized), chain.size()));
            cycle.add(normalized);
            throw new GraphException("Circular include: "
                    + cycle.stream().map(Path::toString).collect(Collectors.joining(" -> ")));
        }
        if (!Files.isRegularFile(normalized)) {
            throw new GraphException(chain.isEmpty()
                    ? "Item file not found: " + normalized
                    : "Included file not found: " + normalized + " (from " + chain.get(chain.size() - 1) + ")");
        }
        List<String> lines = readLines(normalized);
        Map<String, Item> items = new LinkedHashMap<>();

        chain.add(normalized);
        for (String target : parseIncludeDirectives(lines, normalized)) {
            Path resolved = PathResolver.resolve(normalized, target);
            LOG.debug("Resolving include {} from {}", resolved, normalized);
            items.putAll(collect(resolved, occlude, chain));
        }
        chain.remove(chain.size() - 1);

        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (ItemNotation.isCommentLine(line)) {
                continue;
            }
            try {
                Item item = ItemNotation.parse(line, occlude);
                items.put(item.id(), item);
            } catch (ItemParseException e) {
                throw new GraphException("Malformed item at " + normalized + ":" + (i + 1) + ": " + e.getMessage(), e);
            }
        }
        return items;
    }

    private static List<String> readLines(Path file) {
        try {
            return Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new StorageIoException("Failed to read " + file, e);
        }
    }
}
