package io.giantt.cli;

import io.giantt.GianttException;
import io.giantt.config.GianttConfig;
import io.giantt.doctor.GraphDoctor;
import io.giantt.doctor.Issue;
import io.giantt.doctor.IssueType;
import io.giantt.graph.ItemGraph;
import io.giantt.graph.ItemOccluder;
import io.giantt.graph.OccludeResult;
import io.giantt.logs.LogCollection;
import io.giantt.logs.LogRepository;
import io.giantt.logs.LogSerializer;
import io.giantt.model.Item;
import io.giantt.model.LogEntry;
import io.giantt.model.Priority;
import io.giantt.model.RelationType;
import io.giantt.model.Status;
import io.giantt.notation.DurationParser;
import io.giantt.notation.ItemNotation;
import io.giantt.storage.AtomicFileWriter;
import io.giantt.storage.BackupManager;
import io.giantt.storage.FileRepository;
import io.giantt.storage.IncludeNode;
import io.giantt.storage.PathResolver;
import io.giantt.storage.WorkspaceStore;
import io.giantt.util.Jsons;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(
        name = "giantt",
        mixinStandardHelpOptions = true,
        description = "Dependency-graph task tracker",
        subcommands = {
                GianttCommand.InitCommand.class,
                GianttCommand.AddCommand.class,
                GianttCommand.ShowCommand.class,
                GianttCommand.ListCommand.class,
                GianttCommand.SortCommand.class,
                GianttCommand.RelateCommand.class,
                GianttCommand.UnrelateCommand.class,
                GianttCommand.RemoveCommand.class,
                GianttCommand.InsertCommand.class,
                GianttCommand.SetStatusCommand.class,
                GianttCommand.ModifyCommand.class,
                GianttCommand.OccludeCommand.class,
                GianttCommand.IncludeCommand.class,
                GianttCommand.DoctorCommand.class,
                GianttCommand.IncludesCommand.class,
                GianttCommand.TouchCommand.class,
                GianttCommand.LogCommand.class,
                GianttCommand.LogsCommand.class,
                GianttCommand.CleanCommand.class
        }
)
public final class GianttCommand implements Runnable {
    @Spec
    CommandSpec spec;

    @Option(names = {"--workspace"}, description = "Workspace directory (default: nearest .giantt, else ~/.giantt)")
    String workspace;

    @Option(names = {"--keep-backups"}, description = "Numbered backups kept per file (default: metadata, else 3)")
    Integer keepBackups;

    /**
     * Command line with core exceptions mapped to exit code 1 and a message on stderr.
     */
    public static CommandLine newCommandLine() {
        CommandLine commandLine = new CommandLine(new GianttCommand());
        commandLine.setExecutionExceptionHandler((ex, cmd, parseResult) -> {
            if (ex instanceof GianttException || ex instanceof IllegalArgumentException) {
                cmd.getErr().println("Error: " + ex.getMessage());
                cmd.getErr().flush();
                return 1;
            }
            throw ex;
        });
        return commandLine;
    }

    @Override
    public void run() {
        out().println("Use subcommands: init | add | show | list | sort | relate | unrelate | remove | insert | set-status | modify | occlude | include | doctor | includes | touch | log | logs | clean");
    }

    PrintWriter out() {
        return spec.commandLine().getOut();
    }

    GianttConfig config() {
        GianttConfig base = workspace == null || workspace.isBlank()
                ? GianttConfig.discover(Paths.get("").toAbsolutePath(), Paths.get(System.getProperty("user.home")))
                : GianttConfig.fromRoot(workspace);
        return WorkspaceStore.resolveRetention(base, keepBackups);
    }

    GianttConfig validatedConfig() {
        GianttConfig config = config();
        WorkspaceStore.validate(config);
        return config;
    }

    FileRepository repository(GianttConfig config) {
        return new FileRepository(new AtomicFileWriter(config.backupRetention()));
    }

    ItemGraph loadGraph(GianttConfig config) {
        return repository(config).loadGraph(config.includeItems(), config.occludeItems());
    }

    void saveGraph(GianttConfig config, ItemGraph graph) {
        repository(config).saveGraph(config.includeItems(), config.occludeItems(), graph);
    }

    boolean confirm(String question) {
        PrintWriter out = out();
        out.print(question + " [y/N] ");
        out.flush();
        try {
            BufferedReader reader = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
            String answer = reader.readLine();
            return answer != null && answer.trim().toLowerCase(Locale.ROOT).startsWith("y");
        } catch (IOException e) {
            throw new RuntimeException("Failed to read confirmation", e);
        }
    }

    static List<String> splitList(String raw) {
        List<String> out = new ArrayList<>();
        if (raw == null || raw.isBlank()) {
            return out;
        }
        for (String part : raw.split(",")) {
            String trimmed = part.trim();
            if (!trimmed.isEmpty()) {
                out.add(trimmed);
            }
        }
        return out;
    }

    @Command(name = "init", description = "Create the workspace directory layout")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        GianttCommand parent;

        @Override
        public Integer call() {
            GianttConfig config = parent.workspace == null || parent.workspace.isBlank()
                    ? GianttConfig.fromRoot(GianttConfig.WORKSPACE_DIR)
                    : GianttConfig.fromRoot(parent.workspace);
            List<Path> created = WorkspaceStore.initialize(config);
            parent.out().println("Initialized giantt workspace at: " + config.rootDir()
                    + " (" + created.size() + " file(s) created)");
            return 0;
        }
    }

    @Command(name = "add", description = "Add a new item")
    static final class AddCommand implements Callable<Integer> {
        @ParentCommand
        GianttCommand parent;

        @Parameters(index = "0", description = "Item id")
        String id;

        @Parameters(index = "1", description = "Item title")
        String title;

        @Option(names = {"--duration"}, defaultValue = "1d", description = "Duration, e.g. 3mo or 2w3d")
        String duration;

        @Option(names = {"--priority"}, defaultValue = "neutral", description = "Priority name or glyph")
        String priority;

        @Option(names = {"--status"}, defaultValue = "not_started", description = "Status name or glyph")
        String status;

        @Option(names = {"--charts"}, description = "Comma-separated chart names")
        String charts;

        @Option(names = {"--tags"}, description = "Comma-separated tags")
        String tags;

        @Option(names = {"--requires"}, description = "Comma-separated ids this item requires")
        String requires;

        @Option(names = {"--blocks"}, description = "Comma-separated ids this item blocks")
        String blocks;

        @Option(names = {"--comment"}, description = "User comment")
        String comment;

        @Override
        public Integer call() {
            GianttConfig config = parent.validatedConfig();
            ItemGraph graph = parent.loadGraph(config);
            if (graph.contains(id)) {
                parent.spec.commandLine().getErr().println("Error: item already exists: " + id);
                return 1;
            }
            List<String> tagList = splitList(tags);
            for (String tag : tagList) {
                if (!Item.isValidTag(tag)) {
                    throw new IllegalArgumentException("Invalid tag: " + tag);
                }
            }
            Item item = Item.of(id, title, DurationParser.parse(duration))
                    .withPriority(Priority.fromString(priority))
                    .withStatus(Status.fromString(status))
                    .withCharts(splitList(charts))
                    .withTags(tagList)
                    .withUserComment(comment);
            graph.addItem(item);
            for (String target : splitList(requires)) {
                graph.addRelation(id, RelationType.REQUIRES, target);
            }
            for (String target : splitList(blocks)) {
                graph.addRelation(id, RelationType.BLOCKS, target);
            }
            parent.saveGraph(config, graph);
            parent.out().println("Added: " + ItemNotation.serialize(graph.require(id)));
            return 0;
        }
    }

    @Command(name = "show", description = "Show the item matching an id or title substring")
    static final class ShowCommand implements Callable<Integer> {
        @ParentCommand
        GianttCommand parent;

        @Parameters(index = "0", description = "Id or title substring")
        String query;

        @Option(names = {"--json"}, defaultValue = "false", description = "Print as JSON")
        boolean json;

        @Override
        public Integer call() {
            Item item = parent.loadGraph(parent.validatedConfig()).findBySubstring(query);
            parent.out().println(json ? Jsons.toJson(item) : ItemNotation.serialize(item));
            return 0;
        }
    }

    @Command(name = "list", description = "List items in dependency order")
    static final class ListCommand implements Callable<Integer> {
        @ParentCommand
        GianttCommand parent;

        @Option(names = {"--occluded"}, defaultValue = "false", description = "List occluded items instead")
        boolean occluded;

        @Option(names = {"--tag"}, description = "Only items carrying this tag")
        String tag;

        @Option(names = {"--json"}, defaultValue = "false", description = "Print as JSON")
        boolean json;

        @Override
        public Integer call() {
            List<Item> items = parent.loadGraph(parent.validatedConfig()).topologicalSort().stream()
                    .filter(item -> item.occlude() == occluded)
                    .filter(item -> tag == null || item.tags().contains(tag))
                    .toList();
            if (json) {
                parent.out().println(Jsons.toJson(items));
            } else {
                items.forEach(item -> parent.out().println(ItemNotation.serialize(item)));
            }
            return 0;
        }
    }

    @Command(name = "sort", description = "Rewrite the item files in dependency order")
    static final class SortCommand implements Callable<Integer> {
        @ParentCommand
        GianttCommand parent;

        @Override
        public Integer call() {
            GianttConfig config = parent.validatedConfig();
            ItemGraph graph = parent.loadGraph(config);
            parent.saveGraph(config, graph);
            parent.out().println("Sorted " + graph.size() + " item(s)");
            return 0;
        }
    }

    @Command(name = "relate", description = "Add a relation and its mirror")
    static final class RelateCommand implements Callable<Integer> {
        @ParentCommand
        GianttCommand parent;

        @Parameters(index = "0", description = "Source item id")
        String from;

        @Parameters(index = "1", description = "Relation name or symbol, e.g. requires or ⊢")
        String type;

        @Parameters(index = "2", description = "Target item id")
        String to;

        @Override
        public Integer call() {
            GianttConfig config = parent.validatedConfig();
            ItemGraph graph = parent.loadGraph(config);
            RelationType relation = RelationType.fromString(type);
            graph.addRelation(from, relation, to);
            parent.saveGraph(config, graph);
            parent.out().println("Related " + from + " " + relation.symbol() + " " + to);
            return 0;
        }
    }

    @Command(name = "unrelate", description = "Remove a relation and its mirror")
    static final class UnrelateCommand implements Callable<Integer> {
        @ParentCommand
        GianttCommand parent;

        @Parameters(index = "0", description = "Source item id")
        String from;

        @Parameters(index = "1", description = "Relation name or symbol")
        String type;

        @Parameters(index = "2", description = "Target item id")
        String to;

        @Override
        public Integer call() {
            GianttConfig config = parent.validatedConfig();
            ItemGraph graph = parent.loadGraph(config);
            RelationType relation = RelationType.fromString(type);
            graph.removeRelation(from, relation, to);
            parent.saveGraph(config, graph);
            parent.out().println("Unrelated " + from + " " + relation.symbol() + " " + to);
            return 0;
        }
    }

    @Command(name = "remove", description = "Remove an item")
    static final class RemoveCommand implements Callable<Integer> {
        @ParentCommand
        GianttCommand parent;

        @Parameters(index = "0", description = "Item id")
        String id;

        @Option(names = {"--keep-references"}, defaultValue = "false",
                description = "Leave relation entries naming the item in other items")
        boolean keepReferences;

        @Override
        public Integer call() {
            GianttConfig config = parent.validatedConfig();
            ItemGraph graph = parent.loadGraph(config);
            graph.require(id);
            graph.removeItem(id, !keepReferences);
            parent.saveGraph(config, graph);
            parent.out().println("Removed " + id);
            return 0;
        }
    }

    @Command(name = "insert", description = "Insert a new item between two existing ones")
    static final class InsertCommand implements Callable<Integer> {
        @ParentCommand
        GianttCommand parent;

        @Parameters(index = "0", description = "New item id")
        String id;

        @Parameters(index = "1", description = "New item title")
        String title;

        @Option(names = {"--before"}, required = true, description = "Item that will require the new item")
        String before;

        @Option(names = {"--after"}, required = true, description = "Item the new item will require")
        String after;

        @Option(names = {"--duration"}, defaultValue = "1d", description = "Duration")
        String duration;

        @Override
        public Integer call() {
            GianttConfig config = parent.validatedConfig();
            ItemGraph graph = parent.loadGraph(config);
            graph.insertBetween(Item.of(id, title, DurationParser.parse(duration)), before, after);
            parent.saveGraph(config, graph);
            parent.out().println("Inserted " + id + " between " + after + " and " + before);
            return 0;
        }
    }

    @Command(name = "set-status", description = "Set an item's status")
    static final class SetStatusCommand implements Callable<Integer> {
        @ParentCommand
        GianttCommand parent;

        @Parameters(index = "0", description = "Item id")
        String id;

        @Parameters(index = "1", description = "Status name or glyph")
        String status;

        @Override
        public Integer call() {
            GianttConfig config = parent.validatedConfig();
            ItemGraph graph = parent.loadGraph(config);
            Item updated = graph.require(id).withStatus(Status.fromString(status));
            graph.addItem(updated);
            parent.saveGraph(config, graph);
            parent.out().println(ItemNotation.serialize(updated));
            return 0;
        }
    }

    @Command(name = "modify", description = "Edit fields, tags, charts and relations of an item")
    static final class ModifyCommand implements Callable<Integer> {
        @ParentCommand
        GianttCommand parent;

        @Parameters(index = "0", description = "Item id")
        String id;

        @Option(names = {"--title"}, description = "New title")
        String title;

        @Option(names = {"--status"}, description = "Status name or glyph")
        String status;

        @Option(names = {"--priority"}, description = "Priority name or glyph")
        String priority;

        @Option(names = {"--duration"}, description = "Duration, e.g. 3mo or 2w3d")
        String duration;

        @Option(names = {"--add-charts"}, description = "Comma-separated charts to add")
        String addCharts;

        @Option(names = {"--remove-charts"}, description = "Comma-separated charts to remove")
        String removeCharts;

        @Option(names = {"--add-tags"}, description = "Comma-separated tags to add")
        String addTags;

        @Option(names = {"--remove-tags"}, description = "Comma-separated tags to remove")
        String removeTags;

        @Option(names = {"--add-requires"}, description = "Comma-separated ids this item will require")
        String addRequires;

        @Option(names = {"--remove-requires"}, description = "Comma-separated ids this item no longer requires")
        String removeRequires;

        @Option(names = {"--add-blocks"}, description = "Comma-separated ids this item will block")
        String addBlocks;

        @Option(names = {"--remove-blocks"}, description = "Comma-separated ids this item no longer blocks")
        String removeBlocks;

        @Option(names = {"--comment"}, description = "Replace the user comment; empty clears it")
        String comment;

        @Option(names = {"--dry-run"}, defaultValue = "false", description = "Print the result without saving")
        boolean dryRun;

        @Override
        public Integer call() {
            GianttConfig config = parent.validatedConfig();
            ItemGraph graph = parent.loadGraph(config);
            Item original = graph.require(id);
            Item updated = original;
            if (title != null) {
                updated = updated.withTitle(title);
            }
            if (status != null) {
                updated = updated.withStatus(Status.fromString(status));
            }
            if (priority != null) {
                updated = updated.withPriority(Priority.fromString(priority));
            }
            if (duration != null) {
                updated = updated.withDuration(DurationParser.parse(duration));
            }
            updated = updated.withCharts(edit(updated.charts(), addCharts, removeCharts));
            updated = updated.withTags(edit(updated.tags(), addTags, removeTags));
            if (comment != null) {
                updated = updated.withUserComment(comment);
            }
            graph.addItem(updated);
            for (String target : splitList(removeRequires)) {
                graph.removeRelation(id, RelationType.REQUIRES, target);
            }
            for (String target : splitList(removeBlocks)) {
                graph.removeRelation(id, RelationType.BLOCKS, target);
            }
            for (String target : splitList(addRequires)) {
                graph.addRelation(id, RelationType.REQUIRES, target);
            }
            for (String target : splitList(addBlocks)) {
                graph.addRelation(id, RelationType.BLOCKS, target);
            }

            Item result = graph.require(id);
            if (result.equals(original)) {
                parent.out().println("No changes: " + ItemNotation.serialize(result));
                return 0;
            }
            if (dryRun) {
                parent.out().println("Would update: " + ItemNotation.serialize(result));
                return 0;
            }
            parent.saveGraph(config, graph);
            parent.out().println("Updated: " + ItemNotation.serialize(result));
            return 0;
        }

        private static List<String> edit(List<String> current, String add, String remove) {
            List<String> out = new ArrayList<>(current);
            out.removeAll(splitList(remove));
            for (String value : splitList(add)) {
                if (!out.contains(value)) {
                    out.add(value);
                }
            }
            return out;
        }
    }

    @Command(name = "occlude", description = "Move items to the occluded file")
    static final class OccludeCommand implements Callable<Integer> {
        @ParentCommand
        GianttCommand parent;

        @Parameters(arity = "0..*", description = "Item ids")
        List<String> ids = new ArrayList<>();

        @Option(names = {"--tag"}, description = "Occlude every active item carrying one of these tags")
        List<String> tags = new ArrayList<>();

        @Option(names = {"--dry-run"}, defaultValue = "false", description = "Report without saving")
        boolean dryRun;

        @Override
        public Integer call() {
            GianttConfig config = parent.validatedConfig();
            ItemGraph graph = parent.loadGraph(config);
            List<OccludeResult> results = new ArrayList<>();
            if (!ids.isEmpty()) {
                results.add(ItemOccluder.occlude(graph, ids, dryRun));
            }
            if (!tags.isEmpty()) {
                results.add(ItemOccluder.occludeByTags(graph, tags, dryRun));
            }
            return report(parent, config, graph, results, "Occluded", dryRun);
        }
    }

    @Command(name = "include", description = "Move occluded items back to the active file")
    static final class IncludeCommand implements Callable<Integer> {
        @ParentCommand
        GianttCommand parent;

        @Parameters(arity = "1..*", description = "Item ids")
        List<String> ids = new ArrayList<>();

        @Option(names = {"--dry-run"}, defaultValue = "false", description = "Report without saving")
        boolean dryRun;

        @Override
        public Integer call() {
            GianttConfig config = parent.validatedConfig();
            ItemGraph graph = parent.loadGraph(config);
            List<OccludeResult> results = List.of(ItemOccluder.include(graph, ids, dryRun));
            return report(parent, config, graph, results, "Included", dryRun);
        }
    }

    static int report(GianttCommand parent, GianttConfig config, ItemGraph graph,
                      List<OccludeResult> results, String verb, boolean dryRun) {
        List<String> changed = new ArrayList<>();
        List<String> notFound = new ArrayList<>();
        for (OccludeResult result : results) {
            changed.addAll(result.changed());
            notFound.addAll(result.notFound());
        }
        if (!dryRun && !changed.isEmpty()) {
            parent.saveGraph(config, graph);
        }
        parent.out().println((dryRun ? "Would be " + verb.toLowerCase(Locale.ROOT) : verb) + ": "
                + (changed.isEmpty() ? "(none)" : String.join(", ", changed)));
        if (!notFound.isEmpty()) {
            parent.out().println("Not found: " + String.join(", ", notFound));
        }
        return notFound.isEmpty() ? 0 : 1;
    }

    @Command(name = "doctor", description = "Check the graph for dangling references and one-sided relations")
    static final class DoctorCommand implements Callable<Integer> {
        @ParentCommand
        GianttCommand parent;

        @Option(names = {"--fix"}, defaultValue = "false", description = "Remove dangling references")
        boolean fix;

        @Option(names = {"--type"}, description = "Only issues of this type: dangling_reference|incomplete_chain")
        String type;

        @Option(names = {"--item"}, description = "Only issues on this item")
        String itemId;

        @Option(names = {"--yes"}, defaultValue = "false", description = "Skip the confirmation prompt")
        boolean yes;

        @Option(names = {"--dry-run"}, defaultValue = "false", description = "Show what --fix would change")
        boolean dryRun;

        @Option(names = {"--json"}, defaultValue = "false", description = "Print issues as JSON")
        boolean json;

        @Override
        public Integer call() {
            GianttConfig config = parent.validatedConfig();
            ItemGraph graph = parent.loadGraph(config);
            GraphDoctor doctor = new GraphDoctor(graph);
            IssueType filter = type == null ? null : IssueType.fromString(type);
            List<Issue> issues = doctor.fullDiagnosis().stream()
                    .filter(issue -> filter == null || issue.type() == filter)
                    .filter(issue -> itemId == null || itemId.equals(issue.itemId()))
                    .toList();
            if (json) {
                parent.out().println(Jsons.toJson(issues));
            } else if (issues.isEmpty()) {
                parent.out().println("Graph is healthy");
            } else {
                issues.forEach(issue -> parent.out().println(issue.type() + ": " + issue.message()));
            }
            if (!fix && !dryRun) {
                return issues.isEmpty() ? 0 : 1;
            }
            List<Issue> candidates = doctor.fixIssues(filter, itemId, true);
            if (candidates.isEmpty()) {
                parent.out().println("Nothing to fix");
                return 0;
            }
            if (dryRun) {
                parent.out().println("Would fix " + candidates.size() + " issue(s)");
                return 0;
            }
            if (!yes && !parent.confirm("Fix " + candidates.size() + " issue(s)?")) {
                parent.out().println("Aborted");
                return 1;
            }
            List<Issue> fixed = doctor.fixIssues(filter, itemId, false);
            parent.saveGraph(config, graph);
            parent.out().println("Fixed " + fixed.size() + " issue(s)");
            return 0;
        }
    }

    @Command(name = "includes", description = "Show the #include tree of an item file")
    static final class IncludesCommand implements Callable<Integer> {
        @ParentCommand
        GianttCommand parent;

        @Option(names = {"--file"}, description = "Item file (default: the workspace include file)")
        String file;

        @Override
        public Integer call() {
            GianttConfig config = parent.config();
            Path root = file == null ? config.includeItems() : Paths.get(file);
            IncludeNode tree = parent.repository(config).showIncludeStructure(root);
            print(tree, root.toAbsolutePath().getParent(), "");
            return tree.status() == IncludeNode.Status.OK ? 0 : 1;
        }

        private void print(IncludeNode node, Path base, String indent) {
            String label = PathResolver.relativePath(base, node.path());
            String suffix = switch (node.status()) {
                case OK -> "";
                case MISSING -> " (missing)";
                case CIRCULAR -> " (circular include, skipped)";
            };
            parent.out().println(indent + (indent.isEmpty() ? "" : "└─ ") + label + suffix);
            for (IncludeNode child : node.children()) {
                print(child, base, indent + "  ");
            }
        }
    }

    @Command(name = "touch", description = "Check that the workspace files exist and load cleanly")
    static final class TouchCommand implements Callable<Integer> {
        @ParentCommand
        GianttCommand parent;

        @Option(names = {"--verbose"}, defaultValue = "false", description = "Print every check, not only failures")
        boolean verbose;

        private final List<String> lines = new ArrayList<>();
        private int passed;
        private int total;

        @Override
        public Integer call() {
            GianttConfig config = parent.config();
            checkFile("Items", config.includeItems());
            checkFile("Occluded items", config.occludeItems());
            checkFile("Logs", config.includeLogs());
            checkFile("Occluded logs", config.occludeLogs());

            try {
                ItemGraph graph = parent.loadGraph(config);
                record(true, "Loaded " + graph.size() + " item(s): " + graph.includedItems().size()
                        + " included, " + graph.occludedItems().size() + " occluded");
                graph.topologicalSort();
                record(true, "No dependency cycles");
                int issues = new GraphDoctor(graph).quickCheck();
                record(issues == 0, issues == 0 ? "No graph issues" : issues + " graph issue(s), run doctor for details");
            } catch (GianttException e) {
                record(false, "Items failed to load: " + e.getMessage());
            }

            try {
                LogCollection logs = new LogRepository(AtomicFileWriter.withoutBackups())
                        .loadLogs(config.includeLogs(), config.occludeLogs());
                record(true, "Loaded " + logs.size() + " log entries: " + logs.included().size()
                        + " included, " + logs.occluded().size() + " occluded");
            } catch (GianttException e) {
                record(false, "Logs failed to load: " + e.getMessage());
            }

            for (String line : lines) {
                if (verbose || line.startsWith("✗")) {
                    parent.out().println(line);
                }
            }
            parent.out().println("File consistency check completed (" + passed + "/" + total + " checks passed)");
            return passed == total ? 0 : 1;
        }

        private void checkFile(String label, Path file) {
            boolean ok = Files.isRegularFile(file) && Files.isReadable(file);
            record(ok, label + (ok ? " file: " : " file missing or unreadable: ") + file);
        }

        private void record(boolean ok, String message) {
            total++;
            if (ok) {
                passed++;
            }
            lines.add((ok ? "✓ " : "✗ ") + message);
        }
    }

    @Command(name = "log", description = "Append a log entry")
    static final class LogCommand implements Callable<Integer> {
        @ParentCommand
        GianttCommand parent;

        @Parameters(index = "0", description = "Session tag")
        String session;

        @Parameters(index = "1", description = "Message")
        String message;

        @Option(names = {"--tags"}, description = "Comma-separated extra tags")
        String tags;

        @Option(names = {"--meta"}, description = "Metadata entries key=value")
        Map<String, String> metadata = new LinkedHashMap<>();

        @Override
        public Integer call() {
            GianttConfig config = parent.validatedConfig();
            LogRepository repository = new LogRepository(new AtomicFileWriter(config.backupRetention()));
            LogCollection logs = repository.loadLogs(config.includeLogs(), config.occludeLogs());
            LogEntry entry = logs.create(session, message, splitList(tags), metadata);
            repository.saveLogs(config.includeLogs(), config.occludeLogs(), logs);
            parent.out().println(LogSerializer.toLine(entry));
            return 0;
        }
    }

    @Command(name = "logs", description = "Query log entries")
    static final class LogsCommand implements Callable<Integer> {
        @ParentCommand
        GianttCommand parent;

        @Option(names = {"--session"}, description = "Only this session")
        String session;

        @Option(names = {"--tag"}, description = "Only entries carrying any of these tags")
        List<String> tags = new ArrayList<>();

        @Option(names = {"--grep"}, description = "Case-insensitive message substring")
        String grep;

        @Option(names = {"--occluded"}, defaultValue = "false", description = "Query occluded entries instead")
        boolean occluded;

        @Option(names = {"--json"}, defaultValue = "false", description = "Print as a JSON array")
        boolean json;

        @Override
        public Integer call() {
            GianttConfig config = parent.validatedConfig();
            LogCollection logs = new LogRepository(AtomicFileWriter.withoutBackups())
                    .loadLogs(config.includeLogs(), config.occludeLogs());
            List<LogEntry> selected = (occluded ? logs.occluded() : logs.included()).stream()
                    .filter(entry -> session == null || entry.session().equals(session))
                    .filter(entry -> tags.isEmpty() || entry.hasAnyTag(tags))
                    .filter(entry -> grep == null || entry.message().toLowerCase(Locale.ROOT).contains(grep.toLowerCase(Locale.ROOT)))
                    .toList();
            if (json) {
                parent.out().println(Jsons.toJson(selected));
            } else {
                selected.forEach(entry -> parent.out().println(
                        entry.timestamp() + " [" + entry.session() + "] " + entry.message()));
            }
            return 0;
        }
    }

    @Command(name = "clean", description = "Prune old numbered backups")
    static final class CleanCommand implements Callable<Integer> {
        @ParentCommand
        GianttCommand parent;

        @Option(names = {"--keep"}, description = "Backups to keep per file (default: workspace retention)")
        Integer keep;

        @Option(names = {"--yes"}, defaultValue = "false", description = "Skip the confirmation prompt")
        boolean yes;

        @Option(names = {"--dry-run"}, defaultValue = "false", description = "List what would be deleted")
        boolean dryRun;

        @Override
        public Integer call() {
            GianttConfig config = parent.config();
            int retention = keep == null ? config.backupRetention() : keep;
            List<Path> candidates = BackupManager.cleanup(config.workspaceFiles(), retention, true);
            if (candidates.isEmpty()) {
                parent.out().println("No backups to remove");
                return 0;
            }
            candidates.forEach(path -> parent.out().println((dryRun ? "Would remove: " : "Removing: ") + path));
            if (dryRun) {
                return 0;
            }
            if (!yes && !parent.confirm("Delete " + candidates.size() + " backup(s)?")) {
                parent.out().println("Aborted");
                return 1;
            }
            List<Path> removed = BackupManager.cleanup(config.workspaceFiles(), retention, false);
            parent.out().println("Removed " + removed.size() + " backup(s)");
            return 0;
        }
    }
}
