package io.giantt.storage;

import io.giantt.config.WorkspaceMetadata;
import io.giantt.model.RelationType;

import java.util.ArrayList;
import java.util.List;

/**
 * Fixed-width {@code #}-bordered header written at the top of every workspace file.
 * The banner carries no timestamp, so saving unchanged content yields identical bytes.
 */
public final class BannerGenerator {
    private static final int PADDING_H = 5;
    private static final int PADDING_V = 1;

    public enum FileKind {
        ITEMS("Giantt Items",
                "This file contains all include Giantt items in topological",
                "order according to the REQUIRES (" + RelationType.REQUIRES.symbol() + ") relation.",
                "You can use #include directives at the top of this file",
                "to include other Giantt item files."),
        OCCLUDED_ITEMS("Giantt Occluded Items",
                "This file contains all occluded Giantt items in topological",
                "order according to the REQUIRES (" + RelationType.REQUIRES.symbol() + ") relation."),
        LOGS("Giantt Logs",
                "This file contains log entries in JSONL format.",
                "Each line is a JSON object representing a log entry."),
        OCCLUDED_LOGS("Giantt Occluded Logs",
                "This file contains occluded log entries in JSONL format.",
                "Each line is a JSON object representing a log entry."),
        METADATA("Giantt Metadata",
                "This file contains metadata for the Giantt workspace.");

        private final List<String> lines;

        FileKind(String... lines) {
            this.lines = List.of(lines);
        }

        public List<String> lines() {
            return lines;
        }
    }

    private BannerGenerator() {
    }

    public static String banner(FileKind kind, int entryCount) {
        List<String> lines = new ArrayList<>(kind.lines());
        lines.add("Edit this file manually at your own risk.");
        lines.add("Schema " + WorkspaceMetadata.SCHEMA + " | " + entryCount + (entryCount == 1 ? " entry" : " entries"));
        return box(lines);
    }

    static String box(List<String> lines) {
        int width = lines.stream().mapToInt(String::length).max().orElse(0);
        int inner = width + 2 * PADDING_H;
        String border = "#".repeat(inner + 2);
        String empty = "#" + " ".repeat(inner) + "#";

        StringBuilder sb = new StringBuilder();
        sb.append(border).append('\n');
        for (int i = 0; i < PADDING_V; i++) {
            sb.append(empty).append('\n');
        }
        for (String line : lines) {
            int slack = width - line.length();
            int left = slack / 2;
            sb.append('#')
                    .append(" ".repeat(PADDING_H + left))
                    .append(line)
                    .append(" ".repeat(PADDING_H + slack - left))
                    .append("#\n");
        }
        for (int i = 0; i < PADDING_V; i++) {
            sb.append(empty).append('\n');
        }
        sb.append(border).append('\n');
        return sb.toString();
    }
}
