package io.giantt.doctor;

import io.giantt.graph.ItemGraph;
import io.giantt.model.Item;
import io.giantt.model.RelationType;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Finds dangling references and one-sided REQUIRES/BLOCKS or ANYOF/SUFFICIENT pairs.
 * Issues are returned, never thrown. Only dangling references are repaired automatically.
 */
public final class GraphDoctor {
    private static final List<RelationType> PAIRED = List.of(
            RelationType.REQUIRES,
            RelationType.BLOCKS,
            RelationType.ANYOF,
            RelationType.SUFFICIENT
    );

    private final ItemGraph graph;

    public GraphDoctor(ItemGraph graph) {
        this.graph = graph;
    }

    public List<Issue> fullDiagnosis() {
        List<Issue> issues = new ArrayList<>();
        for (Item item : graph.items()) {
            for (Map.Entry<RelationType, List<String>> entry : item.relations().entrySet()) {
                RelationType type = entry.getKey();
                for (String target : entry.getValue()) {
                    Item related = graph.item(target);
                    if (related == null) {
                        issues.add(Issue.danglingReference(item.id(), type, target));
                    } else if (PAIRED.contains(type) && !related.relatesTo(type.mirror(), item.id())) {
                        issues.add(Issue.incompleteChain(item.id(), type, target));
                    }
                }
            }
        }
        return issues;
    }

    public List<Issue> issuesOfType(IssueType type) {
        return fullDiagnosis().stream().filter(issue -> issue.type() == type).toList();
    }

    /**
     * Issue count without building {@link Issue} values.
     */
    public int quickCheck() {
        int count = 0;
        for (Item item : graph.items()) {
            for (Map.Entry<RelationType, List<String>> entry : item.relations().entrySet()) {
                for (String target : entry.getValue()) {
                    Item related = graph.item(target);
                    if (related == null
                            || PAIRED.contains(entry.getKey()) && !related.relatesTo(entry.getKey().mirror(), item.id())) {
                        count++;
                    }
                }
            }
        }
        return count;
    }

    public List<Issue> fixIssues() {
        return fixIssues(null, null, false);
    }

    /**
     * Removes dangling targets matching the optional filters and returns the issues resolved.
     * With {@code dryRun} the graph is left untouched and the would-be fixes are returned.
     */
    public List<Issue> fixIssues(IssueType type, String itemId, boolean dryRun) {
        List<Issue> fixed = new ArrayList<>();
        if (type != null && type != IssueType.DANGLING_REFERENCE) {
            return fixed;
        }
        for (Issue issue : issuesOfType(IssueType.DANGLING_REFERENCE)) {
            if (itemId != null && !itemId.equals(issue.itemId())) {
                continue;
            }
            if (!dryRun) {
                Item item = graph.require(issue.itemId());
                graph.addItem(item.withoutTarget(issue.relationType(), issue.relatedId()));
            }
            fixed.add(issue);
        }
        return fixed;
    }
}
