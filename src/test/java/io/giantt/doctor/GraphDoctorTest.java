package io.giantt.doctor;

import io.giantt.graph.ItemGraph;
import io.giantt.model.CompoundDuration;
import io.giantt.model.Item;
import io.giantt.model.RelationType;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GraphDoctorTest {
    @Test
    void danglingReferenceIsReportedAndFixed() {
        ItemGraph graph = new ItemGraph();
        graph.addItem(Item.of("X", "X", CompoundDuration.ZERO).withTarget(RelationType.REQUIRES, "missing"));
        GraphDoctor doctor = new GraphDoctor(graph);

        List<Issue> issues = doctor.fullDiagnosis();

        assertEquals(1, issues.size());
        Issue issue = issues.get(0);
        assertEquals(IssueType.DANGLING_REFERENCE, issue.type());
        assertEquals("X", issue.itemId());
        assertEquals(RelationType.REQUIRES, issue.relationType());
        assertEquals("missing", issue.relatedId());

        List<Issue> fixed = doctor.fixIssues();

        assertEquals(issues, fixed);
        assertFalse(graph.require("X").relations().containsKey(RelationType.REQUIRES));
        assertEquals(0, doctor.quickCheck());
    }

    @Test
    void incompleteChainIsReportedButNeverFixed() {
        ItemGraph graph = new ItemGraph();
        graph.addItem(Item.of("b", "B", CompoundDuration.ZERO));
        graph.addItem(Item.of("a", "A", CompoundDuration.ZERO).withTarget(RelationType.REQUIRES, "b"));
        graph.addItem(Item.of("c", "C", CompoundDuration.ZERO).withTarget(RelationType.SUFFICIENT, "b"));
        GraphDoctor doctor = new GraphDoctor(graph);

        List<Issue> issues = doctor.issuesOfType(IssueType.INCOMPLETE_CHAIN);

        assertEquals(2, issues.size());
        assertEquals("a", issues.get(0).itemId());
        assertEquals(RelationType.REQUIRES, issues.get(0).relationType());
        assertEquals("c", issues.get(1).itemId());
        assertEquals(RelationType.SUFFICIENT, issues.get(1).relationType());
        assertTrue(doctor.fixIssues().isEmpty());
        assertEquals(2, doctor.quickCheck());
    }

    @Test
    void mirroredRelationsAreHealthy() {
        ItemGraph graph = new ItemGraph();
        graph.addItem(Item.of("a", "A", CompoundDuration.ZERO));
        graph.addItem(Item.of("b", "B", CompoundDuration.ZERO));
        graph.addRelation("a", RelationType.REQUIRES, "b");
        graph.addRelation("a", RelationType.ANYOF, "b");
        graph.addRelation("a", RelationType.TOGETHER, "b");

        GraphDoctor doctor = new GraphDoctor(graph);

        assertTrue(doctor.fullDiagnosis().isEmpty());
        assertEquals(0, doctor.quickCheck());
    }

    @Test
    void dryRunFixDoesNotMutate() {
        ItemGraph graph = new ItemGraph();
        graph.addItem(Item.of("x", "X", CompoundDuration.ZERO).withTarget(RelationType.BLOCKS, "gone"));
        GraphDoctor doctor = new GraphDoctor(graph);

        List<Issue> wouldFix = doctor.fixIssues(null, null, true);

        assertEquals(1, wouldFix.size());
        assertEquals(List.of("gone"), graph.require("x").targets(RelationType.BLOCKS));
    }

    @Test
    void fixFilterLimitsToItem() {
        ItemGraph graph = new ItemGraph();
        graph.addItem(Item.of("x", "X", CompoundDuration.ZERO).withTarget(RelationType.REQUIRES, "gone"));
        graph.addItem(Item.of("y", "Y", CompoundDuration.ZERO).withTarget(RelationType.INDICATES, "gone"));
        GraphDoctor doctor = new GraphDoctor(graph);

        List<Issue> fixed = doctor.fixIssues(IssueType.DANGLING_REFERENCE, "y", false);

        assertEquals(1, fixed.size());
        assertEquals("y", fixed.get(0).itemId());
        assertTrue(graph.require("y").relations().isEmpty());
        assertEquals(1, doctor.quickCheck());
        assertTrue(doctor.fixIssues(IssueType.INCOMPLETE_CHAIN, null, false).isEmpty());
    }
}
