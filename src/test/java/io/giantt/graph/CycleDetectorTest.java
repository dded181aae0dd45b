package io.giantt.graph;

import io.giantt.model.CompoundDuration;
import io.giantt.model.Item;
import io.giantt.model.RelationType;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CycleDetectorTest {
    @Test
    void findCycleReturnsPathWithRepeatedStart() {
        Map<String, List<String>> adjacency = Map.of(
                "a", List.of("b"),
                "b", List.of("c"),
                "c", List.of("a"),
                "d", List.of("a")
        );

        List<String> cycle = CycleDetector.findCycle(adjacency);

        assertEquals(List.of("a", "b", "c", "a"), cycle);
    }

    @Test
    void cycleSliceStartsAtBackEdgeTarget() {
        Map<String, List<String>> adjacency = Map.of(
                "a", List.of("b"),
                "b", List.of("c"),
                "c", List.of("b")
        );

        assertEquals(List.of("b", "c", "b"), CycleDetector.findCycle(adjacency));
    }

    @Test
    void acyclicGraphYieldsEmptyPath() {
        Map<String, List<String>> adjacency = Map.of(
                "a", List.of("b", "c"),
                "b", List.of("c"),
                "c", List.of()
        );

        assertTrue(CycleDetector.findCycle(adjacency).isEmpty());
        assertDoesNotThrow(() -> CycleDetector.check(adjacency));
    }

    @Test
    void checkThrowsWithPath() {
        CycleDetectedException error = assertThrows(CycleDetectedException.class,
                () -> CycleDetector.check(Map.of("x", List.of("x"))));

        assertEquals(List.of("x", "x"), error.cyclePath());
        assertTrue(error.getMessage().contains("x -> x"));
    }

    @Test
    void strictAdjacencyIgnoresSoftAndDanglingEdges() {
        Map<String, Item> items = new LinkedHashMap<>();
        items.put("a", Item.of("a", "A", CompoundDuration.ZERO)
                .withTarget(RelationType.REQUIRES, "b")
                .withTarget(RelationType.ANYOF, "c")
                .withTarget(RelationType.SUPERCHARGES, "b")
                .withTarget(RelationType.REQUIRES, "missing"));
        items.put("b", Item.of("b", "B", CompoundDuration.ZERO).withTarget(RelationType.BLOCKS, "a"));
        items.put("c", Item.of("c", "C", CompoundDuration.ZERO));

        Map<String, List<String>> adjacency = CycleDetector.strictAdjacency(items);

        assertEquals(List.of("b", "c"), adjacency.get("a"));
        assertEquals(List.of(), adjacency.get("b"));
    }

    @Test
    void pathQueriesFollowDirection() {
        Map<String, List<String>> adjacency = Map.of(
                "a", List.of("b"),
                "b", List.of("c"),
                "c", List.of()
        );

        assertTrue(CycleDetector.hasPath(adjacency, "a", "c"));
        assertFalse(CycleDetector.hasPath(adjacency, "c", "a"));
        assertTrue(CycleDetector.wouldCreateCycle(adjacency, "c", "a"));
        assertFalse(CycleDetector.wouldCreateCycle(adjacency, "a", "c"));
    }

    @Test
    void longChainIsWalkedWithoutRecursion() {
        int length = 100_000;
        Map<String, List<String>> adjacency = new HashMap<>();
        for (int i = 0; i < length - 1; i++) {
            adjacency.put("n" + i, List.of("n" + (i + 1)));
        }
        adjacency.put("n" + (length - 1), List.of());

        assertTrue(CycleDetector.findCycle(List.of("n0"), id -> adjacency.getOrDefault(id, List.of())).isEmpty());

        adjacency.put("n" + (length - 1), List.of("n0"));
        List<String> cycle = CycleDetector.findCycle(List.of("n0"), id -> adjacency.getOrDefault(id, List.of()));
        assertEquals(length + 1, cycle.size());
        assertEquals("n0", cycle.get(0));
        assertEquals("n0", cycle.get(length));
    }
}
