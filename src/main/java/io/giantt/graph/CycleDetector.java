package io.giantt.graph;

import io.giantt.model.Item;
import io.giantt.model.RelationType;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Three-color DFS over the strict-edge subgraph (REQUIRES and ANYOF).
 */
public final class CycleDetector {
    private enum Color {
        GRAY,
        BLACK
    }

    private CycleDetector() {
    }

    /**
     * Strict successors of every item, restricted to targets present in {@code items}.
     */
    public static Map<String, List<String>> strictAdjacency(Map<String, Item> items) {
        Map<String, List<String>> adjacency = new TreeMap<>();
        for (Item item : items.values()) {
            adjacency.put(item.id(), strictTargets(item, items::containsKey));
        }
        return adjacency;
    }

    static List<String> strictTargets(Item item, Predicate<String> exists) {
        Set<String> out = new LinkedHashSet<>();
        for (RelationType type : RelationType.values()) {
            if (!type.isStrict()) {
                continue;
            }
            for (String target : item.targets(type)) {
                if (exists.test(target)) {
                    out.add(target);
                }
            }
        }
        return new ArrayList<>(out);
    }

    /**
     * Returns the first cycle found, first id repeated at the end, or an empty list if the graph is acyclic.
     */
    public static List<String> findCycle(Map<String, List<String>> adjacency) {
        return findCycle(new TreeSet<>(adjacency.keySet()), id -> adjacency.getOrDefault(id, List.of()));
    }

    public static List<String> findCycle(Collection<String> roots, Function<String, ? extends Collection<String>> successors) {
        Map<String, Color> colors = new HashMap<>();
        for (String root : roots) {
            if (colors.containsKey(root)) {
                continue;
            }
            List<String> cycle = visit(root, successors, colors);
            if (!cycle.isEmpty()) {
                return cycle;
            }
        }
        return List.of();
    }

    public static void check(Map<String, List<String>> adjacency) {
        List<String> cycle = findCycle(adjacency);
        if (!cycle.isEmpty()) {
            throw new CycleDetectedException(cycle);
        }
    }

    public static boolean hasPath(Map<String, List<String>> adjacency, String from, String to) {
        if (from.equals(to)) {
            return true;
        }
        Set<String> seen = new HashSet<>();
        Deque<String> pending = new ArrayDeque<>();
        pending.push(from);
        while (!pending.isEmpty()) {
            String current = pending.pop();
            if (!seen.add(current)) {
                continue;
            }
            for (String next : adjacency.getOrDefault(current, List.of())) {
                if (next.equals(to)) {
                    return true;
                }
                pending.push(next);
            }
        }
        return false;
    }

    /**
     * Whether adding the strict edge {@code from -> to} would close a cycle.
     */
    public static boolean wouldCreateCycle(Map<String, List<String>> adjacency, String from, String to) {
        return hasPath(adjacency, to, from);
    }

    /**
     * Iterative DFS from {@code root}; one successor iterator per gray node stands in for the call stack.
     */
    private static List<String> visit(
            String root,
            Function<String, ? extends Collection<String>> successors,
            Map<String, Color> colors
    ) {
        Deque<String> path = new ArrayDeque<>();
        Deque<Iterator<String>> pending = new ArrayDeque<>();
        colors.put(root, Color.GRAY);
        path.addLast(root);
        pending.push(successors.apply(root).iterator());
        while (!pending.isEmpty()) {
            Iterator<String> next = pending.peek();
            if (!next.hasNext()) {
                pending.pop();
                colors.put(path.removeLast(), Color.BLACK);
                continue;
            }
            String target = next.next();
            Color color = colors.get(target);
            if (color == Color.GRAY) {
                List<String> cycle = new ArrayList<>();
                boolean inCycle = false;
                for (String onPath : path) {
                    if (onPath.equals(target)) {
                        inCycle = true;
                    }
                    if (inCycle) {
                        cycle.add(onPath);
                    }
                }
                cycle.add(target);
                return cycle;
            }
            if (color == null) {
                colors.put(target, Color.GRAY);
                path.addLast(target);
                pending.push(successors.apply(target).iterator());
            }
        }
        return List.of();
    }
}
