package io.giantt.graph;

import io.giantt.model.Item;
import io.giantt.model.RelationType;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * In-memory item graph. Every mutation validates its result before committing, so a
 * rejected call leaves the graph exactly as it was. The strict-edge subgraph
 * (REQUIRES and ANYOF) is kept acyclic; dangling targets and one-sided pairs are
 * tolerated and left to the doctor.
 */
public final class ItemGraph {
    private final Map<String, Item> items;

    public ItemGraph() {
        this.items = new LinkedHashMap<>();
    }

    public ItemGraph(Collection<Item> initial) {
        this();
        addItems(initial);
    }

    private ItemGraph(Map<String, Item> items) {
        this.items = new LinkedHashMap<>(items);
    }

    public int size() {
        return items.size();
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    public boolean contains(String id) {
        return items.containsKey(id);
    }

    public Item item(String id) {
        return items.get(id);
    }

    public Item require(String id) {
        Item item = items.get(id);
        if (item == null) {
            throw new GraphOperationException("Item not found: " + id);
        }
        return item;
    }

    /**
     * Items in insertion order.
     */
    public List<Item> items() {
        return List.copyOf(items.values());
    }

    public Map<String, Item> asMap() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(items));
    }

    public List<Item> includedItems() {
        return items.values().stream().filter(item -> !item.occlude()).toList();
    }

    public List<Item> occludedItems() {
        return items.values().stream().filter(Item::occlude).toList();
    }

    /**
     * Inserts or replaces an item. Rejected with {@link CycleDetectedException} if its strict
     * relations would close a cycle with items already present.
     */
    public void addItem(Item item) {
        Map<String, Item> candidate = Map.of(item.id(), item);
        ensureAcyclic(candidate, List.of(item.id()));
        items.put(item.id(), item);
    }

    /**
     * Inserts or replaces every item with a single cycle check over the resulting graph.
     * Later items win on id collisions. Nothing is committed if the batch closes a cycle.
     */
    public void addItems(Collection<Item> batch) {
        Map<String, Item> merged = new LinkedHashMap<>(items);
        for (Item item : batch) {
            merged.put(item.id(), item);
        }
        CycleDetector.check(CycleDetector.strictAdjacency(merged));
        items.clear();
        items.putAll(merged);
    }

    public boolean removeItem(String id) {
        return items.remove(id) != null;
    }

    /**
     * Removes the item and, with {@code cascade}, every relation entry elsewhere that names it.
     */
    public boolean removeItem(String id, boolean cascade) {
        if (!items.containsKey(id)) {
            return false;
        }
        items.remove(id);
        if (cascade) {
            for (Item other : List.copyOf(items.values())) {
                Item stripped = other;
                for (RelationType type : other.relations().keySet()) {
                    if (stripped.relatesTo(type, id)) {
                        stripped = stripped.withoutTarget(type, id);
                    }
                }
                if (stripped != other) {
                    items.put(stripped.id(), stripped);
                }
            }
        }
        return true;
    }

    public void addRelation(String fromId, RelationType type, String toId) {
        Item from = require(fromId);
        require(toId);
        Map<String, Item> candidate = new HashMap<>();
        candidate.put(fromId, from.withTarget(type, toId));
        Item to = candidate.containsKey(toId) ? candidate.get(toId) : items.get(toId);
        candidate.put(toId, to.withTarget(type.mirror(), fromId));
        if (type.isStrict() || type.mirror().isStrict()) {
            ensureAcyclic(candidate, List.of(fromId, toId));
        }
        items.putAll(candidate);
    }

    public void removeRelation(String fromId, RelationType type, String toId) {
        Item from = items.get(fromId);
        if (from != null) {
            items.put(fromId, from.withoutTarget(type, toId));
        }
        Item to = items.get(toId);
        if (to != null) {
            items.put(toId, to.withoutTarget(type.mirror(), fromId));
        }
    }

    /**
     * Case-insensitive lookup by exact id or title substring. Exactly one item must match.
     */
    public Item findBySubstring(String text) {
        String needle = text.toLowerCase(Locale.ROOT);
        List<Item> matches = items.values().stream()
                .filter(item -> item.id().toLowerCase(Locale.ROOT).equals(needle)
                        || item.title().toLowerCase(Locale.ROOT).contains(needle))
                .toList();
        if (matches.isEmpty()) {
            throw new GraphOperationException("No item matches '" + text + "'");
        }
        if (matches.size() > 1) {
            throw new GraphOperationException("Ambiguous match for '" + text + "': "
                    + matches.stream().map(Item::id).collect(Collectors.joining(", ")));
        }
        return matches.get(0);
    }

    /**
     * Places {@code newItem} so that {@code beforeId} requires it and it requires {@code afterId},
     * replacing the direct link between the two anchors.
     */
    public void insertBetween(Item newItem, String beforeId, String afterId) {
        Item before = require(beforeId);
        Item after = require(afterId);
        if (items.containsKey(newItem.id())) {
            throw new GraphOperationException("Item already exists: " + newItem.id());
        }
        Map<RelationType, List<String>> relations = newItem.mutableRelations();
        relations.put(RelationType.REQUIRES, List.of(afterId));
        relations.put(RelationType.BLOCKS, List.of(beforeId));
        Item inserted = newItem.withRelations(relations);

        Item newBefore = replaceTarget(before, RelationType.REQUIRES, afterId, inserted.id());
        // one anchor on both sides: both rewrites land on the same item
        Item newAfter = replaceTarget(beforeId.equals(afterId) ? newBefore : after,
                RelationType.BLOCKS, beforeId, inserted.id());

        Map<String, Item> candidate = new HashMap<>();
        candidate.put(inserted.id(), inserted);
        candidate.put(beforeId, newBefore);
        candidate.put(afterId, newAfter);
        ensureAcyclic(candidate, List.of(inserted.id(), beforeId, afterId));
        items.putAll(candidate);
    }

    /**
     * Dependencies first. Ties are broken by REQUIRES-chain depth, then id.
     */
    public List<Item> topologicalSort() {
        Map<String, List<String>> adjacency = CycleDetector.strictAdjacency(items);
        Map<String, Integer> inDegree = new HashMap<>();
        Map<String, List<String>> dependents = new HashMap<>();
        for (Map.Entry<String, List<String>> entry : adjacency.entrySet()) {
            inDegree.put(entry.getKey(), entry.getValue().size());
            for (String target : entry.getValue()) {
                dependents.computeIfAbsent(target, key -> new ArrayList<>()).add(entry.getKey());
            }
        }

        Map<String, Integer> depthMemo = new HashMap<>();
        Comparator<String> order = Comparator
                .comparingInt((String id) -> depth(id, depthMemo))
                .thenComparing(Comparator.naturalOrder());
        PriorityQueue<String> ready = new PriorityQueue<>(order);
        inDegree.forEach((id, degree) -> {
            if (degree == 0) {
                ready.add(id);
            }
        });

        List<Item> sorted = new ArrayList<>(items.size());
        while (!ready.isEmpty()) {
            String id = ready.poll();
            sorted.add(items.get(id));
            for (String dependent : dependents.getOrDefault(id, List.of())) {
                int remaining = inDegree.merge(dependent, -1, Integer::sum);
                if (remaining == 0) {
                    ready.add(dependent);
                }
            }
        }

        if (sorted.size() < items.size()) {
            Set<String> leftover = new TreeSet<>(items.keySet());
            sorted.forEach(item -> leftover.remove(item.id()));
            List<String> cycle = CycleDetector.findCycle(leftover, id -> adjacency.getOrDefault(id, List.of()).stream()
                    .filter(leftover::contains)
                    .toList());
            throw new CycleDetectedException(cycle.isEmpty() ? List.copyOf(leftover) : cycle);
        }
        return sorted;
    }

    public ItemGraph copy() {
        return new ItemGraph(items);
    }

    /**
     * New graph holding both operands' items; {@code other} wins on id collisions.
     * Rejected if the union closes a strict cycle.
     */
    public ItemGraph plus(ItemGraph other) {
        ItemGraph merged = new ItemGraph(items);
        merged.items.putAll(other.items);
        CycleDetector.check(CycleDetector.strictAdjacency(merged.items));
        return merged;
    }

    /**
     * Longest REQUIRES chain below {@code id}, memoized. Iterative post-order so long chains
     * cannot exhaust the call stack; an edge back onto the current path counts as a leaf.
     */
    private int depth(String id, Map<String, Integer> memo) {
        Integer known = memo.get(id);
        if (known != null) {
            return known;
        }
        Set<String> onPath = new HashSet<>();
        Deque<String> stack = new ArrayDeque<>();
        stack.push(id);
        while (!stack.isEmpty()) {
            String current = stack.peek();
            if (memo.containsKey(current)) {
                stack.pop();
                continue;
            }
            if (onPath.add(current)) {
                for (String target : requiredTargets(current)) {
                    if (!memo.containsKey(target) && !onPath.contains(target)) {
                        stack.push(target);
                    }
                }
                continue;
            }
            int deepest = 0;
            for (String target : requiredTargets(current)) {
                deepest = Math.max(deepest, memo.getOrDefault(target, 0) + 1);
            }
            memo.put(current, deepest);
            onPath.remove(current);
            stack.pop();
        }
        return memo.get(id);
    }

    private List<String> requiredTargets(String id) {
        return items.get(id).targets(RelationType.REQUIRES).stream()
                .filter(items::containsKey)
                .toList();
    }

    private void ensureAcyclic(Map<String, Item> candidate, List<String> roots) {
        List<String> cycle = CycleDetector.findCycle(roots, id -> {
            Item item = candidate.containsKey(id) ? candidate.get(id) : items.get(id);
            if (item == null) {
                return List.<String>of();
            }
            return CycleDetector.strictTargets(item, target -> candidate.containsKey(target) || items.containsKey(target));
        });
        if (!cycle.isEmpty()) {
            throw new CycleDetectedException(cycle);
        }
    }

    private static Item replaceTarget(Item item, RelationType type, String oldTarget, String newTarget) {
        Map<RelationType, List<String>> relations = item.mutableRelations();
        List<String> targets = new ArrayList<>(relations.getOrDefault(type, List.of()));
        int index = targets.indexOf(oldTarget);
        if (index >= 0) {
            targets.set(index, newTarget);
        } else {
            targets.add(newTarget);
        }
        relations.put(type, targets);
        return item.withRelations(relations);
    }
}
