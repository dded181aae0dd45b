package io.giantt.graph;

import io.giantt.model.Item;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Flips the occlude flag on items. The flag decides which file an item is saved to.
 */
public final class ItemOccluder {
    private ItemOccluder() {
    }

    public static OccludeResult occlude(ItemGraph graph, Collection<String> ids, boolean dryRun) {
        return setFlag(graph, ids, true, dryRun);
    }

    public static OccludeResult include(ItemGraph graph, Collection<String> ids, boolean dryRun) {
        return setFlag(graph, ids, false, dryRun);
    }

    /**
     * Occludes every active item carrying at least one of {@code tags}.
     */
    public static OccludeResult occludeByTags(ItemGraph graph, Collection<String> tags, boolean dryRun) {
        List<String> ids = new ArrayList<>();
        for (Item item : graph.includedItems()) {
            if (item.tags().stream().anyMatch(tags::contains)) {
                ids.add(item.id());
            }
        }
        return setFlag(graph, ids, true, dryRun);
    }

    private static OccludeResult setFlag(ItemGraph graph, Collection<String> ids, boolean occlude, boolean dryRun) {
        List<String> changed = new ArrayList<>();
        List<String> notFound = new ArrayList<>();
        for (String id : ids) {
            Item item = graph.item(id);
            if (item == null) {
                notFound.add(id);
                continue;
            }
            if (item.occlude() == occlude) {
                continue;
            }
            changed.add(id);
            if (!dryRun) {
                graph.addItem(item.withOcclude(occlude));
            }
        }
        return new OccludeResult(changed, notFound, dryRun);
    }
}
