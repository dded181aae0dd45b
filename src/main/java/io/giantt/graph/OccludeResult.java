package io.giantt.graph;

import java.util.List;

public record OccludeResult(List<String> changed, List<String> notFound, boolean dryRun) {
    public OccludeResult {
        changed = List.copyOf(changed);
        notFound = List.copyOf(notFound);
    }

    public boolean anyChanged() {
        return !changed.isEmpty();
    }
}
