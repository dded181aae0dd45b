package io.giantt.graph;

import io.giantt.GianttException;

import java.util.List;

public class CycleDetectedException extends GianttException {
    private final List<String> cyclePath;

    public CycleDetectedException(List<String> cyclePath) {
        super("Cycle detected: " + String.join(" -> ", cyclePath));
        this.cyclePath = List.copyOf(cyclePath);
    }

    /**
     * Ids along the cycle, with the first id repeated at the end.
     */
    public List<String> cyclePath() {
        return cyclePath;
    }
}
