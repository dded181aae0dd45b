package io.giantt.storage;

import java.nio.file.Path;
import java.util.List;

public record IncludeNode(Path path, Status status, List<IncludeNode> children) {
    public enum Status {
        OK,
        MISSING,
        CIRCULAR
    }

    public IncludeNode {
        children = children == null ? List.of() : List.copyOf(children);
    }
}
