package io.giantt.graph;

import io.giantt.GianttException;

public class GraphOperationException extends GianttException {
    public GraphOperationException(String message) {
        super(message);
    }
}
