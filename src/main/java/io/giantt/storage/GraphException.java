package io.giantt.storage;

import io.giantt.GianttException;

/**
 * Storage-level failure: circular or missing include, malformed file, invalid workspace, failed batch.
 */
public class GraphException extends GianttException {
    public GraphException(String message) {
        super(message);
    }

    public GraphException(String message, Throwable cause) {
        super(message, cause);
    }
}
