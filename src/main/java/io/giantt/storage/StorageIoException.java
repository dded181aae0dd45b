package io.giantt.storage;

import java.io.IOException;

public class StorageIoException extends GraphException {
    public StorageIoException(String message, IOException cause) {
        super(message, cause);
    }
}
