package io.giantt;

/**
 * Root of the unchecked exceptions raised by the core.
 */
public class GianttException extends RuntimeException {
    public GianttException(String message) {
        super(message);
    }

    public GianttException(String message, Throwable cause) {
        super(message, cause);
    }
}
