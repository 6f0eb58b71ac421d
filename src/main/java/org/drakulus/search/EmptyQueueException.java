package org.drakulus.search;

/**
 * Thrown when reading from an empty {@link FrontierQueue}.
 */
public class EmptyQueueException extends IllegalStateException {
    public EmptyQueueException(String message) {
        super(message);
    }
}
