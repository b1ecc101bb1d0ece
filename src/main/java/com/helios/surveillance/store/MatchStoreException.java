package com.helios.surveillance.store;

/**
 * A batch of matches or a match counter update could not be persisted.
 */
public class MatchStoreException extends Exception {

    public MatchStoreException(String message) {
        super(message);
    }

    public MatchStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
