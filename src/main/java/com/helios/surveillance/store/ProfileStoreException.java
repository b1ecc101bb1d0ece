package com.helios.surveillance.store;

/**
 * The profile store could not be read.
 */
public class ProfileStoreException extends Exception {

    public ProfileStoreException(String message) {
        super(message);
    }

    public ProfileStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
