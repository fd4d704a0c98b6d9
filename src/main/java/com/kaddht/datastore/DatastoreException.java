package com.kaddht.datastore;

/**
 * Failure reported by a {@link Datastore}.
 */
public class DatastoreException extends Exception {

    public DatastoreException(String message) {
        super(message);
    }

    public DatastoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
