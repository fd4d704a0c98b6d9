package com.kaddht.core;

/**
 * Thrown when the datastore fails with anything other than "not found",
 * or when stored bytes cannot be decoded on the read path.
 */
public class DhtStorageException extends DhtException {

    public DhtStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
