package com.kaddht.core;

/**
 * Thrown when a PUT_VALUE record is refused by the validator.
 *
 * <p>Nothing is written to the datastore when this is raised.
 */
public class RecordRejectedException extends DhtException {

    public RecordRejectedException(String message) {
        super(message);
    }

    public RecordRejectedException(String message, Throwable cause) {
        super(message, cause);
    }
}
