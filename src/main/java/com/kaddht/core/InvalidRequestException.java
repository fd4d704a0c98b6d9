package com.kaddht.core;

/**
 * Thrown when an inbound request is malformed, for example an empty key,
 * a missing record, a record whose key differs from the message key, or a key
 * that does not parse as a content identifier.
 *
 * <p>The request is dropped; no response is sent.
 */
public class InvalidRequestException extends DhtException {

    public InvalidRequestException(String message) {
        super(message);
    }

    public InvalidRequestException(String message, Throwable cause) {
        super(message, cause);
    }
}
