package com.kaddht.core;

/**
 * Base class for failures raised while handling an inbound DHT message.
 *
 * <p>A handler either returns a response or throws one of the subclasses; it
 * never does both. Failures are local to a single request and are never retried
 * by the node itself.
 *
 * <ul>
 *   <li>{@link InvalidRequestException} - the request is malformed</li>
 *   <li>{@link RecordRejectedException} - a record was refused by the validator</li>
 *   <li>{@link DhtStorageException} - a collaborator failed</li>
 *   <li>{@link RequestCancelledException} - the request was cancelled or timed out</li>
 *   <li>{@link UnsupportedMessageTypeException} - no handler exists for the message type</li>
 * </ul>
 */
public class DhtException extends RuntimeException {

    public DhtException(String message) {
        super(message);
    }

    public DhtException(String message, Throwable cause) {
        super(message, cause);
    }
}
