package com.kaddht.core;

/**
 * Thrown when the thread handling a request is interrupted because the request
 * was cancelled or ran past its deadline.
 *
 * <p>The interrupt flag is restored before this is thrown.
 */
public class RequestCancelledException extends DhtException {

    public RequestCancelledException(String message) {
        super(message);
    }

    public RequestCancelledException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Throws if the current thread has been interrupted.
     *
     * @param stage short description of where the check happens, used in the message
     */
    public static void checkNotCancelled(String stage) {
        if (Thread.currentThread().isInterrupted()) {
            throw new RequestCancelledException("Request cancelled " + stage);
        }
    }
}
