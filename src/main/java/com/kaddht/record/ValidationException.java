package com.kaddht.record;

/**
 * Raised by a {@link Validator} when a record value is not acceptable for its key.
 */
public class ValidationException extends Exception {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
