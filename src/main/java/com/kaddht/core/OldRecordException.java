package com.kaddht.core;

/**
 * Thrown when the validator's selection prefers the record already stored
 * under a key over the incoming one.
 */
public class OldRecordException extends RecordRejectedException {

    public OldRecordException() {
        super("old record");
    }
}
