package com.kaddht.datastore;

/**
 * Thrown by {@link Datastore#get(String)} when no value is stored under the key.
 *
 * <p>Callers in the request path treat this as soft absence, never as a failure.
 */
public class KeyNotFoundException extends DatastoreException {

    private final String key;

    public KeyNotFoundException(String key) {
        super("Key not found: " + key);
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
