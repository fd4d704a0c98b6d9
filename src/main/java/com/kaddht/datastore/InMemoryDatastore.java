package com.kaddht.datastore;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ConcurrentSkipListMap;

/**
 * Datastore implementation using {@link ConcurrentSkipListMap}.
 *
 * <h2>Performance Characteristics</h2>
 * <ul>
 *   <li>get, put, delete, has: O(log n) time complexity</li>
 *   <li>Ordered key iteration</li>
 *   <li>Lock-free concurrent reads</li>
 *   <li>Thread-safe writes without external synchronization</li>
 * </ul>
 *
 * <p>Values are copied on the way in and on the way out so callers can never
 * mutate stored bytes.
 *
 * @see Datastore
 */
public class InMemoryDatastore implements Datastore {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryDatastore.class);

    private final ConcurrentSkipListMap<String, byte[]> store = new ConcurrentSkipListMap<>();

    private volatile boolean closed;

    @Override
    public byte[] get(String key) throws DatastoreException {
        checkOpen();
        byte[] value = store.get(key);
        logger.trace("GET {} -> {} bytes", key, value != null ? value.length : -1);
        if (value == null) {
            throw new KeyNotFoundException(key);
        }
        return value.clone();
    }

    @Override
    public void put(String key, byte[] value) throws DatastoreException {
        checkOpen();
        logger.trace("PUT {} ({} bytes)", key, value.length);
        store.put(key, value.clone());
    }

    @Override
    public void delete(String key) throws DatastoreException {
        checkOpen();
        logger.trace("DELETE {}", key);
        store.remove(key);
    }

    @Override
    public boolean has(String key) throws DatastoreException {
        checkOpen();
        return store.containsKey(key);
    }

    /**
     * Returns the number of stored keys.
     */
    public int size() {
        return store.size();
    }

    /**
     * Checks if the store is empty.
     */
    public boolean isEmpty() {
        return store.isEmpty();
    }

    @Override
    public void close() {
        closed = true;
        store.clear();
        logger.debug("InMemoryDatastore closed");
    }

    private void checkOpen() throws DatastoreException {
        if (closed) {
            throw new DatastoreException("Datastore is closed");
        }
    }
}
