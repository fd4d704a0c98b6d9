package com.kaddht.datastore;

/**
 * Key-value store backing the DHT's value records.
 *
 * <p>Keys are the textual encoding produced by {@link DatastoreKey}; values are
 * serialized records. Implementations must be thread-safe and must make a
 * completed {@link #put(String, byte[])} visible to every later {@link #get(String)}.
 *
 * <h2>Outcomes</h2>
 * <ul>
 *   <li>{@link KeyNotFoundException} - nothing stored under the key</li>
 *   <li>{@link DatastoreException} - any other failure of the underlying store</li>
 * </ul>
 *
 * @see InMemoryDatastore
 */
public interface Datastore extends AutoCloseable {

    /**
     * Retrieves the value stored under a key.
     *
     * @param key the encoded key
     * @return the stored bytes, never null
     * @throws KeyNotFoundException if nothing is stored under the key
     * @throws DatastoreException if the store fails
     */
    byte[] get(String key) throws DatastoreException;

    /**
     * Stores a value, replacing any previous one.
     *
     * @param key the encoded key
     * @param value the bytes to store
     * @throws DatastoreException if the store fails
     */
    void put(String key, byte[] value) throws DatastoreException;

    /**
     * Removes a key. Removing an absent key is not an error.
     *
     * @param key the encoded key
     * @throws DatastoreException if the store fails
     */
    void delete(String key) throws DatastoreException;

    /**
     * Checks whether a value is stored under a key.
     *
     * @param key the encoded key
     * @return {@code true} if a value is present
     * @throws DatastoreException if the store fails
     */
    boolean has(String key) throws DatastoreException;

    /**
     * Releases resources held by the store. The default does nothing.
     */
    @Override
    default void close() {
    }
}
