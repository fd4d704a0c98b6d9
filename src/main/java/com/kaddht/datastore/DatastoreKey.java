package com.kaddht.datastore;

import com.google.common.io.BaseEncoding;

/**
 * Reversible mapping between DHT keys (arbitrary bytes) and datastore keys.
 *
 * <p>A DHT key becomes {@code "/" + base32(key)} using the RFC 4648 alphabet
 * without padding, so keys containing unprintable bytes are safe to use as
 * datastore keys.
 */
public final class DatastoreKey {

    private static final BaseEncoding ENCODING = BaseEncoding.base32().omitPadding();

    private DatastoreKey() {
    }

    /**
     * Encodes a DHT key as a datastore key.
     *
     * @param dhtKey the raw key bytes, possibly empty
     * @return the encoded key
     */
    public static String encode(byte[] dhtKey) {
        return "/" + ENCODING.encode(dhtKey);
    }

    /**
     * Decodes a datastore key back into the DHT key bytes.
     *
     * @param datastoreKey a key produced by {@link #encode(byte[])}
     * @return the raw key bytes
     * @throws IllegalArgumentException if the key is not a valid encoding
     */
    public static byte[] decode(String datastoreKey) {
        if (!datastoreKey.startsWith("/")) {
            throw new IllegalArgumentException("Datastore key must start with '/': " + datastoreKey);
        }
        return ENCODING.decode(datastoreKey.substring(1));
    }
}
