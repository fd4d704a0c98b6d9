package com.kaddht.record;

import java.util.List;

/**
 * Application-defined rules for which record values are acceptable and which
 * of several acceptable values is preferred.
 *
 * <p>The value store consults the validator twice on every write: once to accept
 * the incoming value, and once to choose between it and the value already stored.
 * The ordering defined by {@link #select(byte[], List)} is what makes a write
 * "newer", independent of the order in which writes arrive.
 *
 * <p>Implementations must be thread-safe.
 *
 * @see NamespacedValidator
 * @see PublicKeyValidator
 */
public interface Validator {

    /**
     * Checks that a value is acceptable for a key.
     *
     * @param key the record key
     * @param value the record value
     * @throws ValidationException with the rejection reason if the value is not acceptable
     */
    void validate(byte[] key, byte[] value) throws ValidationException;

    /**
     * Chooses the preferred value among several valid values for the same key.
     *
     * @param key the record key
     * @param values the candidate values, at least one
     * @return the index of the preferred value within {@code values}
     * @throws ValidationException if the values cannot be compared
     */
    int select(byte[] key, List<byte[]> values) throws ValidationException;
}
