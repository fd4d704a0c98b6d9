package com.kaddht.record;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Validator that delegates to a per-namespace validator.
 *
 * <p>Keys take the form {@code /<namespace>/<rest>}. A key without a namespace, with
 * an empty remainder, or with a namespace nobody registered is rejected.
 *
 * <p>Example usage:
 * <pre>{@code
 * NamespacedValidator validator = new NamespacedValidator()
 *         .register("pk", new PublicKeyValidator());
 * }</pre>
 */
public class NamespacedValidator implements Validator {

    private static final Logger logger = LoggerFactory.getLogger(NamespacedValidator.class);

    private final Map<String, Validator> validators = new ConcurrentHashMap<>();

    /**
     * Registers the validator for a namespace, replacing any previous one.
     *
     * @return this validator, for chaining
     */
    public NamespacedValidator register(String namespace, Validator validator) {
        validators.put(namespace, validator);
        return this;
    }

    @Override
    public void validate(byte[] key, byte[] value) throws ValidationException {
        validatorFor(key).validate(key, value);
    }

    @Override
    public int select(byte[] key, List<byte[]> values) throws ValidationException {
        if (values.isEmpty()) {
            throw new ValidationException("Cannot select from an empty set of values");
        }
        return validatorFor(key).select(key, values);
    }

    /**
     * Extracts the namespace of a key.
     *
     * @throws ValidationException if the key is not of the form {@code /<namespace>/<rest>}
     */
    static String namespaceOf(byte[] key) throws ValidationException {
        // ISO-8859-1 keeps a one-to-one byte/char mapping for arbitrary keys.
        String text = new String(key, StandardCharsets.ISO_8859_1);
        if (!text.startsWith("/")) {
            throw new ValidationException("Record key has no namespace");
        }
        int end = text.indexOf('/', 1);
        if (end <= 1 || end == text.length() - 1) {
            throw new ValidationException("Record key has an invalid namespace");
        }
        return text.substring(1, end);
    }

    private Validator validatorFor(byte[] key) throws ValidationException {
        String namespace = namespaceOf(key);
        Validator validator = validators.get(namespace);
        if (validator == null) {
            logger.debug("No validator registered for namespace '{}'", namespace);
            throw new ValidationException("Invalid record keytype: " + namespace);
        }
        return validator;
    }
}
