package com.kaddht.record;

import com.google.common.hash.Hashing;

import java.util.Arrays;
import java.util.List;

/**
 * Validator for the {@code pk} namespace, which stores public keys under their hash.
 *
 * <p>A value is accepted only if its key is {@code /pk/} followed by the sha2-256
 * multihash ({@code 0x12 0x20 <digest>}) of the value. Since any two valid values
 * for the same key are identical, {@link #select(byte[], List)} always keeps the first.
 */
public class PublicKeyValidator implements Validator {

    private static final byte[] PREFIX = {'/', 'p', 'k', '/'};

    @Override
    public void validate(byte[] key, byte[] value) throws ValidationException {
        if (key.length < PREFIX.length || !Arrays.equals(key, 0, PREFIX.length, PREFIX, 0, PREFIX.length)) {
            throw new ValidationException("Key was not prefixed with /pk/");
        }
        byte[] expected = multihash(value);
        byte[] actual = Arrays.copyOfRange(key, PREFIX.length, key.length);
        if (!Arrays.equals(expected, actual)) {
            throw new ValidationException("Public key does not match storage key");
        }
    }

    @Override
    public int select(byte[] key, List<byte[]> values) throws ValidationException {
        return 0;
    }

    /**
     * Returns the record key under which a public key is stored.
     */
    public static byte[] keyFor(byte[] publicKey) {
        byte[] mh = multihash(publicKey);
        byte[] key = Arrays.copyOf(PREFIX, PREFIX.length + mh.length);
        System.arraycopy(mh, 0, key, PREFIX.length, mh.length);
        return key;
    }

    private static byte[] multihash(byte[] data) {
        byte[] digest = Hashing.sha256().hashBytes(data).asBytes();
        byte[] mh = new byte[digest.length + 2];
        mh[0] = 0x12;
        mh[1] = (byte) digest.length;
        System.arraycopy(digest, 0, mh, 2, digest.length);
        return mh;
    }
}
