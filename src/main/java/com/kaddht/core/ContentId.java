package com.kaddht.core;

import com.google.common.hash.Hashing;
import com.google.common.io.BaseEncoding;

import java.io.ByteArrayOutputStream;
import java.math.BigInteger;
import java.util.Arrays;

/**
 * Self-describing content identifier, as used for provider records.
 *
 * <p>Two binary forms are accepted by {@link #cast(byte[])}:
 * <ul>
 *   <li><b>Version 0</b> - a bare 34-byte sha2-256 multihash ({@code 0x12 0x20 <digest>})</li>
 *   <li><b>Version 1</b> - {@code <varint 1><varint codec><multihash>}</li>
 * </ul>
 *
 * <p>A multihash is {@code <varint hash code><varint digest length><digest>} and must
 * account for every remaining byte.
 *
 * <p>Instances are immutable; {@code equals()} and {@code hashCode()} compare the
 * binary form.
 */
public final class ContentId {

    /** Multicodec code of sha2-256. */
    public static final int SHA2_256 = 0x12;

    /** Multicodec code of raw binary content. */
    public static final int RAW = 0x55;

    /** Multicodec code of dag-pb content (implied by version 0). */
    public static final int DAG_PB = 0x70;

    private static final int SHA2_256_LENGTH = 32;
    private static final int MAX_VARINT_BYTES = 9;
    private static final String BASE58_ALPHABET = "123456789ABCDEFGHJKLMNPQRSTUVWXYZabcdefghijkmnopqrstuvwxyz";

    private final int version;
    private final long codec;
    private final byte[] multihash;
    private final byte[] bytes;

    private ContentId(int version, long codec, byte[] multihash, byte[] bytes) {
        this.version = version;
        this.codec = codec;
        this.multihash = multihash;
        this.bytes = bytes;
    }

    /**
     * Parses a content identifier from its binary form.
     *
     * @param data the candidate bytes
     * @return the parsed identifier
     * @throws InvalidRequestException if the bytes are not a valid version 0 or version 1 identifier
     */
    public static ContentId cast(byte[] data) {
        if (data == null || data.length == 0) {
            throw new InvalidRequestException("Content ID is empty");
        }

        if (data.length == 34 && data[0] == SHA2_256 && data[1] == SHA2_256_LENGTH) {
            byte[] copy = data.clone();
            return new ContentId(0, DAG_PB, copy, copy);
        }

        int[] cursor = {0};
        long version = readUvarint(data, cursor);
        if (version != 1) {
            throw new InvalidRequestException("Expected 1 as the content ID version, got " + version);
        }
        long codec = readUvarint(data, cursor);
        byte[] multihash = Arrays.copyOfRange(data, cursor[0], data.length);
        checkMultihash(multihash);

        return new ContentId(1, codec, multihash, data.clone());
    }

    /**
     * Builds a version 1 identifier for the given content, hashed with sha2-256.
     *
     * @param codec multicodec code describing the content
     * @param content the content bytes
     */
    public static ContentId forData(long codec, byte[] content) {
        byte[] digest = Hashing.sha256().hashBytes(content).asBytes();
        ByteArrayOutputStream mh = new ByteArrayOutputStream();
        writeUvarint(mh, SHA2_256);
        writeUvarint(mh, digest.length);
        mh.write(digest, 0, digest.length);
        byte[] multihash = mh.toByteArray();

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        writeUvarint(out, 1);
        writeUvarint(out, codec);
        out.write(multihash, 0, multihash.length);
        return new ContentId(1, codec, multihash, out.toByteArray());
    }

    public int getVersion() {
        return version;
    }

    public long getCodec() {
        return codec;
    }

    /** Returns a copy of the multihash part. */
    public byte[] getMultihash() {
        return multihash.clone();
    }

    /** Returns a copy of the full binary form. */
    public byte[] toBytes() {
        return bytes.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Arrays.equals(bytes, ((ContentId) o).bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    /**
     * Returns the multibase text form: base58btc for version 0, {@code b}-prefixed
     * lower-case base32 for version 1.
     */
    @Override
    public String toString() {
        if (version == 0) {
            return encodeBase58(bytes);
        }
        return "b" + BaseEncoding.base32().lowerCase().omitPadding().encode(bytes);
    }

    // ==================== Helpers ====================

    private static void checkMultihash(byte[] mh) {
        int[] cursor = {0};
        readUvarint(mh, cursor);
        long length = readUvarint(mh, cursor);
        long remaining = mh.length - cursor[0];
        if (length != remaining) {
            throw new InvalidRequestException(
                    "Multihash digest length " + length + " does not match remaining " + remaining + " bytes");
        }
    }

    static long readUvarint(byte[] data, int[] cursor) {
        long value = 0;
        int shift = 0;
        for (int i = 0; i < MAX_VARINT_BYTES; i++) {
            if (cursor[0] >= data.length) {
                throw new InvalidRequestException("Truncated varint in content ID");
            }
            int b = data[cursor[0]++] & 0xff;
            value |= (long) (b & 0x7f) << shift;
            if ((b & 0x80) == 0) {
                return value;
            }
            shift += 7;
        }
        throw new InvalidRequestException("Varint in content ID is too long");
    }

    static void writeUvarint(ByteArrayOutputStream out, long value) {
        while ((value & ~0x7fL) != 0) {
            out.write((int) ((value & 0x7f) | 0x80));
            value >>>= 7;
        }
        out.write((int) value);
    }

    private static String encodeBase58(byte[] input) {
        StringBuilder sb = new StringBuilder();
        BigInteger value = new BigInteger(1, input);
        BigInteger base = BigInteger.valueOf(58);
        while (value.signum() > 0) {
            BigInteger[] divRem = value.divideAndRemainder(base);
            sb.append(BASE58_ALPHABET.charAt(divRem[1].intValue()));
            value = divRem[0];
        }
        for (int i = 0; i < input.length && input[i] == 0; i++) {
            sb.append(BASE58_ALPHABET.charAt(0));
        }
        return sb.reverse().toString();
    }
}
