package com.kaddht.core;

import com.google.common.io.BaseEncoding;
import com.google.protobuf.ByteString;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Immutable identifier of a peer in the DHT.
 *
 * <p>Peer identifiers are opaque byte strings on the wire. They are used for:
 * <ul>
 *   <li>Identifying the requester of an inbound message</li>
 *   <li>Interpreting a FIND_NODE key as the peer being looked up</li>
 *   <li>Keying the address book, routing table and provider index</li>
 * </ul>
 *
 * <p>Backed by a {@link ByteString}, which gives the record value-based
 * {@code equals()} and {@code hashCode()} over the raw bytes.
 *
 * <p>Example usage:
 * <pre>{@code
 * PeerId peer = PeerId.of("node-1");
 * PeerId sameBytes = PeerId.fromBytes("node-1".getBytes(StandardCharsets.UTF_8));
 * }</pre>
 *
 * @see PeerInfo
 */
public record PeerId(ByteString bytes) {

    /**
     * Constructs a new {@code PeerId} with validation.
     *
     * @param bytes the raw identifier bytes
     * @throws NullPointerException if {@code bytes} is null
     * @throws IllegalArgumentException if {@code bytes} is empty
     */
    public PeerId {
        Objects.requireNonNull(bytes, "Peer ID cannot be null");
        if (bytes.isEmpty()) {
            throw new IllegalArgumentException("Peer ID cannot be empty");
        }
    }

    /**
     * Creates a {@code PeerId} from a textual identifier, using its UTF-8 bytes.
     *
     * @param id the identifier text
     * @return a new {@code PeerId}
     */
    public static PeerId of(String id) {
        Objects.requireNonNull(id, "Peer ID cannot be null");
        return new PeerId(ByteString.copyFromUtf8(id));
    }

    /**
     * Creates a {@code PeerId} from raw bytes.
     *
     * @param bytes the identifier bytes (copied)
     * @return a new {@code PeerId}
     */
    public static PeerId fromBytes(byte[] bytes) {
        return new PeerId(ByteString.copyFrom(bytes));
    }

    /**
     * Returns a copy of the identifier bytes.
     */
    public byte[] toByteArray() {
        return bytes.toByteArray();
    }

    /**
     * Returns the UTF-8 text of the identifier if it is printable, otherwise lower-case hex.
     */
    @Override
    public String toString() {
        if (bytes.isValidUtf8()) {
            String text = bytes.toString(StandardCharsets.UTF_8);
            if (text.chars().allMatch(c -> c >= 0x20 && c < 0x7f)) {
                return text;
            }
        }
        return BaseEncoding.base16().lowerCase().encode(bytes.toByteArray());
    }
}
