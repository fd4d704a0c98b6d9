package com.kaddht.core;

import java.util.List;
import java.util.Objects;

/**
 * A peer identifier together with the network addresses currently known for it.
 *
 * <p>Addresses are opaque to the handlers; the gRPC transport uses {@code host:port}.
 * A peer with no known addresses cannot be dialed by whoever receives it.
 *
 * @param id the peer identifier
 * @param addresses the known addresses, possibly empty
 */
public record PeerInfo(PeerId id, List<String> addresses) {

    public PeerInfo {
        Objects.requireNonNull(id, "Peer ID cannot be null");
        addresses = addresses == null ? List.of() : List.copyOf(addresses);
    }

    public static PeerInfo of(PeerId id, String... addresses) {
        return new PeerInfo(id, List.of(addresses));
    }

    public boolean hasAddresses() {
        return !addresses.isEmpty();
    }
}
