package com.kaddht.routing;

import com.kaddht.core.PeerId;
import com.kaddht.core.PeerInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Address book keeping addresses in memory with a per-address expiry.
 *
 * <p>Expired addresses are dropped lazily when a peer is resolved.
 */
public class InMemoryAddressBook implements AddressBook {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryAddressBook.class);

    /** TTL for addresses that never expire, such as the node's own listen address. */
    public static final Duration PERMANENT_TTL = Duration.ofSeconds(Long.MAX_VALUE);

    private final Clock clock;

    // peer -> (address -> expiry), insertion ordered per peer
    private final Map<PeerId, Map<String, Instant>> book = new ConcurrentHashMap<>();

    public InMemoryAddressBook() {
        this(Clock.systemUTC());
    }

    public InMemoryAddressBook(Clock clock) {
        this.clock = clock;
    }

    @Override
    public List<PeerInfo> peerInfos(Collection<PeerId> peers) {
        List<PeerInfo> infos = new ArrayList<>(peers.size());
        for (PeerId peer : peers) {
            infos.add(peerInfo(peer));
        }
        return infos;
    }

    /**
     * Resolves a single peer, pruning expired addresses.
     */
    public PeerInfo peerInfo(PeerId peer) {
        Instant now = clock.instant();
        List<String> live = new ArrayList<>();
        // Per-key mutation and reads both happen inside compute, which the map serializes.
        book.computeIfPresent(peer, (id, current) -> {
            current.values().removeIf(expiry -> !expiry.isAfter(now));
            live.addAll(current.keySet());
            return current.isEmpty() ? null : current;
        });
        return new PeerInfo(peer, live);
    }

    @Override
    public void addAddresses(PeerId peer, Collection<String> addresses, Duration ttl) {
        if (addresses.isEmpty()) {
            return;
        }
        Instant expiry = expiryFor(ttl);
        book.compute(peer, (id, current) -> {
            Map<String, Instant> addrs = current != null ? current : new LinkedHashMap<>();
            for (String address : addresses) {
                addrs.merge(address, expiry, (old, neu) -> neu.isAfter(old) ? neu : old);
            }
            return addrs;
        });
        logger.trace("Added {} address(es) for {} with ttl {}", addresses.size(), peer, ttl);
    }

    private Instant expiryFor(Duration ttl) {
        if (ttl.equals(PERMANENT_TTL)) {
            return Instant.MAX;
        }
        return clock.instant().plus(ttl);
    }
}
