package com.kaddht.routing;

import com.kaddht.core.PeerId;
import com.kaddht.core.PeerInfo;

import java.time.Duration;
import java.util.Collection;
import java.util.List;

/**
 * Store of known network addresses per peer, each with its own expiry.
 *
 * @see InMemoryAddressBook
 */
public interface AddressBook {

    /**
     * Resolves peers to their currently known addresses.
     *
     * @param peers the peers to resolve
     * @return one entry per requested peer, in the same order; peers with no
     *         known addresses get an entry with an empty address list
     */
    List<PeerInfo> peerInfos(Collection<PeerId> peers);

    /**
     * Records addresses for a peer. An address already known with a later expiry
     * keeps that expiry.
     *
     * @param peer the peer
     * @param addresses the addresses to record
     * @param ttl how long the addresses stay valid
     */
    void addAddresses(PeerId peer, Collection<String> addresses, Duration ttl);
}
