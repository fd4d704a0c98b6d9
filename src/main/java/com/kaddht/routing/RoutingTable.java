package com.kaddht.routing;

import com.kaddht.core.PeerId;

import java.util.List;

/**
 * Source of "closer peer" candidates for a key.
 *
 * <p>The handlers never look inside the table; they only ask it for the peers it
 * knows that are nearest to a key.
 *
 * @see XorRoutingTable
 */
public interface RoutingTable {

    /**
     * Returns up to {@code count} known peers nearest to the target key, nearest first.
     *
     * @param target the key being looked up
     * @param exclude a peer that must not appear in the result (typically the requester), or null
     * @param count the maximum number of peers to return
     * @return the nearest peers, possibly empty, never null
     */
    List<PeerId> closerPeers(byte[] target, PeerId exclude, int count);

    /**
     * Notes that a peer was seen alive. Returns true if the peer is now in the table.
     */
    boolean update(PeerId peer);

    /**
     * Forgets a peer.
     */
    void remove(PeerId peer);
}
