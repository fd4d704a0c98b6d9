package com.kaddht.handler;

import com.kaddht.core.PeerId;
import com.kaddht.routing.RoutingTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Picks the peers to suggest to a requester as being closer to a key.
 *
 * <p>The requester is never suggested to itself. If the routing table ever hands
 * back the local node, the selection is abandoned and nothing is suggested.
 */
public class CloserPeers {

    private static final Logger logger = LoggerFactory.getLogger(CloserPeers.class);

    private final PeerId self;
    private final RoutingTable routingTable;
    private final int count;

    public CloserPeers(PeerId self, RoutingTable routingTable, int count) {
        this.self = self;
        this.routingTable = routingTable;
        this.count = count;
    }

    /**
     * @param key the key being looked up
     * @param requester the peer asking
     * @return up to {@code count} peers, nearest first, possibly empty
     */
    public List<PeerId> select(byte[] key, PeerId requester) {
        List<PeerId> closer = routingTable.closerPeers(key, requester, count);
        if (closer.isEmpty()) {
            return List.of();
        }

        if (closer.contains(self)) {
            logger.error("Routing table returned self as a closer peer; suggesting nothing");
            return List.of();
        }

        return closer.stream()
                .filter(p -> !p.equals(requester))
                .collect(Collectors.toList());
    }
}
