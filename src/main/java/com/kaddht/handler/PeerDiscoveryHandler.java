package com.kaddht.handler;

import com.google.protobuf.ByteString;
import com.kaddht.core.PeerId;
import com.kaddht.core.PeerInfo;
import com.kaddht.rpc.MessageCodec;
import com.kaddht.rpc.proto.Message;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Handles FIND_NODE.
 *
 * <p>A request for the local node is answered with the local node alone. Otherwise
 * the answer is the closer peers from the routing table, plus the target itself when
 * it is connected or connectable from here and is not the requester. Each peer
 * appears at most once, and peers without any known address are left out.
 */
public class PeerDiscoveryHandler {

    private static final Logger logger = LoggerFactory.getLogger(PeerDiscoveryHandler.class);

    private final DhtContext context;
    private final CloserPeers closerPeers;

    public PeerDiscoveryHandler(DhtContext context, CloserPeers closerPeers) {
        this.context = context;
        this.closerPeers = closerPeers;
    }

    public Message handleFindPeer(PeerId from, Message request) {
        PeerId self = context.getSelf();
        Message.Builder response = MessageCodec.newResponse(
                request.getType(), ByteString.EMPTY, MessageCodec.clusterLevel(request));

        Set<PeerId> closest = new LinkedHashSet<>();
        ByteString key = request.getKey();

        if (!key.isEmpty() && key.equals(self.bytes())) {
            closest.add(self);
        } else {
            closest.addAll(closerPeers.select(key.toByteArray(), from));

            if (!key.isEmpty()) {
                PeerId target = new PeerId(key);
                // Never tell a peer about itself.
                if (!target.equals(from) && context.getConnectivity().connectedness(target).isReachable()) {
                    closest.add(target);
                }
            }
        }

        if (closest.isEmpty()) {
            logger.info("{} handleFindPeer could not find anything", self);
            return response.build();
        }

        List<PeerInfo> withAddresses = new ArrayList<>(closest.size());
        for (PeerInfo info : context.getAddressBook().peerInfos(closest)) {
            if (info.hasAddresses()) {
                withAddresses.add(info);
            }
        }

        response.addAllCloserPeers(MessageCodec.toWirePeers(withAddresses, context.getConnectivity()));
        return response.build();
    }
}
