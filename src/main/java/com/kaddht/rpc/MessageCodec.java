package com.kaddht.rpc;

import com.google.protobuf.ByteString;
import com.kaddht.core.Connectedness;
import com.kaddht.core.PeerId;
import com.kaddht.core.PeerInfo;
import com.kaddht.routing.ConnectivityOracle;
import com.kaddht.rpc.proto.Message;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Conversions between wire messages and the node's own types.
 *
 * <h2>Cluster level</h2>
 * <p>The cluster level travels as {@code level + 1} in {@code clusterLevelRaw} so that
 * an unset field reads as level 0. Responses always echo the request's level.
 *
 * <h2>Peers</h2>
 * <p>Addresses are carried as UTF-8 bytes. Outbound peers are tagged with the
 * local node's current {@link Connectedness} towards them.
 */
public final class MessageCodec {

    private static final Logger logger = LoggerFactory.getLogger(MessageCodec.class);

    private MessageCodec() {
    }

    /**
     * Creates a response envelope with the given type, key and cluster level.
     */
    public static Message.Builder newResponse(Message.MessageType type, ByteString key, int clusterLevel) {
        return Message.newBuilder()
                .setType(type)
                .setKey(key)
                .setClusterLevelRaw(clusterLevel + 1);
    }

    /**
     * Creates a response envelope echoing the request's type, key and cluster level.
     */
    public static Message.Builder newResponse(Message request) {
        return newResponse(request.getType(), request.getKey(), clusterLevel(request));
    }

    public static int clusterLevel(Message message) {
        return Math.max(message.getClusterLevelRaw() - 1, 0);
    }

    // ==================== Peers ====================

    public static Message.Peer toWirePeer(PeerInfo info, Connectedness connectedness) {
        Message.Peer.Builder builder = Message.Peer.newBuilder()
                .setId(info.id().bytes())
                .setConnection(toConnectionType(connectedness));
        for (String address : info.addresses()) {
            builder.addAddrs(ByteString.copyFromUtf8(address));
        }
        return builder.build();
    }

    public static List<Message.Peer> toWirePeers(List<PeerInfo> infos, ConnectivityOracle connectivity) {
        List<Message.Peer> peers = new ArrayList<>(infos.size());
        for (PeerInfo info : infos) {
            peers.add(toWirePeer(info, connectivity.connectedness(info.id())));
        }
        return peers;
    }

    /**
     * Converts a wire peer, or returns null if it carries no identifier.
     */
    public static PeerInfo fromWirePeer(Message.Peer peer) {
        if (peer.getId().isEmpty()) {
            return null;
        }
        List<String> addresses = new ArrayList<>(peer.getAddrsCount());
        for (ByteString addr : peer.getAddrsList()) {
            if (!addr.isEmpty()) {
                addresses.add(addr.toString(StandardCharsets.UTF_8));
            }
        }
        return new PeerInfo(new PeerId(peer.getId()), addresses);
    }

    /**
     * Converts wire peers, skipping any without an identifier.
     */
    public static List<PeerInfo> fromWirePeers(List<Message.Peer> peers) {
        List<PeerInfo> infos = new ArrayList<>(peers.size());
        for (Message.Peer peer : peers) {
            PeerInfo info = fromWirePeer(peer);
            if (info == null) {
                logger.debug("Skipping wire peer without an identifier");
                continue;
            }
            infos.add(info);
        }
        return infos;
    }

    public static Message.ConnectionType toConnectionType(Connectedness connectedness) {
        return switch (connectedness) {
            case CONNECTED -> Message.ConnectionType.CONNECTED;
            case CAN_CONNECT -> Message.ConnectionType.CAN_CONNECT;
            case CANNOT_CONNECT -> Message.ConnectionType.CANNOT_CONNECT;
            case NOT_CONNECTED -> Message.ConnectionType.NOT_CONNECTED;
        };
    }

    public static Connectedness fromConnectionType(Message.ConnectionType type) {
        return switch (type) {
            case CONNECTED -> Connectedness.CONNECTED;
            case CAN_CONNECT -> Connectedness.CAN_CONNECT;
            case CANNOT_CONNECT -> Connectedness.CANNOT_CONNECT;
            case NOT_CONNECTED, UNRECOGNIZED -> Connectedness.NOT_CONNECTED;
        };
    }
}
