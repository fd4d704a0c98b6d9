package com.kaddht.handler;

import com.kaddht.rpc.proto.Message;

import java.util.Optional;

/**
 * Maps each message type to the handler answering it.
 *
 * <p>The mapping is a switch over every {@link Message.MessageType} constant, so a
 * new type on the wire fails compilation here until it is routed. Types the
 * protobuf runtime does not recognize map to no handler.
 */
public class MessageDispatcher {

    private final ValueStoreHandler values;
    private final PeerDiscoveryHandler discovery;
    private final ProviderHandler providers;
    private final PingHandler ping;

    public MessageDispatcher(ValueStoreHandler values, PeerDiscoveryHandler discovery,
                             ProviderHandler providers, PingHandler ping) {
        this.values = values;
        this.discovery = discovery;
        this.providers = providers;
        this.ping = ping;
    }

    /**
     * Wires up all handlers over one shared context.
     */
    public static MessageDispatcher create(DhtContext context) {
        CloserPeers closerPeers = new CloserPeers(
                context.getSelf(), context.getRoutingTable(), context.getSettings().getCloserPeerCount());
        return new MessageDispatcher(
                new ValueStoreHandler(context, closerPeers),
                new PeerDiscoveryHandler(context, closerPeers),
                new ProviderHandler(context, closerPeers),
                new PingHandler(context.getSelf()));
    }

    public Optional<DhtHandler> handlerFor(Message.MessageType type) {
        DhtHandler handler = switch (type) {
            case GET_VALUE -> values::handleGetValue;
            case PUT_VALUE -> values::handlePutValue;
            case FIND_NODE -> discovery::handleFindPeer;
            case GET_PROVIDERS -> providers::handleGetProviders;
            case ADD_PROVIDER -> providers::handleAddProvider;
            case PING -> ping::handlePing;
            case UNRECOGNIZED -> null;
        };
        return Optional.ofNullable(handler);
    }
}
