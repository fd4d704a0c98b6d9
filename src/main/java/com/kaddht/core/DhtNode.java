package com.kaddht.core;

import com.kaddht.handler.DhtContext;
import com.kaddht.handler.DhtHandler;
import com.kaddht.handler.MessageDispatcher;
import com.kaddht.routing.InMemoryAddressBook;
import com.kaddht.rpc.RequestHandler;
import com.kaddht.rpc.RpcTransport;
import com.kaddht.rpc.proto.Message;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Main DHT node implementation.
 *
 * Assembles the handlers over a shared {@link DhtContext} and serves inbound
 * messages from the transport. Every peer that sends a request is learned: its
 * advertised addresses go into the address book for a short while and it is
 * offered to the routing table.
 */
public class DhtNode implements RequestHandler {

    private static final Logger logger = LoggerFactory.getLogger(DhtNode.class);

    private final PeerId id;
    private final DhtContext context;
    private final RpcTransport transport;
    private final MessageDispatcher dispatcher;

    private volatile boolean running;

    public DhtNode(DhtContext context, RpcTransport transport) {
        this.id = context.getSelf();
        this.context = context;
        this.transport = transport;
        this.dispatcher = MessageDispatcher.create(context);
    }

    /**
     * Start the DHT node, including its transport.
     */
    public void start() {
        MDC.put("nodeId", id.toString());
        try {
            logger.info("Starting DhtNode {}", id);

            // Our own addresses never expire; FIND_NODE on our id needs them.
            context.getAddressBook().addAddresses(id, transport.listenAddresses(), InMemoryAddressBook.PERMANENT_TTL);
            transport.start(this);
            running = true;

            logger.info("DhtNode {} started, listening on {}", id, transport.listenAddresses());
        } finally {
            MDC.remove("nodeId");
        }
    }

    /**
     * Stop the DHT node and release its datastore.
     */
    public void stop() {
        MDC.put("nodeId", id.toString());
        try {
            logger.info("Stopping DhtNode {}", id);

            running = false;
            transport.shutdown();
            context.close();

            logger.info("DhtNode {} stopped", id);
        } finally {
            MDC.remove("nodeId");
        }
    }

    // ==================== RequestHandler ====================

    @Override
    public Message handleRequest(PeerInfo sender, Message request) {
        MDC.put("nodeId", id.toString());
        try {
            learnSender(sender);

            DhtHandler handler = dispatcher.handlerFor(request.getType())
                    .orElseThrow(() -> {
                        logger.debug("Got back nil handler from dispatcher for {}", request.getType());
                        return new UnsupportedMessageTypeException(request.getType());
                    });

            logger.debug("Handling {} from {}", request.getType(), sender.id());
            return handler.handle(sender.id(), request);
        } finally {
            MDC.remove("nodeId");
        }
    }

    private void learnSender(PeerInfo sender) {
        if (sender.id().equals(id)) {
            return;
        }
        if (sender.hasAddresses()) {
            context.getAddressBook().addAddresses(sender.id(), sender.addresses(),
                    context.getSettings().getRecentlyConnectedAddrTtl());
        }
        context.getRoutingTable().update(sender.id());
    }

    // ==================== Outbound ====================

    /**
     * Sends a message to another node.
     */
    public CompletableFuture<Optional<Message>> sendRequest(PeerId target, Message message) {
        return transport.sendRequest(target, message);
    }

    /**
     * Introduces a peer: its addresses become known for the recently-connected TTL,
     * it is offered to the routing table, and the transport learns where to reach it.
     */
    public void addPeer(PeerInfo peer) {
        if (peer.id().equals(id)) {
            return;
        }
        context.getAddressBook().addAddresses(peer.id(), peer.addresses(),
                context.getSettings().getRecentlyConnectedAddrTtl());
        if (!context.getRoutingTable().update(peer.id())) {
            logger.debug("Routing table did not accept {}", peer.id());
        }
        if (peer.hasAddresses()) {
            transport.updatePeerAddress(peer.id(), peer.addresses().get(0));
        }
    }

    // ==================== Getters ====================

    public PeerId getId() {
        return id;
    }

    public DhtContext getContext() {
        return context;
    }

    public boolean isRunning() {
        return running;
    }
}
