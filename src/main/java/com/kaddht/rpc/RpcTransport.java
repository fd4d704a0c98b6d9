package com.kaddht.rpc;

import com.kaddht.core.PeerId;
import com.kaddht.routing.ConnectivityOracle;
import com.kaddht.rpc.proto.Message;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Abstraction layer for DHT message exchange between nodes.
 *
 * <p>A transport delivers inbound messages to a {@link RequestHandler} and sends
 * one-shot requests to other nodes. Because it is the only component that sees
 * live connections, it also acts as the node's {@link ConnectivityOracle}.
 *
 * <h2>Implementations</h2>
 * <ul>
 *   <li>{@link LocalTransport} - In-memory transport for testing (single process)</li>
 *   <li>{@link GrpcTransport} - gRPC-based transport for production (real network)</li>
 * </ul>
 *
 * <h2>Threading Model</h2>
 * <p>Sends return {@link CompletableFuture}. Inbound messages are handled on
 * transport-owned threads, many at a time.
 *
 * @see RequestHandler
 */
public interface RpcTransport extends ConnectivityOracle {

    /**
     * Sends a message to a target node.
     *
     * @param target the ID of the target node
     * @param message the request
     * @return a future completing with the response, or empty if the handler produced
     *         no payload; it completes exceptionally if the remote handler failed
     */
    CompletableFuture<Optional<Message>> sendRequest(PeerId target, Message message);

    /**
     * Records the address at which a peer can be reached.
     */
    void updatePeerAddress(PeerId peer, String address);

    /**
     * Returns the addresses this node advertises to others.
     */
    List<String> listenAddresses();

    /**
     * Starts the transport and begins delivering inbound messages to the handler.
     */
    void start(RequestHandler handler);

    /**
     * Shuts down the transport and releases all resources.
     */
    void shutdown();
}
