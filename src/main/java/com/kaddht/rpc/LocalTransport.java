package com.kaddht.rpc;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.kaddht.core.Connectedness;
import com.kaddht.core.PeerId;
import com.kaddht.core.PeerInfo;
import com.kaddht.rpc.proto.Message;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * In-memory transport for local testing.
 * All nodes share a static registry to find each other.
 *
 * <p>Connectivity: a registered peer this transport has exchanged a message with
 * is {@link Connectedness#CONNECTED}; any other registered peer is
 * {@link Connectedness#CAN_CONNECT}; an unregistered peer is
 * {@link Connectedness#NOT_CONNECTED}.
 */
public class LocalTransport implements RpcTransport {

    private static final Logger logger = LoggerFactory.getLogger(LocalTransport.class);

    // Shared registry of all nodes in the local cluster
    private static final Map<PeerId, LocalTransport> REGISTRY = new ConcurrentHashMap<>();

    private final PeerId selfId;
    private final ExecutorService executor;
    private final long networkDelayMs;  // Simulated network delay
    private final Set<PeerId> contacted = ConcurrentHashMap.newKeySet();

    private volatile RequestHandler handler;

    public LocalTransport(PeerId selfId) {
        this(selfId, 0);
    }

    public LocalTransport(PeerId selfId, long networkDelayMs) {
        this.selfId = selfId;
        this.networkDelayMs = networkDelayMs;
        this.executor = Executors.newCachedThreadPool(new ThreadFactoryBuilder()
                .setNameFormat("local-" + selfId + "-%d")
                .setDaemon(true)
                .build());
    }

    @Override
    public void start(RequestHandler handler) {
        this.handler = handler;
        REGISTRY.put(selfId, this);
        logger.info("LocalTransport started for node {}", selfId);
    }

    @Override
    public void shutdown() {
        REGISTRY.remove(selfId);
        executor.shutdownNow();
        logger.info("LocalTransport shutdown for node {}", selfId);
    }

    @Override
    public CompletableFuture<Optional<Message>> sendRequest(PeerId target, Message message) {
        PeerInfo sender = new PeerInfo(selfId, listenAddresses());
        return CompletableFuture.supplyAsync(() -> {
            simulateNetworkDelay();

            LocalTransport remote = REGISTRY.get(target);
            if (remote == null) {
                throw new RuntimeException("Node not found: " + target);
            }
            contacted.add(target);

            logger.debug("{} -> {} {}", selfId, target, message.getType());
            Message response = remote.deliver(sender, message);
            logger.debug("{} <- {} {} (hasResponse={})", selfId, target, message.getType(), response != null);

            return Optional.ofNullable(response);
        }, executor);
    }

    private Message deliver(PeerInfo sender, Message message) {
        contacted.add(sender.id());
        return handler.handleRequest(sender, message);
    }

    @Override
    public Connectedness connectedness(PeerId peer) {
        if (!REGISTRY.containsKey(peer)) {
            return Connectedness.NOT_CONNECTED;
        }
        return contacted.contains(peer) ? Connectedness.CONNECTED : Connectedness.CAN_CONNECT;
    }

    @Override
    public void updatePeerAddress(PeerId peer, String address) {
        // Peers are found through the registry.
    }

    @Override
    public List<String> listenAddresses() {
        return List.of("local:" + selfId);
    }

    private void simulateNetworkDelay() {
        if (networkDelayMs > 0) {
            try {
                Thread.sleep(networkDelayMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    /**
     * Clear the registry. Useful for test cleanup.
     */
    public static void clearRegistry() {
        REGISTRY.clear();
    }

    /**
     * Check if a node is registered.
     */
    public static boolean isRegistered(PeerId peerId) {
        return REGISTRY.containsKey(peerId);
    }
}
