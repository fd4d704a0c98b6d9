package com.kaddht.server;

import com.kaddht.config.NodeConfig;
import com.kaddht.core.DhtNode;
import com.kaddht.core.PeerId;
import com.kaddht.core.PeerInfo;
import com.kaddht.handler.DhtContext;
import com.kaddht.rpc.GrpcTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * DHT server main class.
 *
 * Starts a single DHT node with gRPC transport and in-memory storage.
 *
 * Usage:
 *   java -jar kad-dht.jar --id=node-1 --port=4001 \
 *       --peers=node-2:localhost:4002,node-3:localhost:4003
 */
public class DhtServer {

    private static final Logger logger = LoggerFactory.getLogger(DhtServer.class);

    private final NodeConfig config;
    private volatile DhtNode node;

    public DhtServer(NodeConfig config) {
        this.config = config;
    }

    /**
     * Start the DHT server.
     */
    public void start() {
        logger.info("Starting DHT server with config: {}", config);

        GrpcTransport transport = new GrpcTransport(
                config.getPeerId(),
                config.getBindHost(),
                config.getHost(),
                config.getPort(),
                config.getPeerAddresses(),
                config.getSettings().getRequestTimeout()
        );

        DhtContext context = DhtContext.builder(config.getPeerId())
                .settings(config.getSettings())
                .connectivity(transport)
                .build();

        node = new DhtNode(context, transport);
        node.start();

        // Seed the routing table with the configured peers
        for (Map.Entry<PeerId, String> peer : config.getPeerAddresses().entrySet()) {
            node.addPeer(new PeerInfo(peer.getKey(), List.of(peer.getValue())));
        }

        logger.info("DHT server started: {} listening on port {} with {} seed peers",
                config.getPeerId(), config.getPort(), config.getPeerAddresses().size());
    }

    /**
     * Stop the DHT server.
     */
    public void stop() {
        logger.info("Stopping DHT server: {}", config.getPeerId());

        DhtNode current = node;
        if (current != null) {
            current.stop();
        }
        synchronized (this) {
            node = null;
            notifyAll();
        }

        logger.info("DHT server stopped: {}", config.getPeerId());
    }

    /**
     * Get the underlying DHT node.
     */
    public DhtNode getNode() {
        return node;
    }

    public NodeConfig getConfig() {
        return config;
    }

    /**
     * Block until shutdown signal.
     */
    public void awaitTermination() throws InterruptedException {
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.info("Shutdown signal received");
            stop();
        }));

        synchronized (this) {
            while (node != null) {
                wait(1000);
            }
        }
    }

    /**
     * Main entry point.
     */
    public static void main(String[] args) {
        if (args.length == 0) {
            printUsage();
            System.exit(1);
        }

        try {
            NodeConfig config = NodeConfig.fromArgs(args);
            DhtServer server = new DhtServer(config);

            server.start();
            server.awaitTermination();

        } catch (Exception e) {
            logger.error("Failed to start DHT server", e);
            System.exit(1);
        }
    }

    private static void printUsage() {
        System.out.println("Usage: java -jar kad-dht.jar [options]");
        System.out.println();
        System.out.println("Options:");
        System.out.println("  --id=<peer-id>              Peer identifier (required)");
        System.out.println("  --host=<host>               Host to advertise (default: this machine's address)");
        System.out.println("  --bind=<host>               Interface to listen on (default: 0.0.0.0)");
        System.out.println("  --port=<port>               Port to listen on (default: 4001)");
        System.out.println("  --peers=<peers>             Comma-separated list of seed peers");
        System.out.println("                              Format: peer-id:host:port,peer-id:host:port");
        System.out.println("  --max-record-age=<dur>      ISO-8601 duration (default: PT36H)");
        System.out.println("  --request-timeout-ms=<ms>   Inbound request deadline (default: 5000)");
        System.out.println("  --closer-peer-count=<n>     Closer peers per answer (default: 20)");
        System.out.println();
        System.out.println("Example:");
        System.out.println("  java -jar kad-dht.jar --id=node-1 --port=4001 \\");
        System.out.println("      --peers=node-2:localhost:4002,node-3:localhost:4003");
    }
}
