package com.kaddht.config;

import com.google.common.net.InetAddresses;
import com.kaddht.core.PeerId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration for a DHT node.
 *
 * <p>The bind host is the interface the server listens on and may be the
 * wildcard {@code 0.0.0.0}. The advertised host is what peers are told to dial;
 * it defaults to this machine's address and is never a wildcard.
 */
public class NodeConfig {

    private static final Logger logger = LoggerFactory.getLogger(NodeConfig.class);

    private final PeerId peerId;
    private final String bindHost;
    private final String host;
    private final int port;
    private final Map<PeerId, String> peerAddresses;
    private final DhtSettings settings;

    private NodeConfig(Builder builder) {
        this.peerId = builder.peerId;
        this.bindHost = builder.bindHost;
        this.host = builder.host;
        this.port = builder.port;
        this.peerAddresses = new LinkedHashMap<>(builder.peerAddresses);
        this.settings = builder.settings.build();
    }

    public PeerId getPeerId() {
        return peerId;
    }

    /**
     * The host advertised to other peers.
     */
    public String getHost() {
        return host;
    }

    public String getBindHost() {
        return bindHost;
    }

    public int getPort() {
        return port;
    }

    public Map<PeerId, String> getPeerAddresses() {
        return peerAddresses;
    }

    public List<PeerId> getPeers() {
        return List.copyOf(peerAddresses.keySet());
    }

    public DhtSettings getSettings() {
        return settings;
    }

    public String getAddress() {
        return host + ":" + port;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Parse command line arguments into NodeConfig.
     *
     * Expected format:
     *   --id=node-1 --host=10.0.0.5 --bind=0.0.0.0 --port=9001
     *   --peers=node-2:localhost:9002,node-3:localhost:9003
     *   --max-record-age=PT36H --request-timeout-ms=5000 --closer-peer-count=20
     */
    public static NodeConfig fromArgs(String[] args) {
        Builder builder = builder();

        for (String arg : args) {
            if (arg.startsWith("--id=")) {
                builder.peerId(PeerId.of(arg.substring(5)));
            } else if (arg.startsWith("--host=")) {
                builder.host(arg.substring(7));
            } else if (arg.startsWith("--bind=")) {
                builder.bindHost(arg.substring(7));
            } else if (arg.startsWith("--port=")) {
                builder.port(Integer.parseInt(arg.substring(7)));
            } else if (arg.startsWith("--peers=")) {
                // Format: node-2:localhost:9002,node-3:localhost:9003
                String peersStr = arg.substring(8);
                if (!peersStr.isEmpty()) {
                    for (String peerSpec : peersStr.split(",")) {
                        String[] parts = peerSpec.split(":", 2);
                        if (parts.length == 2) {
                            builder.addPeer(PeerId.of(parts[0]), parts[1]);
                        }
                    }
                }
            } else if (arg.startsWith("--max-record-age=")) {
                builder.settings().maxRecordAge(Duration.parse(arg.substring(17)));
            } else if (arg.startsWith("--request-timeout-ms=")) {
                builder.settings().requestTimeout(Duration.ofMillis(Long.parseLong(arg.substring(21))));
            } else if (arg.startsWith("--closer-peer-count=")) {
                builder.settings().closerPeerCount(Integer.parseInt(arg.substring(20)));
            }
        }

        return builder.build();
    }

    @Override
    public String toString() {
        return "NodeConfig{" +
                "peerId=" + peerId +
                ", host='" + host + '\'' +
                ", bindHost='" + bindHost + '\'' +
                ", port=" + port +
                ", peers=" + peerAddresses.keySet() +
                ", settings=" + settings +
                '}';
    }

    public static class Builder {
        private PeerId peerId;
        private String bindHost = "0.0.0.0";
        private String host;
        private int port = 4001;
        private final Map<PeerId, String> peerAddresses = new LinkedHashMap<>();
        private final DhtSettings.Builder settings = DhtSettings.builder();

        public Builder peerId(PeerId peerId) {
            this.peerId = peerId;
            return this;
        }

        public Builder peerId(String peerId) {
            this.peerId = PeerId.of(peerId);
            return this;
        }

        public Builder host(String host) {
            this.host = host;
            return this;
        }

        public Builder bindHost(String bindHost) {
            this.bindHost = bindHost;
            return this;
        }

        public Builder port(int port) {
            this.port = port;
            return this;
        }

        public Builder addPeer(PeerId peerId, String address) {
            this.peerAddresses.put(peerId, address);
            return this;
        }

        public Builder addPeer(String peerId, String host, int port) {
            this.peerAddresses.put(PeerId.of(peerId), host + ":" + port);
            return this;
        }

        /**
         * Returns the nested settings builder so protocol constants can be tuned in place.
         */
        public DhtSettings.Builder settings() {
            return settings;
        }

        public NodeConfig build() {
            if (peerId == null) {
                throw new IllegalStateException("peerId is required");
            }
            if (host == null || host.isEmpty()) {
                host = localHostAddress();
            } else if (InetAddresses.isInetAddress(host) && InetAddresses.forString(host).isAnyLocalAddress()) {
                throw new IllegalStateException("Cannot advertise wildcard address " + host + ", set --host");
            }
            return new NodeConfig(this);
        }

        private static String localHostAddress() {
            try {
                return InetAddress.getLocalHost().getHostAddress();
            } catch (UnknownHostException e) {
                String loopback = InetAddress.getLoopbackAddress().getHostAddress();
                logger.warn("Cannot resolve the local host address, advertising {}; set --host", loopback, e);
                return loopback;
            }
        }
    }
}
