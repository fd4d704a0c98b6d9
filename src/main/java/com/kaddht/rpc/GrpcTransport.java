package com.kaddht.rpc;

import com.google.common.net.HostAndPort;
import com.google.common.net.InetAddresses;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.kaddht.core.Connectedness;
import com.kaddht.core.InvalidRequestException;
import com.kaddht.core.PeerId;
import com.kaddht.core.PeerInfo;
import com.kaddht.core.RecordRejectedException;
import com.kaddht.core.RequestCancelledException;
import com.kaddht.core.UnsupportedMessageTypeException;
import com.kaddht.rpc.proto.DhtRequest;
import com.kaddht.rpc.proto.DhtResponse;
import com.kaddht.rpc.proto.DhtServiceGrpc;
import com.kaddht.rpc.proto.Message;
import io.grpc.ConnectivityState;
import io.grpc.Context;
import io.grpc.Contexts;
import io.grpc.Grpc;
import io.grpc.ManagedChannel;
import io.grpc.ManagedChannelBuilder;
import io.grpc.Metadata;
import io.grpc.Server;
import io.grpc.ServerCall;
import io.grpc.ServerCallHandler;
import io.grpc.ServerInterceptor;
import io.grpc.ServerInterceptors;
import io.grpc.Status;
import io.grpc.netty.shaded.io.grpc.netty.NettyServerBuilder;
import io.grpc.stub.StreamObserver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * gRPC-based transport for real network communication.
 *
 * <p>Each node runs a gRPC server and maintains client channels to peers. Inbound
 * requests run on a worker pool under the configured request timeout; if the
 * caller cancels or the timeout passes, the worker is interrupted so the handler
 * stops without persisting anything.
 *
 * <h2>Failure mapping</h2>
 * <ul>
 *   <li>{@link InvalidRequestException} - {@code INVALID_ARGUMENT}</li>
 *   <li>{@link RecordRejectedException} - {@code FAILED_PRECONDITION}</li>
 *   <li>{@link UnsupportedMessageTypeException} - {@code UNIMPLEMENTED}</li>
 *   <li>{@link RequestCancelledException} - {@code CANCELLED}</li>
 *   <li>timeout - {@code DEADLINE_EXCEEDED}</li>
 *   <li>anything else - {@code INTERNAL}</li>
 * </ul>
 *
 * <h2>Sender addresses</h2>
 * <p>A request's sender block is only a claim. Addresses in it are kept only when
 * their host is the address the call actually came from, and an inbound request
 * never replaces the route already held for a peer; only
 * {@link #updatePeerAddress} (configured or explicitly introduced peers) does that.
 */
public class GrpcTransport implements RpcTransport {

    private static final Logger logger = LoggerFactory.getLogger(GrpcTransport.class);

    private static final Context.Key<SocketAddress> REMOTE_ADDR = Context.key("dht-remote-addr");

    private final PeerId selfId;
    private final String bindHost;
    private final String host;
    private final int port;
    private final Duration requestTimeout;
    private final Map<PeerId, String> peerAddresses;  // peerId -> "host:port"

    private Server server;
    private RequestHandler handler;

    // Client stubs for each peer (lazily created and cached)
    private final Map<PeerId, ManagedChannel> channels = new ConcurrentHashMap<>();
    private final Map<PeerId, DhtServiceGrpc.DhtServiceFutureStub> stubs = new ConcurrentHashMap<>();

    // Workers for inbound requests and async sends
    private final ExecutorService executor;

    /**
     * Create a GrpcTransport.
     *
     * @param selfId this node's ID
     * @param host host advertised to other nodes; must not be a wildcard address
     * @param port port to bind the server to
     * @param peerAddresses map of peer ID to "host:port"
     * @param requestTimeout deadline for handling one inbound request and for one outbound send
     */
    public GrpcTransport(PeerId selfId, String host, int port, Map<PeerId, String> peerAddresses,
                         Duration requestTimeout) {
        this(selfId, "0.0.0.0", host, port, peerAddresses, requestTimeout);
    }

    /**
     * Create a GrpcTransport bound to a specific local interface.
     *
     * @param bindHost interface the server listens on, {@code 0.0.0.0} for all
     */
    public GrpcTransport(PeerId selfId, String bindHost, String host, int port, Map<PeerId, String> peerAddresses,
                         Duration requestTimeout) {
        if (isWildcard(host)) {
            throw new IllegalArgumentException("Cannot advertise wildcard address " + host);
        }
        this.selfId = selfId;
        this.bindHost = bindHost;
        this.host = host;
        this.port = port;
        this.requestTimeout = requestTimeout;
        this.peerAddresses = new ConcurrentHashMap<>(peerAddresses);
        this.executor = Executors.newCachedThreadPool(new ThreadFactoryBuilder()
                .setNameFormat("dht-" + selfId + "-%d")
                .setDaemon(true)
                .build());
    }

    @Override
    public void start(RequestHandler handler) {
        this.handler = handler;

        try {
            server = NettyServerBuilder.forAddress(new InetSocketAddress(bindHost, port))
                    .addService(ServerInterceptors.intercept(new DhtServiceImpl(), new RemoteAddressInterceptor()))
                    .build()
                    .start();

            logger.info("gRPC server started on {}:{}, advertising {}:{}", bindHost, port, host, port);

        } catch (IOException e) {
            throw new RuntimeException("Failed to start gRPC server on port " + port, e);
        }
    }

    @Override
    public void shutdown() {
        // Shutdown all client channels
        for (ManagedChannel channel : channels.values()) {
            try {
                channel.shutdown().awaitTermination(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                channel.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        channels.clear();
        stubs.clear();

        // Shutdown server
        if (server != null) {
            server.shutdown();
            try {
                server.awaitTermination(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                server.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }

        executor.shutdownNow();
        logger.info("gRPC transport shutdown for {}", selfId);
    }

    @Override
    public CompletableFuture<Optional<Message>> sendRequest(PeerId target, Message message) {
        DhtRequest request = DhtRequest.newBuilder()
                .setSender(MessageCodec.toWirePeer(new PeerInfo(selfId, listenAddresses()), Connectedness.CONNECTED))
                .setMessage(message)
                .build();

        return CompletableFuture.supplyAsync(() -> {
            try {
                DhtServiceGrpc.DhtServiceFutureStub stub = getStub(target);
                DhtResponse response = stub.handle(request)
                        .get(requestTimeout.toMillis(), TimeUnit.MILLISECONDS);

                logger.debug("{} -> {} {} -> hasResponse={}",
                        selfId, target, message.getType(), response.hasMessage());

                return response.hasMessage() ? Optional.of(response.getMessage()) : Optional.<Message>empty();

            } catch (TimeoutException e) {
                throw new CompletionException(message.getType() + " to " + target + " timed out", e);
            } catch (ExecutionException e) {
                throw new CompletionException(e.getCause());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new CompletionException(message.getType() + " to " + target + " interrupted", e);
            }
        }, executor);
    }

    @Override
    public Connectedness connectedness(PeerId peer) {
        ManagedChannel channel = channels.get(peer);
        if (channel != null) {
            ConnectivityState state = channel.getState(false);
            return switch (state) {
                case READY -> Connectedness.CONNECTED;
                case TRANSIENT_FAILURE -> Connectedness.CANNOT_CONNECT;
                case SHUTDOWN -> Connectedness.NOT_CONNECTED;
                case IDLE, CONNECTING -> Connectedness.CAN_CONNECT;
            };
        }
        return peerAddresses.containsKey(peer) ? Connectedness.CAN_CONNECT : Connectedness.NOT_CONNECTED;
    }

    @Override
    public List<String> listenAddresses() {
        return List.of(host + ":" + port);
    }

    /**
     * Get or create a stub for the target node.
     */
    private DhtServiceGrpc.DhtServiceFutureStub getStub(PeerId target) {
        return stubs.computeIfAbsent(target, id -> {
            ManagedChannel channel = getChannel(id);
            return DhtServiceGrpc.newFutureStub(channel);
        });
    }

    /**
     * Get or create a channel to the target node.
     */
    private ManagedChannel getChannel(PeerId target) {
        return channels.computeIfAbsent(target, id -> {
            String address = peerAddresses.get(id);
            if (address == null) {
                throw new IllegalArgumentException("Unknown peer: " + id);
            }

            String[] parts = address.split(":");
            String peerHost = parts[0];
            int peerPort = Integer.parseInt(parts[1]);

            logger.debug("Creating channel to {} at {}:{}", id, peerHost, peerPort);

            return ManagedChannelBuilder.forAddress(peerHost, peerPort)
                    .usePlaintext()  // No TLS for now
                    .build();
        });
    }

    /**
     * Add or update a peer address. A changed address closes the old channel.
     */
    @Override
    public void updatePeerAddress(PeerId peerId, String address) {
        if (peerId.equals(selfId)) {
            return;
        }
        String oldAddress = peerAddresses.put(peerId, address);

        // If address changed, close old channel
        if (oldAddress != null && !oldAddress.equals(address)) {
            ManagedChannel oldChannel = channels.remove(peerId);
            stubs.remove(peerId);
            if (oldChannel != null) {
                oldChannel.shutdown();
            }
        }
    }

    /**
     * Records an address for a peer the transport has no route to yet.
     */
    private void learnPeerAddress(PeerId peerId, String address) {
        if (peerId.equals(selfId)) {
            return;
        }
        if (peerAddresses.putIfAbsent(peerId, address) == null) {
            logger.debug("Learned address {} for {}", address, peerId);
        }
    }

    /**
     * Keeps the claimed sender addresses that can be trusted: the host must be the
     * one the call came from, and a peer we already route to keeps its known address.
     */
    PeerInfo verifiedSender(PeerInfo claimed, SocketAddress remote) {
        String known = peerAddresses.get(claimed.id());
        List<String> trusted = claimed.addresses().stream()
                .filter(address -> hostMatches(address, remote))
                .filter(address -> known == null || known.equals(address))
                .collect(Collectors.toList());
        if (trusted.size() < claimed.addresses().size()) {
            logger.debug("Dropped unverified addresses for {}: claimed {}, kept {} (remote {})",
                    claimed.id(), claimed.addresses(), trusted, remote);
        }
        return new PeerInfo(claimed.id(), trusted);
    }

    static boolean hostMatches(String address, SocketAddress remote) {
        if (!(remote instanceof InetSocketAddress)) {
            return false;
        }
        InetAddress remoteHost = ((InetSocketAddress) remote).getAddress();
        if (remoteHost == null) {
            return false;
        }
        HostAndPort hostAndPort;
        try {
            hostAndPort = HostAndPort.fromString(address);
        } catch (IllegalArgumentException e) {
            return false;
        }
        if (!hostAndPort.hasPort() || !InetAddresses.isInetAddress(hostAndPort.getHost())) {
            return false;
        }
        return InetAddresses.forString(hostAndPort.getHost()).equals(remoteHost);
    }

    static boolean isWildcard(String host) {
        return host == null || host.isEmpty()
                || (InetAddresses.isInetAddress(host) && InetAddresses.forString(host).isAnyLocalAddress());
    }

    /**
     * Get the port this transport is listening on.
     */
    public int getPort() {
        return port;
    }

    /**
     * Maps a handler failure to the gRPC status returned to the caller.
     */
    static Status toStatus(Throwable error) {
        if (error instanceof InvalidRequestException) {
            return Status.INVALID_ARGUMENT.withDescription(error.getMessage());
        }
        if (error instanceof RecordRejectedException) {
            return Status.FAILED_PRECONDITION.withDescription(error.getMessage());
        }
        if (error instanceof UnsupportedMessageTypeException) {
            return Status.UNIMPLEMENTED.withDescription(error.getMessage());
        }
        if (error instanceof RequestCancelledException) {
            return Status.CANCELLED.withDescription(error.getMessage());
        }
        return Status.INTERNAL.withDescription(error.getMessage()).withCause(error);
    }

    /**
     * gRPC service implementation that delegates to RequestHandler.
     */
    private class DhtServiceImpl extends DhtServiceGrpc.DhtServiceImplBase {

        @Override
        public void handle(DhtRequest request, StreamObserver<DhtResponse> responseObserver) {
            MDC.put("nodeId", selfId.toString());
            try {
                serve(request, responseObserver);
            } finally {
                MDC.remove("nodeId");
            }
        }

        private void serve(DhtRequest request, StreamObserver<DhtResponse> responseObserver) {
            PeerInfo claimed = MessageCodec.fromWirePeer(request.getSender());
            if (claimed == null) {
                responseObserver.onError(Status.INVALID_ARGUMENT
                        .withDescription("Request carries no sender")
                        .asRuntimeException());
                return;
            }
            PeerInfo sender = verifiedSender(claimed, REMOTE_ADDR.get());
            if (sender.hasAddresses()) {
                learnPeerAddress(sender.id(), sender.addresses().get(0));
            }

            Message message = request.getMessage();
            Future<Message> work = executor.submit(() -> {
                MDC.put("nodeId", selfId.toString());
                try {
                    return handler.handleRequest(sender, message);
                } finally {
                    MDC.remove("nodeId");
                }
            });
            // Interrupt the worker if the caller goes away.
            Context.current().addListener(ctx -> work.cancel(true), MoreExecutors.directExecutor());

            try {
                Message response = work.get(requestTimeout.toMillis(), TimeUnit.MILLISECONDS);
                DhtResponse.Builder builder = DhtResponse.newBuilder();
                if (response != null) {
                    builder.setMessage(response);
                }
                responseObserver.onNext(builder.build());
                responseObserver.onCompleted();

            } catch (TimeoutException e) {
                work.cancel(true);
                logger.warn("{} from {} timed out after {}", message.getType(), sender.id(), requestTimeout);
                responseObserver.onError(Status.DEADLINE_EXCEEDED
                        .withDescription("Request timed out")
                        .asRuntimeException());
            } catch (CancellationException e) {
                logger.debug("{} from {} cancelled by caller", message.getType(), sender.id());
                responseObserver.onError(Status.CANCELLED.asRuntimeException());
            } catch (ExecutionException e) {
                Status status = toStatus(e.getCause());
                if (status.getCode() == Status.Code.INTERNAL) {
                    logger.error("Error handling {} from {}", message.getType(), sender.id(), e.getCause());
                } else {
                    logger.debug("{} from {} failed: {}", message.getType(), sender.id(), e.getCause().getMessage());
                }
                responseObserver.onError(status.asRuntimeException());
            } catch (InterruptedException e) {
                work.cancel(true);
                Thread.currentThread().interrupt();
                responseObserver.onError(Status.CANCELLED.asRuntimeException());
            }
        }
    }

    /**
     * Exposes the caller's socket address to the service through the gRPC context.
     */
    private static class RemoteAddressInterceptor implements ServerInterceptor {

        @Override
        public <ReqT, RespT> ServerCall.Listener<ReqT> interceptCall(
                ServerCall<ReqT, RespT> call, Metadata headers, ServerCallHandler<ReqT, RespT> next) {
            SocketAddress remote = call.getAttributes().get(Grpc.TRANSPORT_ATTR_REMOTE_ADDR);
            Context context = Context.current().withValue(REMOTE_ADDR, remote);
            return Contexts.interceptCall(context, call, headers, next);
        }
    }
}
