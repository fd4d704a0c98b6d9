package com.kaddht.rpc;

import com.kaddht.core.PeerInfo;
import com.kaddht.rpc.proto.Message;

/**
 * Handler interface for processing inbound DHT messages.
 *
 * <p>This interface is implemented by {@link com.kaddht.core.DhtNode}. The transport
 * layer ({@link RpcTransport}) receives requests and delegates them here.
 * Implementations must be thread-safe: requests are handled concurrently,
 * including several requests for the same key.
 *
 * @see RpcTransport
 * @see com.kaddht.core.DhtNode
 */
public interface RequestHandler {

    /**
     * Handles one inbound message.
     *
     * @param sender the requesting peer and the addresses it advertised
     * @param request the inbound message
     * @return the response, or null if the message produces no response payload
     * @throws com.kaddht.core.DhtException if the request fails; no response is sent
     */
    Message handleRequest(PeerInfo sender, Message request);
}
