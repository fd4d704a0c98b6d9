package com.kaddht.handler;

import com.kaddht.core.PeerId;
import com.kaddht.rpc.proto.Message;

/**
 * Handles one message type.
 */
@FunctionalInterface
public interface DhtHandler {

    /**
     * @param from the requesting peer
     * @param request the inbound message
     * @return the response, or null when the message type has no response payload
     * @throws com.kaddht.core.DhtException if the request fails
     */
    Message handle(PeerId from, Message request);
}
