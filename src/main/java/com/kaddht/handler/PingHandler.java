package com.kaddht.handler;

import com.kaddht.core.PeerId;
import com.kaddht.rpc.proto.Message;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Answers PING by echoing the request.
 */
public class PingHandler {

    private static final Logger logger = LoggerFactory.getLogger(PingHandler.class);

    private final PeerId self;

    public PingHandler(PeerId self) {
        this.self = self;
    }

    public Message handlePing(PeerId from, Message request) {
        logger.debug("{} Responding to ping from {}", self, from);
        return request;
    }
}
