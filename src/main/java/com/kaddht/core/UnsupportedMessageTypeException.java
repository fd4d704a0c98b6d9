package com.kaddht.core;

import com.kaddht.rpc.proto.Message;

/**
 * Thrown by the node when dispatch yields no handler for a message type.
 */
public class UnsupportedMessageTypeException extends DhtException {

    private final Message.MessageType type;

    public UnsupportedMessageTypeException(Message.MessageType type) {
        super("Unsupported message type: " + type);
        this.type = type;
    }

    public Message.MessageType getType() {
        return type;
    }
}
