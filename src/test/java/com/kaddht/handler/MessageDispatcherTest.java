package com.kaddht.handler;

import com.google.protobuf.ByteString;
import com.kaddht.core.PeerId;
import com.kaddht.rpc.proto.Message;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class MessageDispatcherTest {

    private final PeerId self = PeerId.of("self");
    private final PeerId requester = PeerId.of("requester");

    private DhtContext context;
    private MessageDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        context = DhtContext.builder(self).build();
        dispatcher = MessageDispatcher.create(context);
    }

    @AfterEach
    void tearDown() {
        context.close();
    }

    @Test
    @DisplayName("Every known message type has a handler")
    void testAllTypesRouted() {
        for (Message.MessageType type : Message.MessageType.values()) {
            if (type == Message.MessageType.UNRECOGNIZED) {
                continue;
            }
            assertThat(dispatcher.handlerFor(type)).as("handler for %s", type).isPresent();
        }
    }

    @Test
    @DisplayName("Unrecognized message types have no handler")
    void testUnrecognized() {
        Message unknown = Message.newBuilder().setTypeValue(42).build();

        assertThat(unknown.getType()).isEqualTo(Message.MessageType.UNRECOGNIZED);
        assertThat(dispatcher.handlerFor(unknown.getType())).isEmpty();
    }

    @Test
    @DisplayName("PING is answered with the request itself")
    void testPing() {
        Message ping = Message.newBuilder()
                .setType(Message.MessageType.PING)
                .setClusterLevelRaw(2)
                .build();

        Message response = dispatcher.handlerFor(Message.MessageType.PING).orElseThrow().handle(requester, ping);

        assertThat(response).isEqualTo(ping);
    }

    @Test
    @DisplayName("Dispatch reaches the value store")
    void testDispatchGetValue() {
        Message get = Message.newBuilder()
                .setType(Message.MessageType.GET_VALUE)
                .setKey(ByteString.copyFromUtf8("/pk/none"))
                .build();

        Message response = dispatcher.handlerFor(Message.MessageType.GET_VALUE).orElseThrow().handle(requester, get);

        assertThat(response.getType()).isEqualTo(Message.MessageType.GET_VALUE);
        assertThat(response.hasRecord()).isFalse();
    }
}
