package com.kaddht.rpc;

import com.google.protobuf.ByteString;
import com.kaddht.core.Connectedness;
import com.kaddht.core.PeerId;
import com.kaddht.core.PeerInfo;
import com.kaddht.rpc.proto.Message;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class MessageCodecTest {

    @Test
    @DisplayName("Cluster level travels as level plus one")
    void testClusterLevel() {
        Message.Builder response = MessageCodec.newResponse(Message.MessageType.PING, ByteString.EMPTY, 0);

        assertThat(response.getClusterLevelRaw()).isEqualTo(1);
        assertThat(MessageCodec.clusterLevel(response.build())).isZero();
        assertThat(MessageCodec.clusterLevel(Message.getDefaultInstance())).isZero();
        assertThat(MessageCodec.clusterLevel(Message.newBuilder().setClusterLevelRaw(5).build())).isEqualTo(4);
    }

    @Test
    @DisplayName("Responses echo type, key and level of the request")
    void testNewResponseEchoes() {
        Message request = Message.newBuilder()
                .setType(Message.MessageType.GET_PROVIDERS)
                .setKey(ByteString.copyFromUtf8("k"))
                .setClusterLevelRaw(3)
                .build();

        Message response = MessageCodec.newResponse(request).build();

        assertThat(response.getType()).isEqualTo(Message.MessageType.GET_PROVIDERS);
        assertThat(response.getKey()).isEqualTo(request.getKey());
        assertThat(response.getClusterLevelRaw()).isEqualTo(3);
    }

    @Test
    @DisplayName("Wire peers carry id, addresses and connectivity")
    void testToWirePeers() {
        PeerInfo a = PeerInfo.of(PeerId.of("a"), "10.0.0.1:4001", "10.0.0.2:4001");
        PeerInfo b = PeerInfo.of(PeerId.of("b"));

        List<Message.Peer> peers = MessageCodec.toWirePeers(List.of(a, b),
                peer -> peer.equals(PeerId.of("a")) ? Connectedness.CONNECTED : Connectedness.CANNOT_CONNECT);

        assertThat(peers).hasSize(2);
        assertThat(peers.get(0).getId().toStringUtf8()).isEqualTo("a");
        assertThat(peers.get(0).getAddrsCount()).isEqualTo(2);
        assertThat(peers.get(0).getConnection()).isEqualTo(Message.ConnectionType.CONNECTED);
        assertThat(peers.get(1).getAddrsList()).isEmpty();
        assertThat(peers.get(1).getConnection()).isEqualTo(Message.ConnectionType.CANNOT_CONNECT);
    }

    @Test
    @DisplayName("Wire peers without an id are skipped when reading")
    void testFromWirePeers() {
        Message.Peer good = Message.Peer.newBuilder()
                .setId(ByteString.copyFromUtf8("a"))
                .addAddrs(ByteString.copyFromUtf8("10.0.0.1:4001"))
                .addAddrs(ByteString.EMPTY)
                .build();
        Message.Peer anonymous = Message.Peer.newBuilder()
                .addAddrs(ByteString.copyFromUtf8("10.0.0.2:4001"))
                .build();

        List<PeerInfo> infos = MessageCodec.fromWirePeers(List.of(anonymous, good));

        assertThat(infos).containsExactly(PeerInfo.of(PeerId.of("a"), "10.0.0.1:4001"));
    }

    @Test
    @DisplayName("Connection types map both ways")
    void testConnectionTypes() {
        for (Connectedness c : Connectedness.values()) {
            assertThat(MessageCodec.fromConnectionType(MessageCodec.toConnectionType(c))).isEqualTo(c);
        }
        assertThat(MessageCodec.fromConnectionType(Message.ConnectionType.UNRECOGNIZED))
                .isEqualTo(Connectedness.NOT_CONNECTED);
    }
}
