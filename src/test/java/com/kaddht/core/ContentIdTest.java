package com.kaddht.core;

import com.google.common.hash.Hashing;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ContentIdTest {

    private static byte[] v0(String content) {
        byte[] digest = Hashing.sha256().hashString(content, StandardCharsets.UTF_8).asBytes();
        byte[] bytes = new byte[34];
        bytes[0] = 0x12;
        bytes[1] = 0x20;
        System.arraycopy(digest, 0, bytes, 2, 32);
        return bytes;
    }

    @Test
    @DisplayName("Bare sha2-256 multihash parses as version 0")
    void testVersionZero() {
        ContentId cid = ContentId.cast(v0("hello"));

        assertThat(cid.getVersion()).isZero();
        assertThat(cid.getCodec()).isEqualTo(ContentId.DAG_PB);
        assertThat(cid.toBytes()).isEqualTo(v0("hello"));
        assertThat(cid.toString()).startsWith("Qm");
    }

    @Test
    @DisplayName("Version 1 identifiers survive a parse of their own bytes")
    void testVersionOne() {
        ContentId built = ContentId.forData(ContentId.RAW, "hello".getBytes(StandardCharsets.UTF_8));
        ContentId parsed = ContentId.cast(built.toBytes());

        assertThat(parsed).isEqualTo(built);
        assertThat(parsed.hashCode()).isEqualTo(built.hashCode());
        assertThat(parsed.getVersion()).isEqualTo(1);
        assertThat(parsed.getCodec()).isEqualTo(ContentId.RAW);
        assertThat(parsed.getMultihash()).hasSize(34).startsWith((byte) 0x12, (byte) 0x20);
        assertThat(parsed.toString()).startsWith("bafkrei");
    }

    @Test
    @DisplayName("Different content gives different identifiers")
    void testDistinctContent() {
        ContentId a = ContentId.forData(ContentId.RAW, new byte[]{1});
        ContentId b = ContentId.forData(ContentId.RAW, new byte[]{2});

        assertThat(a).isNotEqualTo(b);
    }

    @Test
    @DisplayName("Malformed identifiers are rejected as invalid requests")
    void testMalformed() {
        byte[] valid = ContentId.forData(ContentId.RAW, new byte[]{9}).toBytes();

        assertThatThrownBy(() -> ContentId.cast(new byte[0]))
                .isInstanceOf(InvalidRequestException.class);
        assertThatThrownBy(() -> ContentId.cast("not-a-cid".getBytes(StandardCharsets.UTF_8)))
                .isInstanceOf(InvalidRequestException.class);
        assertThatThrownBy(() -> ContentId.cast(Arrays.copyOf(valid, valid.length - 1)))
                .isInstanceOf(InvalidRequestException.class)
                .hasMessageContaining("does not match");
        assertThatThrownBy(() -> ContentId.cast(new byte[]{(byte) 0x80}))
                .isInstanceOf(InvalidRequestException.class);

        byte[] wrongVersion = valid.clone();
        wrongVersion[0] = 2;
        assertThatThrownBy(() -> ContentId.cast(wrongVersion))
                .isInstanceOf(InvalidRequestException.class)
                .hasMessageContaining("version");
    }

    @Test
    @DisplayName("Returned byte arrays are copies")
    void testDefensiveCopies() {
        ContentId cid = ContentId.forData(ContentId.RAW, new byte[]{1, 2, 3});
        byte[] bytes = cid.toBytes();
        bytes[0] = 42;

        assertThat(cid.toBytes()[0]).isEqualTo((byte) 1);
    }
}
