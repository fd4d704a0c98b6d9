package com.kaddht.config;

import com.kaddht.core.PeerId;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NodeConfigTest {

    @Test
    @DisplayName("Command line flags populate the config")
    void testFromArgs() {
        NodeConfig config = NodeConfig.fromArgs(new String[]{
                "--id=node-1",
                "--host=127.0.0.1",
                "--bind=127.0.0.1",
                "--port=4101",
                "--peers=node-2:localhost:4102,node-3:localhost:4103",
                "--max-record-age=PT2H",
                "--request-timeout-ms=750",
                "--closer-peer-count=8"
        });

        assertThat(config.getPeerId()).isEqualTo(PeerId.of("node-1"));
        assertThat(config.getAddress()).isEqualTo("127.0.0.1:4101");
        assertThat(config.getBindHost()).isEqualTo("127.0.0.1");
        assertThat(config.getPeers()).containsExactly(PeerId.of("node-2"), PeerId.of("node-3"));
        assertThat(config.getPeerAddresses()).containsEntry(PeerId.of("node-3"), "localhost:4103");
        assertThat(config.getSettings().getMaxRecordAge()).isEqualTo(Duration.ofHours(2));
        assertThat(config.getSettings().getRequestTimeout()).isEqualTo(Duration.ofMillis(750));
        assertThat(config.getSettings().getCloserPeerCount()).isEqualTo(8);
    }

    @Test
    @DisplayName("Unset flags fall back to the defaults")
    void testDefaults() {
        NodeConfig config = NodeConfig.fromArgs(new String[]{"--id=solo"});

        assertThat(config.getBindHost()).isEqualTo("0.0.0.0");
        assertThat(config.getHost()).isNotEmpty().isNotEqualTo("0.0.0.0");
        assertThat(config.getPort()).isEqualTo(4001);
        assertThat(config.getPeers()).isEmpty();

        DhtSettings settings = config.getSettings();
        assertThat(settings.getMaxRecordAge()).isEqualTo(Duration.ofHours(36));
        assertThat(settings.getCloserPeerCount()).isEqualTo(20);
        assertThat(settings.getProviderAddrTtl()).isEqualTo(Duration.ofMinutes(30));
        assertThat(settings.getRecentlyConnectedAddrTtl()).isEqualTo(Duration.ofMinutes(10));
        assertThat(settings.getProvideValidity()).isEqualTo(Duration.ofHours(24));
        assertThat(settings.getRequestTimeout()).isEqualTo(Duration.ofSeconds(5));
    }

    @Test
    @DisplayName("A peer id is required")
    void testRequiresId() {
        assertThatThrownBy(() -> NodeConfig.fromArgs(new String[]{"--port=4001"}))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("A wildcard address is never advertised")
    void testWildcardHostRefused() {
        assertThatThrownBy(() -> NodeConfig.fromArgs(new String[]{"--id=node-1", "--host=0.0.0.0"}))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("wildcard");
        assertThatThrownBy(() -> NodeConfig.fromArgs(new String[]{"--id=node-1", "--host=::"}))
                .isInstanceOf(IllegalStateException.class);

        NodeConfig config = NodeConfig.fromArgs(new String[]{"--id=node-1", "--bind=0.0.0.0", "--port=4201"});
        assertThat(config.getAddress()).doesNotStartWith("0.0.0.0").endsWith(":4201");
    }

    @Test
    @DisplayName("Nonsensical settings are refused")
    void testSettingsValidation() {
        assertThatThrownBy(() -> DhtSettings.builder().closerPeerCount(0).build())
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> DhtSettings.builder().maxRecordAge(Duration.ZERO).build())
                .isInstanceOf(IllegalStateException.class);
    }
}
