package com.kaddht.routing;

import com.kaddht.core.PeerId;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;

class XorRoutingTableTest {

    private final PeerId self = PeerId.of("self");
    private XorRoutingTable table;

    @BeforeEach
    void setUp() {
        table = new XorRoutingTable(self, 8);
        IntStream.rangeClosed(1, 5).forEach(i -> table.update(PeerId.of("peer-" + i)));
    }

    @Test
    @DisplayName("The local node is never added")
    void testRejectsSelf() {
        assertThat(table.update(self)).isFalse();
        assertThat(table.contains(self)).isFalse();
    }

    @Test
    @DisplayName("A peer's own id is the closest key to it")
    void testClosestIsExactMatch() {
        PeerId target = PeerId.of("peer-3");

        List<PeerId> closer = table.closerPeers(target.toByteArray(), self, 3);

        assertThat(closer).hasSize(3).first().isEqualTo(target);
    }

    @Test
    @DisplayName("Results are ordered by XOR distance and exclude the given peer")
    void testOrderingAndExclusion() {
        byte[] key = "some-key".getBytes();
        byte[] target = XorRoutingTable.keyspaceId(key);

        List<PeerId> closer = table.closerPeers(key, PeerId.of("peer-2"), 10);

        assertThat(closer).hasSize(4).doesNotContain(PeerId.of("peer-2"));
        for (int i = 1; i < closer.size(); i++) {
            byte[] previous = XorRoutingTable.keyspaceId(closer.get(i - 1).toByteArray());
            byte[] current = XorRoutingTable.keyspaceId(closer.get(i).toByteArray());
            assertThat(XorRoutingTable.compareDistance(previous, current, target)).isLessThanOrEqualTo(0);
        }
    }

    @Test
    @DisplayName("A full table evicts the peer seen least recently")
    void testCapacityEvictsLeastRecentlySeen() {
        IntStream.rangeClosed(6, 8).forEach(i -> table.update(PeerId.of("peer-" + i)));
        assertThat(table.size()).isEqualTo(8);

        // peer-1 is seen again, so peer-2 is now the oldest
        assertThat(table.update(PeerId.of("peer-1"))).isTrue();
        assertThat(table.update(PeerId.of("peer-9"))).isTrue();

        assertThat(table.size()).isEqualTo(8);
        assertThat(table.contains(PeerId.of("peer-9"))).isTrue();
        assertThat(table.contains(PeerId.of("peer-1"))).isTrue();
        assertThat(table.contains(PeerId.of("peer-2"))).isFalse();
    }

    @Test
    @DisplayName("A stream of new peers never locks out later ones")
    void testManyNewPeers() {
        IntStream.rangeClosed(100, 2000).forEach(i -> table.update(PeerId.of("peer-" + i)));

        assertThat(table.size()).isEqualTo(8);
        assertThat(table.contains(PeerId.of("peer-2000"))).isTrue();
        assertThat(table.contains(PeerId.of("peer-1"))).isFalse();
    }

    @Test
    @DisplayName("Removed peers are forgotten")
    void testRemove() {
        table.remove(PeerId.of("peer-1"));

        assertThat(table.contains(PeerId.of("peer-1"))).isFalse();
        assertThat(table.size()).isEqualTo(4);
    }
}
