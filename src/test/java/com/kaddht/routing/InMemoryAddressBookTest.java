package com.kaddht.routing;

import com.kaddht.MutableClock;
import com.kaddht.core.PeerId;
import com.kaddht.core.PeerInfo;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryAddressBookTest {

    private final PeerId alice = PeerId.of("alice");
    private final PeerId bob = PeerId.of("bob");

    private MutableClock clock;
    private InMemoryAddressBook book;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-01-01T00:00:00Z");
        book = new InMemoryAddressBook(clock);
    }

    @Test
    @DisplayName("Unknown peers resolve with no addresses, in request order")
    void testUnknownPeers() {
        book.addAddresses(alice, List.of("10.0.0.1:4001"), Duration.ofMinutes(10));

        List<PeerInfo> infos = book.peerInfos(List.of(bob, alice));

        assertThat(infos).extracting(PeerInfo::id).containsExactly(bob, alice);
        assertThat(infos.get(0).addresses()).isEmpty();
        assertThat(infos.get(1).addresses()).containsExactly("10.0.0.1:4001");
    }

    @Test
    @DisplayName("Addresses disappear once their TTL passes")
    void testExpiry() {
        book.addAddresses(alice, List.of("10.0.0.1:4001"), Duration.ofMinutes(10));
        book.addAddresses(alice, List.of("10.0.0.2:4001"), Duration.ofMinutes(30));

        clock.advance(Duration.ofMinutes(10));

        assertThat(book.peerInfo(alice).addresses()).containsExactly("10.0.0.2:4001");

        clock.advance(Duration.ofMinutes(20));

        assertThat(book.peerInfo(alice).hasAddresses()).isFalse();
    }

    @Test
    @DisplayName("Re-adding an address never shortens its expiry")
    void testKeepsLaterExpiry() {
        book.addAddresses(alice, List.of("10.0.0.1:4001"), Duration.ofMinutes(30));
        book.addAddresses(alice, List.of("10.0.0.1:4001"), Duration.ofMinutes(1));

        clock.advance(Duration.ofMinutes(5));

        assertThat(book.peerInfo(alice).addresses()).containsExactly("10.0.0.1:4001");
    }

    @Test
    @DisplayName("Permanent addresses never expire")
    void testPermanent() {
        book.addAddresses(alice, List.of("10.0.0.1:4001"), InMemoryAddressBook.PERMANENT_TTL);

        clock.advance(Duration.ofDays(3650));

        assertThat(book.peerInfo(alice).addresses()).containsExactly("10.0.0.1:4001");
    }
}
