package com.kaddht.provider;

import com.kaddht.MutableClock;
import com.kaddht.core.ContentId;
import com.kaddht.core.PeerId;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryProviderIndexTest {

    private final ContentId cid = ContentId.forData(ContentId.RAW, new byte[]{1, 2, 3});
    private final PeerId alice = PeerId.of("alice");
    private final PeerId bob = PeerId.of("bob");

    private MutableClock clock;
    private InMemoryProviderIndex index;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-01-01T00:00:00Z");
        index = new InMemoryProviderIndex(clock, Duration.ofHours(24), 16);
    }

    @Test
    @DisplayName("Providers are returned in announcement order without duplicates")
    void testProviders() {
        index.addProvider(cid, alice);
        index.addProvider(cid, bob);
        index.addProvider(cid, alice);

        assertThat(index.getProviders(cid)).containsExactly(alice, bob);
        assertThat(index.getProviders(ContentId.forData(ContentId.RAW, new byte[]{9}))).isEmpty();
    }

    @Test
    @DisplayName("Associations expire after the provide validity unless re-announced")
    void testExpiry() {
        index.addProvider(cid, alice);
        clock.advance(Duration.ofHours(12));
        index.addProvider(cid, bob);
        clock.advance(Duration.ofHours(12));

        assertThat(index.getProviders(cid)).containsExactly(bob);

        clock.advance(Duration.ofHours(12));

        assertThat(index.getProviders(cid)).isEmpty();
        assertThat(index.size()).isZero();
    }

    @Test
    @DisplayName("The number of tracked content ids is bounded")
    void testBounded() {
        for (int i = 0; i < 100; i++) {
            index.addProvider(ContentId.forData(ContentId.RAW, new byte[]{(byte) i}), alice);
        }

        assertThat(index.size()).isLessThanOrEqualTo(16);
    }
}
