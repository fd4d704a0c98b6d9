package com.kaddht.handler;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class StripedLocksTest {

    @Test
    @DisplayName("Stripe is the unsigned trailing byte, or zero for an empty key")
    void testStripeIndex() {
        assertThat(StripedLocks.stripeIndex(new byte[0])).isZero();
        assertThat(StripedLocks.stripeIndex(new byte[]{1, 2, 3})).isEqualTo(3);
        assertThat(StripedLocks.stripeIndex(new byte[]{(byte) 0xff})).isEqualTo(255);
        assertThat(StripedLocks.stripeIndex(new byte[]{(byte) 0x80})).isEqualTo(128);
    }

    @Test
    @DisplayName("Keys sharing a trailing byte share a lock")
    void testSharedStripe() {
        StripedLocks locks = new StripedLocks();

        assertThat(locks.lockFor("/v/a".getBytes())).isSameAs(locks.lockFor("/v/xa".getBytes()));
        assertThat(locks.lockFor("/v/a".getBytes())).isNotSameAs(locks.lockFor("/v/b".getBytes()));
        assertThat(locks.lockFor(new byte[0])).isSameAs(locks.lockFor(new byte[]{0}));
    }
}
