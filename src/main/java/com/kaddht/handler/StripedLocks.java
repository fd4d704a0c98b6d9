package com.kaddht.handler;

import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Fixed set of 256 locks serializing writes per key stripe.
 *
 * <p>A key maps to the stripe given by its last byte (unsigned), or stripe 0 when
 * the key is empty. Writes to keys on different stripes never wait on each other.
 * Distinct keys sharing a last byte share a stripe and are serialized; each write
 * still compares against the record stored under its own key, so this only costs
 * throughput.
 *
 * <p>The array is allocated once and never resized.
 */
public final class StripedLocks {

    public static final int STRIPE_COUNT = 256;

    private final Lock[] locks = new Lock[STRIPE_COUNT];

    public StripedLocks() {
        for (int i = 0; i < STRIPE_COUNT; i++) {
            locks[i] = new ReentrantLock();
        }
    }

    public static int stripeIndex(byte[] key) {
        if (key.length == 0) {
            return 0;
        }
        return key[key.length - 1] & 0xff;
    }

    public Lock lockFor(byte[] key) {
        return locks[stripeIndex(key)];
    }
}
