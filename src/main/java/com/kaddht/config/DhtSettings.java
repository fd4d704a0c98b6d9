package com.kaddht.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Protocol constants used by the request handlers.
 *
 * <p>All values have defaults matching the public DHT network; tests usually
 * override {@link #getMaxRecordAge()} or {@link #getCloserPeerCount()}.
 */
public class DhtSettings {

    /** Records older than this are treated as absent and deleted when read. */
    public static final Duration DEFAULT_MAX_RECORD_AGE = Duration.ofHours(36);

    /** Number of closer peers returned with GET_VALUE, GET_PROVIDERS and FIND_NODE. */
    public static final int DEFAULT_CLOSER_PEER_COUNT = 20;

    /** How long addresses learned from ADD_PROVIDER stay in the address book. */
    public static final Duration DEFAULT_PROVIDER_ADDR_TTL = Duration.ofMinutes(30);

    /** How long addresses advertised by a requester stay in the address book. */
    public static final Duration DEFAULT_RECENTLY_CONNECTED_ADDR_TTL = Duration.ofMinutes(10);

    /** How long a provider association stays in the provider index. */
    public static final Duration DEFAULT_PROVIDE_VALIDITY = Duration.ofHours(24);

    /** Deadline applied by the transport to a single inbound request. */
    public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(5);

    private final Duration maxRecordAge;
    private final int closerPeerCount;
    private final Duration providerAddrTtl;
    private final Duration recentlyConnectedAddrTtl;
    private final Duration provideValidity;
    private final Duration requestTimeout;

    private DhtSettings(Builder builder) {
        this.maxRecordAge = builder.maxRecordAge;
        this.closerPeerCount = builder.closerPeerCount;
        this.providerAddrTtl = builder.providerAddrTtl;
        this.recentlyConnectedAddrTtl = builder.recentlyConnectedAddrTtl;
        this.provideValidity = builder.provideValidity;
        this.requestTimeout = builder.requestTimeout;
    }

    public static DhtSettings defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Duration getMaxRecordAge() {
        return maxRecordAge;
    }

    public int getCloserPeerCount() {
        return closerPeerCount;
    }

    public Duration getProviderAddrTtl() {
        return providerAddrTtl;
    }

    public Duration getRecentlyConnectedAddrTtl() {
        return recentlyConnectedAddrTtl;
    }

    public Duration getProvideValidity() {
        return provideValidity;
    }

    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    @Override
    public String toString() {
        return "DhtSettings{" +
                "maxRecordAge=" + maxRecordAge +
                ", closerPeerCount=" + closerPeerCount +
                ", providerAddrTtl=" + providerAddrTtl +
                ", recentlyConnectedAddrTtl=" + recentlyConnectedAddrTtl +
                ", provideValidity=" + provideValidity +
                ", requestTimeout=" + requestTimeout +
                '}';
    }

    public static class Builder {
        private Duration maxRecordAge = DEFAULT_MAX_RECORD_AGE;
        private int closerPeerCount = DEFAULT_CLOSER_PEER_COUNT;
        private Duration providerAddrTtl = DEFAULT_PROVIDER_ADDR_TTL;
        private Duration recentlyConnectedAddrTtl = DEFAULT_RECENTLY_CONNECTED_ADDR_TTL;
        private Duration provideValidity = DEFAULT_PROVIDE_VALIDITY;
        private Duration requestTimeout = DEFAULT_REQUEST_TIMEOUT;

        public Builder maxRecordAge(Duration maxRecordAge) {
            this.maxRecordAge = Objects.requireNonNull(maxRecordAge);
            return this;
        }

        public Builder closerPeerCount(int closerPeerCount) {
            this.closerPeerCount = closerPeerCount;
            return this;
        }

        public Builder providerAddrTtl(Duration providerAddrTtl) {
            this.providerAddrTtl = Objects.requireNonNull(providerAddrTtl);
            return this;
        }

        public Builder recentlyConnectedAddrTtl(Duration recentlyConnectedAddrTtl) {
            this.recentlyConnectedAddrTtl = Objects.requireNonNull(recentlyConnectedAddrTtl);
            return this;
        }

        public Builder provideValidity(Duration provideValidity) {
            this.provideValidity = Objects.requireNonNull(provideValidity);
            return this;
        }

        public Builder requestTimeout(Duration requestTimeout) {
            this.requestTimeout = Objects.requireNonNull(requestTimeout);
            return this;
        }

        public DhtSettings build() {
            if (closerPeerCount <= 0) {
                throw new IllegalStateException("closerPeerCount must be positive, got " + closerPeerCount);
            }
            if (maxRecordAge.isNegative() || maxRecordAge.isZero()) {
                throw new IllegalStateException("maxRecordAge must be positive, got " + maxRecordAge);
            }
            return new DhtSettings(this);
        }
    }
}
