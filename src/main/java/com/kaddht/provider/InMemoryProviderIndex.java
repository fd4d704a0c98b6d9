package com.kaddht.provider;

import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.kaddht.core.ContentId;
import com.kaddht.core.PeerId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Provider index held in memory.
 *
 * <p>Each association expires {@code provideValidity} after it was last announced.
 * The number of distinct content identifiers is bounded; the least recently used
 * ones are evicted first.
 */
public class InMemoryProviderIndex implements ProviderIndex {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryProviderIndex.class);

    public static final int DEFAULT_CACHE_SIZE = 256 * 1024;

    private final Clock clock;
    private final Duration provideValidity;

    // content id -> (provider -> expiry)
    private final Cache<ContentId, Map<PeerId, Instant>> providers;

    public InMemoryProviderIndex(Duration provideValidity) {
        this(Clock.systemUTC(), provideValidity, DEFAULT_CACHE_SIZE);
    }

    public InMemoryProviderIndex(Clock clock, Duration provideValidity, int cacheSize) {
        this.clock = clock;
        this.provideValidity = provideValidity;
        this.providers = CacheBuilder.newBuilder()
                .maximumSize(cacheSize)
                .build();
    }

    @Override
    public synchronized List<PeerId> getProviders(ContentId key) {
        Map<PeerId, Instant> entries = providers.getIfPresent(key);
        if (entries == null) {
            return List.of();
        }
        Instant now = clock.instant();
        entries.values().removeIf(expiry -> !expiry.isAfter(now));
        if (entries.isEmpty()) {
            providers.invalidate(key);
            return List.of();
        }
        return List.copyOf(entries.keySet());
    }

    @Override
    public synchronized void addProvider(ContentId key, PeerId provider) {
        Instant expiry = clock.instant().plus(provideValidity);
        providers.asMap()
                .computeIfAbsent(key, k -> new LinkedHashMap<>())
                .put(provider, expiry);
        logger.debug("Added provider {} for {} (expires {})", provider, key, expiry);
    }

    /**
     * Returns the number of content identifiers with at least one association.
     */
    public long size() {
        return providers.size();
    }
}
