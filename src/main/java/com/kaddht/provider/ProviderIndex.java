package com.kaddht.provider;

import com.kaddht.core.ContentId;
import com.kaddht.core.PeerId;

import java.util.List;

/**
 * Index from content identifiers to the peers that announced they provide them.
 *
 * <p>The index owns the expiry of its associations; callers only add and query.
 *
 * @see InMemoryProviderIndex
 */
public interface ProviderIndex {

    /**
     * Returns the providers currently known for a content identifier, in announcement order.
     *
     * @return the providers, possibly empty, never null
     */
    List<PeerId> getProviders(ContentId key);

    /**
     * Associates a provider with a content identifier, refreshing its expiry if it was already known.
     */
    void addProvider(ContentId key, PeerId provider);
}
