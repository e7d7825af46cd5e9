package com.tony.propsAnalytics.cache;

import java.time.Instant;
import java.util.List;

/**
 * Réponse du cache. stale = true : résultat dégradé mais utilisable (fetch amont en échec).
 */
public record CachedResult(List<Double> payload, boolean stale, Instant fetchedAt) {

    static CachedResult of(CacheEntry entry, boolean stale) {
        return new CachedResult(entry.payload(), stale, entry.fetchedInstant());
    }
}
