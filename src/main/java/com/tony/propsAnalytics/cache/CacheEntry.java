package com.tony.propsAnalytics.cache;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;
import java.util.List;

/**
 * Entrée de cache. fetchedAt en secondes epoch, ttl en secondes.
 */
public record CacheEntry(CacheKey key, List<Double> payload, long fetchedAt, long ttl) {

    public CacheEntry {
        payload = List.copyOf(payload);
    }

    /** Fraîche ssi now - fetchedAt < ttl. */
    public boolean isFresh(Instant now) {
        return ageSeconds(now) < ttl;
    }

    public long ageSeconds(Instant now) {
        return now.getEpochSecond() - fetchedAt;
    }

    @JsonIgnore
    public Instant fetchedInstant() {
        return Instant.ofEpochSecond(fetchedAt);
    }
}
