package com.tony.propsAnalytics.cache;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;

public class InMemoryCacheStore implements CacheStore {

    private final ConcurrentHashMap<CacheKey, CacheEntry> entries = new ConcurrentHashMap<>();

    @Override
    public Optional<CacheEntry> get(CacheKey key) {
        return Optional.ofNullable(entries.get(key));
    }

    @Override
    public void put(CacheEntry entry) {
        entries.put(entry.key(), entry);
    }

    @Override
    public int removeIf(Predicate<CacheEntry> predicate) {
        int removed = 0;
        for (Map.Entry<CacheKey, CacheEntry> e : entries.entrySet()) {
            // remove(k, v) : ne supprime pas une entrée remplacée entre-temps
            if (predicate.test(e.getValue()) && entries.remove(e.getKey(), e.getValue())) {
                removed++;
            }
        }
        return removed;
    }

    @Override
    public int size() {
        return entries.size();
    }
}
