package com.tony.propsAnalytics.cache;

import java.util.Optional;
import java.util.function.Predicate;

/**
 * Stockage des entrées du cache de stats. Une lecture voit l'entrée entière ou rien.
 */
public interface CacheStore {

    Optional<CacheEntry> get(CacheKey key);

    void put(CacheEntry entry);

    /**
     * Supprime les entrées qui vérifient le prédicat.
     * @return nombre d'entrées supprimées
     */
    int removeIf(Predicate<CacheEntry> predicate);

    int size();
}
