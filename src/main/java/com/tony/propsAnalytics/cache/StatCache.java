package com.tony.propsAnalytics.cache;

import com.tony.propsAnalytics.exception.CacheMissException;
import com.tony.propsAnalytics.exception.StatSourceException;
import com.tony.propsAnalytics.exception.UpstreamUnavailableException;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Cache TTL devant la source de stats (lente, limitée en débit).
 * <ul>
 *     <li>entrée fraîche : servie sans appel amont ;</li>
 *     <li>sinon un seul fetch par clé à la fois (singleflight), les autres appelants attendent son résultat ;</li>
 *     <li>fetch en échec : on sert la dernière valeur connue (stale), sinon {@link CacheMissException}.</li>
 * </ul>
 * Aucun verrou global : deux clés différentes ne se bloquent jamais.
 */
@Slf4j
public class StatCache {

    private final CacheStore store;
    private final Clock clock;
    private final ConcurrentHashMap<CacheKey, CompletableFuture<CacheEntry>> inFlight = new ConcurrentHashMap<>();

    public StatCache(CacheStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    public CachedResult get(CacheKey key, Duration ttl, Supplier<List<Double>> fetcher) {
        return get(key, ttl, fetcher, false);
    }

    /**
     * @param forceRefresh ignore la fraîcheur de l'entrée (rafraîchissement planifié), garde le fallback stale
     */
    public CachedResult get(CacheKey key, Duration ttl, Supplier<List<Double>> fetcher, boolean forceRefresh) {
        if (!forceRefresh) {
            Optional<CacheEntry> cached = freshEntry(key);
            if (cached.isPresent()) {
                log.debug("Cache HIT {}", key);
                return CachedResult.of(cached.get(), false);
            }
        }

        CompletableFuture<CacheEntry> flight = new CompletableFuture<>();
        CompletableFuture<CacheEntry> existing = inFlight.putIfAbsent(key, flight);
        if (existing != null) {
            log.debug("Fetch déjà en cours pour {}, on attend son résultat", key);
            return await(key, existing);
        }

        try {
            CacheEntry entry = load(key, ttl, fetcher, forceRefresh);
            flight.complete(entry);
            return CachedResult.of(entry, false);
        } catch (RuntimeException e) {
            flight.completeExceptionally(e);
            return fallback(key, e);
        } finally {
            if (!flight.isDone()) {
                flight.completeExceptionally(new IllegalStateException("Fetch interrompu pour " + key));
            }
            inFlight.remove(key, flight);
        }
    }

    /**
     * Supprime les entrées plus vieilles que la rétention max.
     * @return nombre d'entrées purgées
     */
    public int purgeExpired(Duration maxRetention) {
        Instant now = clock.instant();
        int purged = store.removeIf(entry -> entry.ageSeconds(now) >= maxRetention.getSeconds());
        if (purged > 0) {
            log.info("🧹 Cache : {} entrée(s) purgée(s) (rétention {})", purged, maxRetention);
        }
        return purged;
    }

    public int size() {
        return store.size();
    }

    private CacheEntry load(CacheKey key, Duration ttl, Supplier<List<Double>> fetcher, boolean forceRefresh) {
        // Un autre appelant a pu remplir la clé entre notre lecture et la prise du vol
        if (!forceRefresh) {
            Optional<CacheEntry> cached = freshEntry(key);
            if (cached.isPresent()) return cached.get();
        }

        log.debug("Cache MISS {} : appel de la source", key);
        List<Double> payload = fetcher.get();
        if (payload == null) {
            throw new IllegalStateException("La source a renvoyé une réponse vide pour " + key);
        }
        CacheEntry entry = new CacheEntry(key, payload, clock.instant().getEpochSecond(), ttl.getSeconds());
        store.put(entry);
        return entry;
    }

    private CachedResult await(CacheKey key, CompletableFuture<CacheEntry> flight) {
        try {
            return CachedResult.of(flight.join(), false);
        } catch (CompletionException e) {
            return fallback(key, e.getCause() != null ? e.getCause() : e);
        }
    }

    private CachedResult fallback(CacheKey key, Throwable failure) {
        Optional<CacheEntry> previous = store.get(key);
        if (previous.isPresent()) {
            CacheEntry entry = previous.get();
            boolean stale = !entry.isFresh(clock.instant());
            log.warn("⚠️ Source indisponible pour {} ({}), on sert la dernière valeur connue (âge {}s)",
                    key, failure.getMessage(), entry.ageSeconds(clock.instant()));
            return CachedResult.of(entry, stale);
        }
        log.error("❌ Aucune donnée en cache pour {} et la source est en échec : {}", key, failure.getMessage());
        if (failure instanceof StatSourceException) {
            throw new UpstreamUnavailableException(key, (StatSourceException) failure);
        }
        throw new CacheMissException(key, failure);
    }

    private Optional<CacheEntry> freshEntry(CacheKey key) {
        Instant now = clock.instant();
        return store.get(key).filter(entry -> entry.isFresh(now));
    }
}
