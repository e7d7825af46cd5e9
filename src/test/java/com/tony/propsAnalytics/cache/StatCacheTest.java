package com.tony.propsAnalytics.cache;

import com.tony.propsAnalytics.exception.CacheMissException;
import com.tony.propsAnalytics.exception.StatSourceException;
import com.tony.propsAnalytics.exception.UpstreamUnavailableException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StatCacheTest {

    private static final Duration TTL = Duration.ofHours(1);
    private static final CacheKey KEY = new CacheKey("lebron", "PTS", 10);

    private MutableClock clock;
    private InMemoryCacheStore store;
    private StatCache cache;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-01-15T09:00:00Z"));
        store = new InMemoryCacheStore();
        cache = new StatCache(store, clock);
    }

    @Test
    @DisplayName("Entrée fraîche : servie sans nouvel appel amont")
    void shouldServeFreshEntryWithoutFetching() {
        AtomicInteger calls = new AtomicInteger();
        Supplier<List<Double>> fetcher = () -> {
            calls.incrementAndGet();
            return List.of(28.0, 31.0);
        };

        CachedResult first = cache.get(KEY, TTL, fetcher);
        clock.advance(Duration.ofMinutes(59));
        CachedResult second = cache.get(KEY, TTL, fetcher);

        assertThat(calls).hasValue(1);
        assertThat(second.payload()).isEqualTo(first.payload());
        assertThat(second.stale()).isFalse();
    }

    @Test
    @DisplayName("TTL dépassé : nouvel appel amont")
    void shouldRefetchOnceTtlElapsed() {
        AtomicInteger calls = new AtomicInteger();
        Supplier<List<Double>> fetcher = () -> List.of((double) calls.incrementAndGet());

        cache.get(KEY, TTL, fetcher);
        clock.advance(TTL);
        CachedResult result = cache.get(KEY, TTL, fetcher);

        assertThat(calls).hasValue(2);
        assertThat(result.payload()).containsExactly(2.0);
    }

    @Test
    @DisplayName("Source en échec avec une vieille entrée : on sert la valeur stale")
    void shouldFallBackToStaleEntry() {
        cache.get(KEY, TTL, () -> List.of(28.0, 31.0));
        clock.advance(Duration.ofHours(2));

        CachedResult result = cache.get(KEY, TTL, () -> {
            throw new StatSourceException(StatSourceException.Reason.RATE_LIMITED, "429");
        });

        assertThat(result.stale()).isTrue();
        assertThat(result.payload()).containsExactly(28.0, 31.0);
        assertThat(result.fetchedAt()).isEqualTo(Instant.parse("2024-01-15T09:00:00Z"));
    }

    @Test
    @DisplayName("Source en échec sans entrée : CacheMissException")
    void shouldThrowCacheMissWhenNothingCached() {
        assertThatThrownBy(() -> cache.get(KEY, TTL, () -> {
            throw new StatSourceException(StatSourceException.Reason.UNAVAILABLE, "timeout");
        }))
                .isInstanceOf(UpstreamUnavailableException.class)
                .isInstanceOf(CacheMissException.class)
                .satisfies(e -> assertThat(((UpstreamUnavailableException) e).getReason())
                        .isEqualTo(StatSourceException.Reason.UNAVAILABLE));

        assertThatThrownBy(() -> cache.get(KEY, TTL, () -> {
            throw new IllegalStateException("boom");
        }))
                .isInstanceOf(CacheMissException.class)
                .isNotInstanceOf(UpstreamUnavailableException.class);
    }

    @Test
    @DisplayName("Réponse vide de la source : traitée comme un échec")
    void shouldTreatNullPayloadAsFailure() {
        assertThatThrownBy(() -> cache.get(KEY, TTL, () -> null))
                .isInstanceOf(CacheMissException.class);
        assertThat(cache.size()).isZero();
    }

    @Test
    @DisplayName("forceRefresh : rappelle la source même si l'entrée est fraîche")
    void forceRefreshShouldBypassFreshness() {
        AtomicInteger calls = new AtomicInteger();
        Supplier<List<Double>> fetcher = () -> List.of((double) calls.incrementAndGet());

        cache.get(KEY, TTL, fetcher);
        CachedResult refreshed = cache.get(KEY, TTL, fetcher, true);

        assertThat(calls).hasValue(2);
        assertThat(refreshed.payload()).containsExactly(2.0);
    }

    @Test
    @DisplayName("Appels concurrents sur une clé froide : un seul fetch")
    void concurrentMissesShouldTriggerSingleFetch() throws Exception {
        int threads = 10;
        AtomicInteger calls = new AtomicInteger();
        CountDownLatch fetchStarted = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        Supplier<List<Double>> slowFetcher = () -> {
            calls.incrementAndGet();
            fetchStarted.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return List.of(25.0, 27.0);
        };

        ExecutorService executor = Executors.newFixedThreadPool(threads);
        try {
            List<Future<CachedResult>> results = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                results.add(executor.submit(() -> cache.get(KEY, TTL, slowFetcher)));
            }
            assertThat(fetchStarted.await(5, TimeUnit.SECONDS)).isTrue();
            Thread.sleep(100);
            release.countDown();

            for (Future<CachedResult> result : results) {
                assertThat(result.get(5, TimeUnit.SECONDS).payload()).containsExactly(25.0, 27.0);
            }
        } finally {
            executor.shutdownNow();
        }
        assertThat(calls).hasValue(1);
    }

    @Test
    @DisplayName("Un fetch lent sur une clé ne bloque pas une autre clé")
    void slowKeyShouldNotBlockOtherKeys() throws Exception {
        CountDownLatch fetchStarted = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);

        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<CachedResult> slow = executor.submit(() -> cache.get(KEY, TTL, () -> {
                fetchStarted.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return List.of(1.0);
            }));
            assertThat(fetchStarted.await(5, TimeUnit.SECONDS)).isTrue();

            CachedResult other = cache.get(new CacheKey("curry", "3PM", 10), TTL, () -> List.of(5.0, 4.0));
            assertThat(other.payload()).containsExactly(5.0, 4.0);
            assertThat(slow.isDone()).isFalse();

            release.countDown();
            assertThat(slow.get(5, TimeUnit.SECONDS).payload()).containsExactly(1.0);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("Les appelants en attente d'un fetch en échec reçoivent aussi le fallback")
    void waitersShouldShareFailureFallback() throws Exception {
        cache.get(KEY, TTL, () -> List.of(20.0));
        clock.advance(Duration.ofHours(2));

        CountDownLatch fetchStarted = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger calls = new AtomicInteger();
        Supplier<List<Double>> failing = () -> {
            calls.incrementAndGet();
            fetchStarted.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            throw new StatSourceException(StatSourceException.Reason.UNAVAILABLE, "down");
        };

        ExecutorService executor = Executors.newFixedThreadPool(3);
        try {
            List<Future<CachedResult>> results = new ArrayList<>();
            for (int i = 0; i < 3; i++) {
                results.add(executor.submit(() -> cache.get(KEY, TTL, failing)));
            }
            assertThat(fetchStarted.await(5, TimeUnit.SECONDS)).isTrue();
            Thread.sleep(100);
            release.countDown();

            for (Future<CachedResult> result : results) {
                CachedResult r = result.get(5, TimeUnit.SECONDS);
                assertThat(r.stale()).isTrue();
                assertThat(r.payload()).containsExactly(20.0);
            }
        } finally {
            executor.shutdownNow();
        }
        assertThat(calls).hasValue(1);
    }

    @Test
    @DisplayName("Purge : supprime les entrées plus vieilles que la rétention")
    void purgeShouldRemoveOnlyExpiredEntries() {
        cache.get(KEY, TTL, () -> List.of(1.0));
        clock.advance(Duration.ofDays(8));
        CacheKey recent = new CacheKey("curry", "PTS", 10);
        cache.get(recent, TTL, () -> List.of(2.0));

        int purged = cache.purgeExpired(Duration.ofDays(7));

        assertThat(purged).isEqualTo(1);
        assertThat(store.get(KEY)).isEmpty();
        assertThat(store.get(recent)).isPresent();
    }
}
