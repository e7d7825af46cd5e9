package com.tony.propsAnalytics.service;

import com.tony.propsAnalytics.cache.CacheKey;
import com.tony.propsAnalytics.cache.CachedResult;
import com.tony.propsAnalytics.cache.StatCache;
import com.tony.propsAnalytics.config.CacheProperties;
import com.tony.propsAnalytics.source.StatSource;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * Accès aux stats récentes d'un joueur, toujours via le cache TTL.
 */
@Service
@RequiredArgsConstructor
public class PlayerStatsService {

    private final StatCache statCache;
    private final StatSource statSource;
    private final CacheProperties cacheProperties;

    public CachedResult getRecentValues(String playerId, String statType, int lookback) {
        return getRecentValues(playerId, statType, lookback, false);
    }

    public CachedResult getRecentValues(String playerId, String statType, int lookback, boolean forceRefresh) {
        CacheKey key = new CacheKey(playerId, statType, lookback);
        return statCache.get(key, cacheProperties.getTtl(),
                () -> statSource.fetch(key.playerId(), key.statType(), lookback), forceRefresh);
    }

    public int purgeExpired() {
        return statCache.purgeExpired(cacheProperties.getMaxRetention());
    }
}
