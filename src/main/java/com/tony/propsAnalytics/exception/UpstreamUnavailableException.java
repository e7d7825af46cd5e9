package com.tony.propsAnalytics.exception;

import com.tony.propsAnalytics.cache.CacheKey;

/**
 * Échec de la source de stats remonté par le cache, faute de donnée de secours.
 */
public class UpstreamUnavailableException extends CacheMissException {

    public UpstreamUnavailableException(CacheKey key, StatSourceException cause) {
        super(key, cause);
    }

    public StatSourceException.Reason getReason() {
        return ((StatSourceException) getCause()).getReason();
    }
}
