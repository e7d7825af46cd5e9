package com.tony.propsAnalytics.exception;

import com.tony.propsAnalytics.cache.CacheKey;
import lombok.Getter;

/**
 * Aucune entrée (fraîche ou périmée) en cache et le fetch amont a échoué.
 */
@Getter
public class CacheMissException extends RuntimeException {

    private final CacheKey key;

    public CacheMissException(CacheKey key, Throwable cause) {
        super("Aucune donnée disponible pour " + key + " : " + (cause != null ? cause.getMessage() : "fetch en échec"), cause);
        this.key = key;
    }
}
