package com.tony.propsAnalytics.cache;

import java.util.Locale;

/**
 * Clé du cache de stats : (joueur, type de stat, fenêtre de matchs).
 */
public record CacheKey(String playerId, String statType, int window) {

    public CacheKey {
        if (playerId == null || playerId.isBlank()) {
            throw new IllegalArgumentException("playerId est requis");
        }
        if (statType == null || statType.isBlank()) {
            throw new IllegalArgumentException("statType est requis");
        }
        if (window <= 0) {
            throw new IllegalArgumentException("window doit être > 0");
        }
        playerId = playerId.trim();
        statType = statType.trim().toUpperCase(Locale.ROOT);
    }

    public String asString() {
        return playerId + "_" + statType + "_" + window;
    }

    @Override
    public String toString() {
        return asString();
    }
}
