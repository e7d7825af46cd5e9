package com.tony.propsAnalytics.model;

import java.util.Locale;

/**
 * Identifie une prop suivie : (joueur, type de stat). Le type de stat est normalisé en majuscules.
 */
public record LineKey(String playerId, String statType) {

    public LineKey {
        if (playerId == null || playerId.isBlank()) {
            throw new IllegalArgumentException("playerId est requis");
        }
        if (statType == null || statType.isBlank()) {
            throw new IllegalArgumentException("statType est requis");
        }
        playerId = playerId.trim();
        statType = statType.trim().toUpperCase(Locale.ROOT);
    }

    public static LineKey of(String playerId, String statType) {
        return new LineKey(playerId, statType);
    }
}
