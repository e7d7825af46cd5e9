package com.tony.propsAnalytics.model;

import java.time.Instant;

/**
 * Une ligne affichée à un instant donné. Une nouvelle ligne pour la même prop est une nouvelle instance.
 */
public record Line(String playerId, String statType, double value, Instant timestamp) {

    public LineKey key() {
        return LineKey.of(playerId, statType);
    }
}
