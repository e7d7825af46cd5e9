package com.tony.propsAnalytics.source;

import com.tony.propsAnalytics.exception.StatSourceException;

import java.util.List;

/**
 * Source amont des stats par match.
 */
public interface StatSource {

    /**
     * Dernières valeurs d'un joueur pour un type de stat, du match le plus récent au plus ancien.
     *
     * @param lookback nombre de matchs demandés (la source peut en renvoyer moins)
     * @throws StatSourceException RATE_LIMITED, NOT_FOUND ou UNAVAILABLE
     */
    List<Double> fetch(String playerId, String statType, int lookback);
}
