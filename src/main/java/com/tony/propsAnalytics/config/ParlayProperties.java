package com.tony.propsAnalytics.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.LinkedHashMap;
import java.util.Map;

@Configuration
@ConfigurationProperties(prefix = "parlay")
@Data
public class ParlayProperties {
    // Seules les sélections à 70%+ entrent dans les recommandations
    private double minLegProbability = 70.0;

    // Cote standard d'une prop quand le marché n'est pas fourni
    private int defaultLegOdds = -110;

    // Taille max du vivier avant combinaisons (C(15,6) = 5005)
    private int maxCandidates = 15;

    // Taille du parlay -> nb de recommandations retournées
    private Map<Integer, Integer> sizes = new LinkedHashMap<>(Map.of(2, 5, 3, 5, 4, 5, 6, 3));
}
