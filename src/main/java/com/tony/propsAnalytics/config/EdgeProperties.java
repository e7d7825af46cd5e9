package com.tony.propsAnalytics.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "edge")
@Data
public class EdgeProperties {
    // --- Moyenne glissante ---
    private int minObservations = 5;
    private int window = 5;

    // --- Seuil d'edge (écart moyenne / ligne) ---
    private double threshold = 2.0;

    // Plancher d'écart-type : évite une proba infinie sur un échantillon constant
    private double minStdDev = 0.5;

    // --- Séries (streaks) ---
    private int streakLookback = 10;
    private int minStreak = 2;

    // --- Analytics EV ---
    // Cote américaine supposée quand le marché n'en donne pas
    private int defaultOdds = -110;
}
