package com.tony.propsAnalytics.service;

import com.tony.propsAnalytics.config.EdgeProperties;
import com.tony.propsAnalytics.exception.InsufficientDataException;
import com.tony.propsAnalytics.model.EdgeResult;
import com.tony.propsAnalytics.model.Pick;
import lombok.RequiredArgsConstructor;
import org.apache.commons.math3.distribution.TDistribution;
import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Moteur d'edge : moyenne glissante vs ligne -> pick, probabilité et détection d'edge.
 * Fonction pure de ses entrées, sans état partagé.
 */
@Service
@RequiredArgsConstructor
public class EdgeEngine {

    private static final double MIN_PROBABILITY = 50.0;
    // On ne promet jamais 100% : marge pour l'incertitude d'échantillon
    private static final double MAX_PROBABILITY = 99.0;

    private final EdgeProperties properties;

    public EdgeResult evaluate(List<Double> observations, double line) {
        return evaluate(null, null, observations, line, properties.getThreshold());
    }

    public EdgeResult evaluate(List<Double> observations, double line, double threshold) {
        return evaluate(null, null, observations, line, threshold);
    }

    /**
     * Le pick, la probabilité et le test d'edge utilisent la moyenne et l'écart exacts ; les valeurs
     * reportées sont arrondies à 2 décimales. Une moyenne de 24.004 sur une ligne à 24.0 est donc
     * affichée 24.0 avec un pick OVER.
     *
     * @param observations valeurs par match, la plus récente en premier
     * @throws InsufficientDataException moins de {@code minObservations} matchs
     */
    public EdgeResult evaluate(String playerId, String statType, List<Double> observations, double line, double threshold) {
        int available = observations == null ? 0 : observations.size();
        if (available < properties.getMinObservations()) {
            throw new InsufficientDataException(available, properties.getMinObservations());
        }
        if (threshold < 0 || Double.isNaN(threshold)) {
            throw new IllegalArgumentException("Le seuil d'edge doit être positif : " + threshold);
        }
        if (Double.isNaN(line) || Double.isInfinite(line)) {
            throw new IllegalArgumentException("Ligne invalide : " + line);
        }

        // Fenêtre : les N plus récents (tous si moins de N mais au-dessus du minimum)
        int n = Math.min(properties.getWindow(), available);
        double[] sample = new double[n];
        for (int i = 0; i < n; i++) {
            Double v = observations.get(i);
            if (v == null || v < 0 || Double.isNaN(v) || Double.isInfinite(v)) {
                throw new IllegalArgumentException("Valeur de match invalide à l'index " + i + " : " + v);
            }
            sample[i] = v;
        }

        double average = StatUtils.mean(sample);
        double stdDev = new StandardDeviation().evaluate(sample);
        double gap = Math.abs(average - line);

        // Égalité stricte -> UNDER (départage déterministe)
        Pick pick = average > line ? Pick.OVER : Pick.UNDER;

        return EdgeResult.builder()
                .playerId(playerId)
                .statType(statType)
                .lineValue(line)
                .rollingAverage(round(average))
                .pick(pick)
                .probability(probability(gap, stdDev, n))
                .edge(gap >= threshold)
                .gap(round(gap))
                .sampleSize(n)
                .stdDev(round(stdDev))
                .build();
    }

    /**
     * Probabilité (en %) que le prochain match tombe du côté du pick.
     * z = écart / (sd * sqrt(1 + 1/n)), puis CDF d'une loi de Student à n-1 ddl, bornée à [50, 99].
     * Croissante avec l'écart à variance fixée ; écart nul -> 50.
     */
    double probability(double gap, double stdDev, int sampleSize) {
        double spread = Math.max(stdDev, properties.getMinStdDev()) * Math.sqrt(1.0 + 1.0 / sampleSize);
        double z = gap / spread;
        TDistribution student = new TDistribution(null, Math.max(1, sampleSize - 1));
        double p = student.cumulativeProbability(z) * 100.0;
        return round(Math.max(MIN_PROBABILITY, Math.min(MAX_PROBABILITY, p)));
    }

    private double round(double val) { return Math.round(val * 100.0) / 100.0; }
}
