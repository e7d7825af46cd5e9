package com.tony.propsAnalytics.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Sortie du moteur d'edge. Jamais persistée : recalculée à chaque évaluation.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class EdgeResult {
    private String playerId;
    private String statType;

    private double lineValue;
    // Arrondie pour l'affichage ; le pick vient de la moyenne exacte
    private double rollingAverage;
    private Pick pick;

    // Probabilité que le pick passe, en % dans [50, 99]
    private double probability;
    private boolean edge;

    private double gap;         // |moyenne - ligne|
    private int sampleSize;     // nb de matchs utilisés pour la moyenne
    private double stdDev;      // écart-type de l'échantillon
}
