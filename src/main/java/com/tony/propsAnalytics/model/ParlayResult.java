package com.tony.propsAnalytics.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Valorisation d'un parlay. Entièrement dérivée des sélections, jamais persistée.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ParlayResult {
    private int legs;

    private double combinedProbability;   // %
    private int americanOdds;             // cote "juste" (sans marge)
    private double decimalPayoutPerUnit;  // retour pour 100 misés
    private double expectedValue;         // pour 100 misés
    private double edgePercent;           // proba modèle - proba implicite du marché

    // Renseignés seulement si des cotes de marché ont été fournies
    private Integer marketAmericanOdds;
    private Double impliedProbability;
}
