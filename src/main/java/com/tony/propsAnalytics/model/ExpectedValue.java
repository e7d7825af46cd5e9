package com.tony.propsAnalytics.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Espérance d'un pari simple à une cote donnée. Montants pour la mise indiquée, pourcentages en points.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ExpectedValue {
    private int americanOdds;
    private double stake;

    private double ev;
    private double evPercentage;
    private double marketEdge;          // proba estimée - proba implicite
    private double impliedProbability;
    private double kellyFraction;       // % de bankroll, plafonné à 25
    private double payout;              // gain net si gagnant
    private boolean positiveEv;
}
