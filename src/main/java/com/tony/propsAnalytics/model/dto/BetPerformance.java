package com.tony.propsAnalytics.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BetPerformance {
    private int totalBets;
    private int settledBets;
    private int pendingBets;

    private int wins;
    private int losses;
    private int pushes;

    private double totalStake;   // paris réglés uniquement
    private double totalProfit;
    private double roiPct;
    private double winRate;      // % sur gagnés + perdus, pushes exclus

    private int avgOddsPlaced;
    private Integer avgOddsClosing; // null si aucune cote de fermeture

    // Closing Line Value moyenne, en points de proba implicite (positif = meilleure cote que la fermeture)
    private double clv;
}
