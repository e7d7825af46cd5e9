package com.tony.propsAnalytics.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ConfidenceAssessment {
    private double score;   // 0-100
    private ConfidenceGrade grade;

    private RiskTier riskTier;
    private double riskFactors;

    private double suggestedStakePct;   // % de bankroll
    private double units;               // 1 unité = 1% de bankroll
    private String stakeLabel;

    // Détail du score
    private double probabilityContribution;
    private double evContribution;
    private double edgeContribution;
    private double streakContribution;
}
