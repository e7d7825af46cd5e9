package com.tony.propsAnalytics.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Edge enrichi : espérance à la cote de marché et note de confiance.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class EdgeAnalysis {
    private String playerId;
    private String statType;
    private double line;
    private Pick pick;
    private double probability;
    private double gap;
    private boolean edge;

    private StreakInfo streak;
    private ExpectedValue expectedValue;
    private ConfidenceAssessment confidence;
}
