package com.tony.propsAnalytics.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Filtres tactiques sur les edges analysés. Un critère null est ignoré.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AnalyticsFilter {
    private Double minProbability;
    private Double minEv;
    private Double minMarketEdge;
    private String minGrade;    // A+, A, B+ ...
    private boolean positiveEvOnly;
}
