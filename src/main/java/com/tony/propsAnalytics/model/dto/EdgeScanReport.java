package com.tony.propsAnalytics.model.dto;

import com.tony.propsAnalytics.model.EdgeResult;
import com.tony.propsAnalytics.model.PropEvaluation;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class EdgeScanReport {
    private String statType;
    private double threshold;
    private Instant scannedAt;

    private List<PropEvaluation> evaluations;
    private List<PropEvaluation> edges;   // triés par proba décroissante
    private List<PropEvaluation> streaks; // séries actives qui ne sont pas des edges

    public List<EdgeResult> edgeResults() {
        return edges.stream().map(PropEvaluation::getEdgeResult).toList();
    }
}
