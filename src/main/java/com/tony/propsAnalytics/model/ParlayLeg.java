package com.tony.propsAnalytics.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ParlayLeg {
    private String label;

    // Probabilité du modèle en %, dans ]0, 100]
    private double probability;

    // Cote américaine proposée par le marché (optionnelle)
    private Integer americanOdds;

    public static ParlayLeg fromEdge(EdgeResult edge, Integer marketOdds) {
        return ParlayLeg.builder()
                .label(edge.getPlayerId() + " " + edge.getPick() + " " + edge.getLineValue() + " " + edge.getStatType())
                .probability(edge.getProbability())
                .americanOdds(marketOdds)
                .build();
    }
}
