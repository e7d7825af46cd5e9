package com.tony.propsAnalytics.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ParlayRecommendation {
    private List<ParlayLeg> legs;
    private ParlayResult result;
    private double score; // EV + 10 x edge
}
