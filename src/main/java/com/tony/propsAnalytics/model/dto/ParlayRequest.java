package com.tony.propsAnalytics.model.dto;

import com.tony.propsAnalytics.model.ParlayLeg;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class ParlayRequest {
    private List<ParlayLeg> legs = new ArrayList<>();

    // Cote américaine du parlay complet proposée par le book (optionnelle)
    private Integer marketAmericanOdds;
}
