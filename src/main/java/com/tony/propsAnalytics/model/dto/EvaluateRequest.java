package com.tony.propsAnalytics.model.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;

import java.util.List;

@Data
public class EvaluateRequest {
    private String playerId;
    private String statType;

    // Du match le plus récent au plus ancien
    @NotNull
    private List<Double> observations;

    @NotNull
    private Double line;

    @PositiveOrZero
    private Double threshold;
}
