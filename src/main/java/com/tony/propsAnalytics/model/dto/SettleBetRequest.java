package com.tony.propsAnalytics.model.dto;

import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class SettleBetRequest {
    @NotNull(message = "La stat réelle est requise")
    private Double actualStat;

    private Integer closingOdds;
}
