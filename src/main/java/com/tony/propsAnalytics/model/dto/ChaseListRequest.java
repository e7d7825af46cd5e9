package com.tony.propsAnalytics.model.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class ChaseListRequest {
    @NotBlank
    private String playerId;
    @NotBlank
    private String statType;
    @NotNull
    private Double lineValue;
    private String reason;
}
