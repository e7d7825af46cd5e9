package com.tony.propsAnalytics.model.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.time.Instant;

@Data
public class LineRequest {
    @NotBlank
    private String playerId;
    @NotBlank
    private String statType;
    @NotNull
    private Double value;

    // Optionnel : maintenant si absent
    private Instant timestamp;
}
