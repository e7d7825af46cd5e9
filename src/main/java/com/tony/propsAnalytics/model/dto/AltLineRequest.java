package com.tony.propsAnalytics.model.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class AltLineRequest {
    @NotBlank
    private String playerId;
    @NotBlank
    private String statType;
    @NotNull
    private Double mainLine;
    @NotNull
    private Double altLine;
    private String source;
}
