package com.tony.propsAnalytics.model.dto;

import com.tony.propsAnalytics.model.Pick;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;

@Data
public class BetRequest {
    @NotBlank(message = "Le joueur est requis")
    private String playerId;

    @NotBlank(message = "Le type de stat est requis")
    private String statType;

    private double line;

    @NotNull(message = "Le pick (OVER/UNDER) est requis")
    private Pick pick;

    private int oddsPlaced = -110;

    @Positive(message = "La mise doit être positive")
    private double stake;

    private String platform;
    private String confidenceGrade;
    private Double confidenceScore;
}
