package com.tony.propsAnalytics.model.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
public class EdgeScanRequest {
    @NotBlank(message = "Le type de stat est requis")
    private String statType;

    @PositiveOrZero
    private Double threshold;

    // Joueur -> ligne affichée
    @NotEmpty(message = "Au moins une ligne est requise")
    private Map<String, Double> lines = new LinkedHashMap<>();

    // Propose aussi des parlays à partir des edges trouvés
    private boolean withParlays;
}
