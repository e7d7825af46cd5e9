package com.tony.propsAnalytics.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum RiskTier {
    LOW(1.0, "Safe bet with strong fundamentals"),
    MEDIUM(0.7, "Reasonable risk with good upside"),
    HIGH(0.4, "Elevated risk - bet with caution");

    // Multiplicateur appliqué à la mise Kelly
    private final double stakeMultiplier;
    private final String description;

    public static RiskTier of(double riskFactors) {
        if (riskFactors <= 1) return LOW;
        if (riskFactors <= 3) return MEDIUM;
        return HIGH;
    }
}
