package com.tony.propsAnalytics.model;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;
import java.util.Optional;

/**
 * Note de confiance, de la meilleure à la pire (l'ordre de déclaration sert au tri).
 */
@Getter
@RequiredArgsConstructor
public enum ConfidenceGrade {
    A_PLUS("A+", 95, "Elite Lock"),
    A("A", 90, "Strong Play"),
    A_MINUS("A-", 85, "Very Good"),
    B_PLUS("B+", 80, "Good Value"),
    B("B", 75, "Solid"),
    B_MINUS("B-", 70, "Above Average"),
    C_PLUS("C+", 65, "Moderate"),
    C("C", 60, "Average"),
    C_MINUS("C-", 55, "Below Average"),
    D("D", 50, "Risky"),
    F("F", 0, "Avoid");

    @JsonValue
    private final String label;
    private final double minScore;
    private final String description;

    public static ConfidenceGrade of(double score) {
        for (ConfidenceGrade grade : values()) {
            if (score >= grade.minScore) return grade;
        }
        return F;
    }

    public static Optional<ConfidenceGrade> fromLabel(String label) {
        if (label == null) return Optional.empty();
        String wanted = label.trim().toUpperCase();
        return Arrays.stream(values()).filter(g -> g.label.equals(wanted)).findFirst();
    }

    public boolean isAtLeast(ConfidenceGrade other) {
        return ordinal() <= other.ordinal();
    }
}
