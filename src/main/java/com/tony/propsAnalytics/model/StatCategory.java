package com.tony.propsAnalytics.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.Getter;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Catégories de props supportées : stats simples et combinaisons (somme par match des composantes).
 */
@Getter
@JsonFormat(shape = JsonFormat.Shape.OBJECT)
public enum StatCategory {
    PTS("PTS", "Points", "Total de points marqués", List.of(), List.of(15, 20, 25, 30, 35, 40)),
    REB("REB", "Rebonds", "Total de rebonds", List.of(), List.of(5, 7, 10, 12, 15)),
    AST("AST", "Passes décisives", "Total de passes décisives", List.of(), List.of(5, 7, 10, 12, 15)),
    STL("STL", "Interceptions", "Total d'interceptions", List.of(), List.of(1, 2, 3, 4, 5)),
    BLK("BLK", "Contres", "Total de contres", List.of(), List.of(1, 2, 3, 4, 5)),
    THREES("3PM", "Paniers à 3 points", "Tirs à 3 points réussis", List.of(), List.of(2, 3, 4, 5, 6)),
    PTS_REB("PTS+REB", "Points + Rebonds", "Points et rebonds cumulés", List.of("PTS", "REB"), List.of(20, 25, 30, 35, 40, 45)),
    PTS_AST("PTS+AST", "Points + Passes", "Points et passes cumulés", List.of("PTS", "AST"), List.of(20, 25, 30, 35, 40, 45)),
    REB_AST("REB+AST", "Rebonds + Passes", "Rebonds et passes cumulés", List.of("REB", "AST"), List.of(10, 12, 15, 18, 20)),
    PRA("PTS+REB+AST", "Points + Rebonds + Passes", "Ligne type triple-double", List.of("PTS", "REB", "AST"), List.of(30, 35, 40, 45, 50, 55)),
    STL_BLK("STL+BLK", "Interceptions + Contres", "Interceptions et contres cumulés", List.of("STL", "BLK"), List.of(2, 3, 4, 5, 6));

    private final String code;
    private final String displayName;
    private final String description;
    private final List<String> components;
    private final List<Integer> commonLines;

    StatCategory(String code, String displayName, String description, List<String> components, List<Integer> commonLines) {
        this.code = code;
        this.displayName = displayName;
        this.description = description;
        this.components = components;
        this.commonLines = commonLines;
    }

    public boolean isCombination() {
        return !components.isEmpty();
    }

    /**
     * Résout un code ("pts+reb", "PRA", "3PM"...). Insensible à la casse.
     */
    public static Optional<StatCategory> fromCode(String code) {
        if (code == null) return Optional.empty();
        String normalized = code.trim().toUpperCase(Locale.ROOT).replace(" ", "");
        if ("PRA".equals(normalized)) return Optional.of(PRA);
        return Arrays.stream(values())
                .filter(c -> c.code.equals(normalized))
                .findFirst();
    }

    /**
     * Valeur de la catégorie pour un match, à partir des stats brutes du match (clé = code simple).
     * Null si une composante manque.
     */
    public Double valueOf(Map<String, Double> gameStats) {
        if (!isCombination()) {
            return gameStats.get(code);
        }
        double total = 0.0;
        for (String component : components) {
            Double v = gameStats.get(component);
            if (v == null) return null;
            total += v;
        }
        return total;
    }
}
