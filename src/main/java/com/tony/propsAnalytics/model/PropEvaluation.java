package com.tony.propsAnalytics.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Résultat d'évaluation d'une prop lors d'un scan. Un joueur en erreur donne un statut, pas une exception.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PropEvaluation {

    public enum Status {
        EDGE,
        NO_EDGE,
        NO_DATA,       // pas assez de matchs
        UNAVAILABLE,   // source indisponible et rien en cache
        INVALID        // entrée du scan inexploitable (joueur vide, ligne absente)
    }

    private String playerId;
    private String statType;
    private Double line;  // null si l'entrée du scan n'en avait pas
    private Status status;

    private EdgeResult edgeResult;
    private StreakInfo streak;

    // Vrai si la moyenne a été calculée sur des données périmées (fallback cache)
    private boolean stale;

    private LineChangeEvent lineChange;
    private String message;
}
