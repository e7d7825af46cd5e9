package com.tony.propsAnalytics.exception;

import lombok.Getter;

/**
 * Pas assez de matchs pour produire une recommandation ("pas d'edge disponible").
 */
@Getter
public class InsufficientDataException extends RuntimeException {

    private final int observed;
    private final int required;

    public InsufficientDataException(int observed, int required) {
        super("Données insuffisantes : " + observed + " match(s) pour un minimum de " + required);
        this.observed = observed;
        this.required = required;
    }
}
