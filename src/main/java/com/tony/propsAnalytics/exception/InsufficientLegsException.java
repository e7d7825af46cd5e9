package com.tony.propsAnalytics.exception;

public class InsufficientLegsException extends RuntimeException {

    public InsufficientLegsException(int legs) {
        super("Un parlay nécessite au moins 2 sélections (reçu : " + legs + ")");
    }
}
