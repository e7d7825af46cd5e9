package com.tony.propsAnalytics.exception;

public class InvalidProbabilityException extends RuntimeException {

    public InvalidProbabilityException(String label, double probability) {
        super("Probabilité invalide pour '" + label + "' : " + probability + " (attendu dans ]0, 100])");
    }

    public InvalidProbabilityException(String message) {
        super(message);
    }
}
