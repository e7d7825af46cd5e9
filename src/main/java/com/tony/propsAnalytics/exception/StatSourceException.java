package com.tony.propsAnalytics.exception;

import lombok.Getter;

@Getter
public class StatSourceException extends RuntimeException {

    public enum Reason {
        RATE_LIMITED,
        NOT_FOUND,
        UNAVAILABLE
    }

    private final Reason reason;

    public StatSourceException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public StatSourceException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }
}
