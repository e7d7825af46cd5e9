package com.tony.propsAnalytics.model;

public enum BetResult {
    PENDING,
    WIN,
    LOSS,
    PUSH
}
