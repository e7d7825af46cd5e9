package com.tony.propsAnalytics.model;

public enum LineDirection {
    UP,
    DOWN,
    UNCHANGED;

    public static LineDirection between(double previous, double current) {
        int cmp = Double.compare(current, previous);
        if (cmp > 0) return UP;
        if (cmp < 0) return DOWN;
        return UNCHANGED;
    }
}
