package com.tony.propsAnalytics.model;

public record StreakInfo(int count, Pick type, boolean active) {

    public static StreakInfo none() {
        return new StreakInfo(0, null, false);
    }
}
