package com.tony.propsAnalytics.model;

public enum Pick {
    OVER,
    UNDER
}
