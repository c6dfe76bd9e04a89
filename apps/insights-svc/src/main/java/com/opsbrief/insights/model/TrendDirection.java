package com.opsbrief.insights.model;

public enum TrendDirection {
    UP,
    DOWN,
    FLAT
}
