package com.opsbrief.insights.model;

/**
 * Slope sign reversal between the window ending before {@code index} and the one starting at it.
 */
public record TrendChange(int index, double previousSlope, double nextSlope) {

    public TrendDirection from() {
        return previousSlope > 0 ? TrendDirection.UP : TrendDirection.DOWN;
    }

    public TrendDirection to() {
        return nextSlope > 0 ? TrendDirection.UP : TrendDirection.DOWN;
    }
}
