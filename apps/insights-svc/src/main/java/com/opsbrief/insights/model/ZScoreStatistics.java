package com.opsbrief.insights.model;

public record ZScoreStatistics(
        double mean,
        double median,
        double std,
        double variance,
        double min,
        double max,
        int count
) {
    /**
     * Coefficient of variation in percent, 0 when the mean is 0.
     */
    public double coefficientOfVariation() {
        return mean == 0 ? 0d : std / Math.abs(mean) * 100d;
    }
}
