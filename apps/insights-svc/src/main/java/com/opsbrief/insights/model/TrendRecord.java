package com.opsbrief.insights.model;

import java.util.Objects;

/**
 * Directional movement over an analysis window.
 *
 * @param magnitude        slope normalized to percent of the series scale per step
 * @param confidence       blend of fit quality and sample size, always within {@code [0, 1]}
 * @param slope            raw least squares slope per step, in the metric's unit
 * @param percentageChange period-over-period change in percent
 * @param absoluteChange   last value minus first value
 * @param volatility       coefficient of variation in percent
 */
public record TrendRecord(
        TrendDirection direction,
        double magnitude,
        double confidence,
        double slope,
        double rSquared,
        double percentageChange,
        double absoluteChange,
        double volatility,
        AnomalySeverity severity,
        boolean significant
) {
    public TrendRecord {
        Objects.requireNonNull(direction, "direction");
        Objects.requireNonNull(severity, "severity");
        if (confidence < 0d || confidence > 1d) {
            throw new IllegalArgumentException("confidence must be within [0, 1]");
        }
    }

    public static TrendRecord neutral() {
        return new TrendRecord(TrendDirection.FLAT, 0d, 0d, 0d, 0d, 0d, 0d, 0d, AnomalySeverity.INFO, false);
    }
}
