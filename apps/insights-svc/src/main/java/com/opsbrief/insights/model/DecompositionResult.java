package com.opsbrief.insights.model;

import java.util.Collections;
import java.util.List;

/**
 * Additive decomposition {@code value = trend + seasonal + residual}. All three components have the
 * length of the decomposed series and share its indices.
 */
public record DecompositionResult(
        List<Double> trend,
        List<Double> seasonal,
        List<Double> residual,
        int period,
        double seasonalStrength,
        double trendStrength,
        boolean seasonalityDetected
) {
    public DecompositionResult {
        trend = List.copyOf(trend);
        seasonal = List.copyOf(seasonal);
        residual = List.copyOf(residual);
        if (trend.size() != seasonal.size() || trend.size() != residual.size()) {
            throw new IllegalArgumentException("components must have equal length");
        }
    }

    /**
     * Result used when no seasonality can be extracted: the series itself is the trend.
     */
    public static DecompositionResult withoutSeasonality(List<Double> values, int period) {
        List<Double> zeros = Collections.nCopies(values.size(), 0d);
        return new DecompositionResult(values, zeros, zeros, period, 0d, 0d, false);
    }

    public int size() {
        return trend.size();
    }
}
