package com.opsbrief.insights.analytics;

import com.opsbrief.insights.model.ComparisonPeriod;
import java.util.Objects;

/**
 * Classification thresholds for {@link TrendAnalyzer}.
 *
 * <p>The slope is normalized by {@code max(|mean|, std)}. A series centred near zero is therefore
 * measured against its own spread, not against a mean that may be arbitrarily close to 0. A fit
 * whose R squared is below {@code minFitRSquared} explains too little of the variance to have a
 * direction and is reported FLAT whatever its slope.
 *
 * @param minSamples                  shortest series that gets a non-neutral result
 * @param flatThresholdPercent        normalized slopes within {@code [-t, t]} percent per step are FLAT
 * @param minFitRSquared              smallest R squared that can yield UP or DOWN
 * @param significanceThresholdPercent period-over-period change, in percent, that marks a trend significant
 * @param comparisonPeriod            window used for the period-over-period change
 */
public record TrendPolicy(
        int minSamples,
        double flatThresholdPercent,
        double minFitRSquared,
        double significanceThresholdPercent,
        ComparisonPeriod comparisonPeriod
) {
    public static final int DEFAULT_MIN_SAMPLES = 7;
    public static final double DEFAULT_FLAT_THRESHOLD_PERCENT = 0.5d;
    public static final double DEFAULT_MIN_FIT_R_SQUARED = 0.1d;
    public static final double DEFAULT_SIGNIFICANCE_THRESHOLD_PERCENT = 10.0d;

    public TrendPolicy {
        if (minSamples < 3) {
            throw new IllegalArgumentException("minSamples must be at least 3");
        }
        if (!(flatThresholdPercent >= 0d) || Double.isInfinite(flatThresholdPercent)) {
            throw new IllegalArgumentException("flatThresholdPercent must be a non-negative number");
        }
        if (!(minFitRSquared >= 0d) || minFitRSquared > 1d) {
            throw new IllegalArgumentException("minFitRSquared must be within [0, 1]");
        }
        if (!(significanceThresholdPercent >= 0d) || Double.isInfinite(significanceThresholdPercent)) {
            throw new IllegalArgumentException("significanceThresholdPercent must be a non-negative number");
        }
        Objects.requireNonNull(comparisonPeriod, "comparisonPeriod");
    }

    public static TrendPolicy defaults() {
        return new TrendPolicy(DEFAULT_MIN_SAMPLES, DEFAULT_FLAT_THRESHOLD_PERCENT,
                DEFAULT_MIN_FIT_R_SQUARED, DEFAULT_SIGNIFICANCE_THRESHOLD_PERCENT, ComparisonPeriod.WEEK_OVER_WEEK);
    }
}
