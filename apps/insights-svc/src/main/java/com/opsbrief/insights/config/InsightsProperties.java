package com.opsbrief.insights.config;

import com.opsbrief.insights.analytics.IqrDetector;
import com.opsbrief.insights.analytics.SeasonalDecomposer;
import com.opsbrief.insights.analytics.TrendPolicy;
import com.opsbrief.insights.analytics.ZScoreDetector;
import com.opsbrief.insights.model.ComparisonPeriod;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;

@ConfigurationProperties(prefix = "opsbrief.insights")
public record InsightsProperties(
        ZScore zScore,
        Iqr iqr,
        Trend trend,
        Seasonal seasonal
) {

    @ConstructorBinding
    public InsightsProperties {
        // every section is optional; missing ones fall back to the analyzer defaults
        if (zScore == null) {
            zScore = new ZScore(null, null);
        }
        if (iqr == null) {
            iqr = new Iqr(null, null);
        }
        if (trend == null) {
            trend = new Trend(null, null, null, null, null);
        }
        if (seasonal == null) {
            seasonal = new Seasonal(null, null);
        }
    }

    public record ZScore(Double threshold, Integer minSamples) {
        public ZScore {
            if (threshold == null) threshold = ZScoreDetector.DEFAULT_THRESHOLD;
            if (minSamples == null) minSamples = ZScoreDetector.DEFAULT_MIN_SAMPLES;
            if (threshold <= 0) {
                throw new IllegalArgumentException("z-score threshold must be positive");
            }
            if (minSamples < 2) {
                throw new IllegalArgumentException("z-score minSamples must be at least 2");
            }
        }
    }

    public record Iqr(Double multiplier, Integer minSamples) {
        public Iqr {
            if (multiplier == null) multiplier = IqrDetector.DEFAULT_MULTIPLIER;
            if (minSamples == null) minSamples = IqrDetector.DEFAULT_MIN_SAMPLES;
            if (multiplier < 0) {
                throw new IllegalArgumentException("iqr multiplier must not be negative");
            }
            if (minSamples < 2) {
                throw new IllegalArgumentException("iqr minSamples must be at least 2");
            }
        }
    }

    public record Trend(
            Integer minSamples,
            Double flatThresholdPercent,
            Double minFitRSquared,
            Double significanceThresholdPercent,
            ComparisonPeriod comparisonPeriod
    ) {
        public Trend {
            if (minSamples == null) minSamples = TrendPolicy.DEFAULT_MIN_SAMPLES;
            if (flatThresholdPercent == null) flatThresholdPercent = TrendPolicy.DEFAULT_FLAT_THRESHOLD_PERCENT;
            if (minFitRSquared == null) minFitRSquared = TrendPolicy.DEFAULT_MIN_FIT_R_SQUARED;
            if (significanceThresholdPercent == null) {
                significanceThresholdPercent = TrendPolicy.DEFAULT_SIGNIFICANCE_THRESHOLD_PERCENT;
            }
            if (comparisonPeriod == null) comparisonPeriod = ComparisonPeriod.WEEK_OVER_WEEK;
        }

        public TrendPolicy toPolicy() {
            return new TrendPolicy(minSamples, flatThresholdPercent, minFitRSquared, significanceThresholdPercent, comparisonPeriod);
        }
    }

    public record Seasonal(Integer period, Double residualThreshold) {
        public Seasonal {
            if (period == null) period = SeasonalDecomposer.DEFAULT_PERIOD;
            if (residualThreshold == null) residualThreshold = SeasonalDecomposer.DEFAULT_RESIDUAL_THRESHOLD;
            if (period < 2) {
                throw new IllegalArgumentException("seasonal period must be at least 2");
            }
            if (residualThreshold <= 0) {
                throw new IllegalArgumentException("seasonal residualThreshold must be positive");
            }
        }
    }
}
