package com.opsbrief.insights.analytics;

import com.opsbrief.insights.model.ComparisonPeriod;
import com.opsbrief.insights.model.MetricSeries;
import com.opsbrief.insights.model.TrendChange;
import com.opsbrief.insights.model.TrendDirection;
import com.opsbrief.insights.model.TrendRecord;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Classifies the direction of a series from its least squares slope.
 *
 * <p>The slope is expressed per step (one index, or the mean timestamp spacing when timestamps are
 * present) and normalized by {@code max(|mean|, std)}, so the flat threshold reads as percent change
 * per step whatever the metric's unit. See {@link TrendPolicy} for the classification rules. Confidence weights the fit (R squared) 80% and the sample size 20%,
 * the latter saturating at 30 points.
 */
public class TrendAnalyzer {

    private static final String NAME = "trend";
    private static final double FIT_WEIGHT = 0.8d;
    private static final double SAMPLE_WEIGHT = 0.2d;
    private static final double FULL_CONFIDENCE_SAMPLES = 30d;
    private static final double MILLIS_PER_DAY = Duration.ofDays(1).toMillis();

    private final TrendPolicy policy;
    private final AnalysisObserver observer;

    public TrendAnalyzer() {
        this(TrendPolicy.defaults());
    }

    public TrendAnalyzer(TrendPolicy policy) {
        this(policy, new LoggingAnalysisObserver());
    }

    public TrendAnalyzer(TrendPolicy policy, AnalysisObserver observer) {
        this.policy = Objects.requireNonNull(policy, "policy");
        this.observer = Objects.requireNonNull(observer, "observer");
    }

    public TrendRecord analyze(List<Double> values) {
        return analyze(MetricSeries.of(values));
    }

    public TrendRecord analyze(List<Double> values, List<Instant> timestamps) {
        return analyze(new MetricSeries(values, timestamps));
    }

    public TrendRecord analyze(MetricSeries series) {
        return analyze(series, policy.comparisonPeriod());
    }

    public TrendRecord analyze(MetricSeries series, ComparisonPeriod period) {
        Objects.requireNonNull(series, "series");
        Objects.requireNonNull(period, "period");
        if (series.size() < policy.minSamples()) {
            observer.insufficientData(NAME, series.size(), policy.minSamples());
            return TrendRecord.neutral();
        }
        try {
            double[] data = SeriesMath.requireFinite(series.toArray());
            if (SeriesMath.isConstant(data)) {
                observer.degenerateSeries(NAME, "series is constant, reporting a flat trend");
                return TrendRecord.neutral();
            }
            double mean = SeriesMath.mean(data);
            double std = SeriesMath.standardDeviation(data, mean);
            double scale = Math.max(Math.abs(mean), std);

            SeriesMath.LinearFit fit = SeriesMath.linearFit(axis(series), data);
            double slopePerStep = fit.slope() * stepLength(series);
            double magnitude = slopePerStep / scale * 100d;
            TrendDirection direction = classify(magnitude, fit.rSquared());

            double sampleFactor = Math.min(data.length / FULL_CONFIDENCE_SAMPLES, 1d);
            double confidence = SeriesMath.clamp(FIT_WEIGHT * fit.rSquared() + SAMPLE_WEIGHT * sampleFactor, 0d, 1d);

            double percentageChange = percentageChange(series, data, period);
            double volatility = mean == 0d ? 0d : std / Math.abs(mean) * 100d;
            boolean significant = Math.abs(percentageChange) >= policy.significanceThresholdPercent();

            observer.analysisCompleted(NAME, String.format(Locale.ROOT,
                    "direction=%s, magnitude=%.3f%%/step, r2=%.3f, change=%.2f%%", direction, magnitude,
                    fit.rSquared(), percentageChange));
            return new TrendRecord(
                    direction,
                    magnitude,
                    confidence,
                    slopePerStep,
                    fit.rSquared(),
                    percentageChange,
                    data[data.length - 1] - data[0],
                    volatility,
                    SeverityScale.PERCENT_CHANGE.classify(Math.abs(percentageChange)),
                    significant);
        } catch (NonFiniteValueException | ArithmeticException ex) {
            observer.computationFailed(NAME, "analysis", ex);
            return TrendRecord.neutral();
        }
    }

    /**
     * Indices where the slope of the {@code windowSize} points before differs in sign from the slope
     * of the {@code windowSize} points from that index on.
     */
    public List<TrendChange> detectTrendChanges(MetricSeries series, int windowSize) {
        Objects.requireNonNull(series, "series");
        if (windowSize < 2) {
            throw new IllegalArgumentException("windowSize must be at least 2");
        }
        if (series.size() < windowSize * 2) {
            observer.insufficientData(NAME, series.size(), windowSize * 2);
            return List.of();
        }
        try {
            SeriesMath.requireFinite(series.toArray());
            List<TrendChange> changes = new ArrayList<>();
            for (int i = windowSize; i <= series.size() - windowSize; i++) {
                double previousSlope = slopeOf(series.slice(i - windowSize, i));
                double nextSlope = slopeOf(series.slice(i, i + windowSize));
                if (previousSlope * nextSlope < 0) {
                    changes.add(new TrendChange(i, previousSlope, nextSlope));
                }
            }
            return List.copyOf(changes);
        } catch (NonFiniteValueException | ArithmeticException ex) {
            observer.computationFailed(NAME, "trend change detection", ex);
            return List.of();
        }
    }

    /**
     * Linear extrapolation from the last value. Series shorter than the policy minimum are
     * forecast as their last value.
     */
    public OptionalDouble forecast(MetricSeries series, int periodsAhead) {
        Objects.requireNonNull(series, "series");
        if (periodsAhead < 1) {
            throw new IllegalArgumentException("periodsAhead must be at least 1");
        }
        if (series.isEmpty()) {
            return OptionalDouble.empty();
        }
        try {
            double[] data = SeriesMath.requireFinite(series.toArray());
            double last = data[data.length - 1];
            if (data.length < policy.minSamples()) {
                observer.insufficientData(NAME, data.length, policy.minSamples());
                return OptionalDouble.of(last);
            }
            double slopePerStep = SeriesMath.linearFit(axis(series), data).slope() * stepLength(series);
            return OptionalDouble.of(last + slopePerStep * periodsAhead);
        } catch (NonFiniteValueException | ArithmeticException ex) {
            observer.computationFailed(NAME, "forecast", ex);
            return OptionalDouble.empty();
        }
    }

    public TrendPolicy getPolicy() {
        return policy;
    }

    private TrendDirection classify(double magnitude, double rSquared) {
        if (rSquared < policy.minFitRSquared()) {
            return TrendDirection.FLAT;
        }
        if (magnitude > policy.flatThresholdPercent()) {
            return TrendDirection.UP;
        }
        if (magnitude < -policy.flatThresholdPercent()) {
            return TrendDirection.DOWN;
        }
        return TrendDirection.FLAT;
    }

    private double slopeOf(MetricSeries window) {
        return SeriesMath.linearFit(axis(window), window.toArray()).slope();
    }

    /**
     * Elapsed days since the first timestamp, or the index when the series has no timestamps.
     */
    private static double[] axis(MetricSeries series) {
        double[] x = new double[series.size()];
        if (!series.hasTimestamps()) {
            for (int i = 0; i < x.length; i++) {
                x[i] = i;
            }
            return x;
        }
        Instant origin = series.timestamps().get(0);
        for (int i = 0; i < x.length; i++) {
            x[i] = Duration.between(origin, series.timestamps().get(i)).toMillis() / MILLIS_PER_DAY;
        }
        return x;
    }

    private static double stepLength(MetricSeries series) {
        if (!series.hasTimestamps() || series.size() < 2) {
            return 1d;
        }
        Duration span = Duration.between(series.timestamps().get(0), series.timestamps().get(series.size() - 1));
        return span.toMillis() / MILLIS_PER_DAY / (series.size() - 1);
    }

    private static double percentageChange(MetricSeries series, double[] data, ComparisonPeriod period) {
        double base = data[0];
        double current = data[data.length - 1];
        if (series.hasTimestamps()) {
            Instant cutoff = series.timestamps().get(data.length - 1).minus(period.window());
            double recentSum = 0d;
            double olderSum = 0d;
            int recentCount = 0;
            int olderCount = 0;
            for (int i = 0; i < data.length; i++) {
                if (series.timestamps().get(i).isBefore(cutoff)) {
                    olderSum += data[i];
                    olderCount++;
                } else {
                    recentSum += data[i];
                    recentCount++;
                }
            }
            if (recentCount > 0 && olderCount > 0) {
                base = olderSum / olderCount;
                current = recentSum / recentCount;
            }
        }
        if (base == 0d) {
            return 0d;
        }
        return (current - base) / Math.abs(base) * 100d;
    }
}
