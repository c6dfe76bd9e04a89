package com.opsbrief.insights.analytics;

import com.opsbrief.insights.model.AnomalyRecord;
import com.opsbrief.insights.model.AnomalySeverity;
import com.opsbrief.insights.model.DetectionMethod;
import com.opsbrief.insights.model.MetricSeries;
import com.opsbrief.insights.model.ZScoreStatistics;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Flags points whose distance from the series mean exceeds {@code threshold} population standard
 * deviations.
 */
public class ZScoreDetector implements AnomalyDetector {

    public static final double DEFAULT_THRESHOLD = 3.0d;
    public static final int DEFAULT_MIN_SAMPLES = 10;

    private static final String NAME = "z-score";
    private static final double CONFIDENCE_DEVIATION_CAP = 5.0d;

    private final double threshold;
    private final int minSamples;
    private final AnalysisObserver observer;

    public ZScoreDetector() {
        this(DEFAULT_THRESHOLD, DEFAULT_MIN_SAMPLES);
    }

    public ZScoreDetector(double threshold, int minSamples) {
        this(threshold, minSamples, new LoggingAnalysisObserver());
    }

    public ZScoreDetector(double threshold, int minSamples, AnalysisObserver observer) {
        if (!(threshold > 0d) || Double.isInfinite(threshold)) {
            throw new IllegalArgumentException("threshold must be a positive number");
        }
        if (minSamples < 2) {
            throw new IllegalArgumentException("minSamples must be at least 2");
        }
        this.threshold = threshold;
        this.minSamples = minSamples;
        this.observer = Objects.requireNonNull(observer, "observer");
    }

    @Override
    public DetectionMethod method() {
        return DetectionMethod.Z_SCORE;
    }

    @Override
    public List<AnomalyRecord> detect(MetricSeries series) {
        Objects.requireNonNull(series, "series");
        if (series.size() < minSamples) {
            observer.insufficientData(NAME, series.size(), minSamples);
            return List.of();
        }
        try {
            double[] data = SeriesMath.requireFinite(series.toArray());
            double mean = SeriesMath.mean(data);
            double std = SeriesMath.standardDeviation(data, mean);
            if (std == 0d || SeriesMath.isConstant(data)) {
                observer.degenerateSeries(NAME, "standard deviation is 0, no anomalies detected");
                return List.of();
            }

            List<AnomalyRecord> anomalies = SeriesMath.zScoreOutliers(data, mean, std, threshold);
            observer.detectionCompleted(NAME, anomalies.size(),
                    String.format(Locale.ROOT, "mean=%.2f, std=%.2f, threshold=%s", mean, std, threshold));
            return anomalies;
        } catch (NonFiniteValueException | ArithmeticException ex) {
            observer.computationFailed(NAME, "detection", ex);
            return List.of();
        }
    }

    public AnomalySeverity severityFor(double zScore) {
        return SeverityScale.Z_SCORE.classify(zScore);
    }

    /**
     * Blends sample size (saturating at 100 points) and z-score (saturating at 5) 30/70.
     */
    @Override
    public double calculateConfidence(List<Double> values, double zScore) {
        Objects.requireNonNull(values, "values");
        return SeriesMath.blendedConfidence(values.size(), zScore, CONFIDENCE_DEVIATION_CAP);
    }

    /**
     * The series mean. This detector has no per-index model, so every index shares it.
     */
    @Override
    public OptionalDouble calculateExpectedValue(List<Double> values, int index) {
        Objects.requireNonNull(values, "values");
        Objects.checkIndex(index, values.size());
        try {
            return OptionalDouble.of(SeriesMath.mean(SeriesMath.requireFinite(SeriesMath.toArray(values))));
        } catch (NonFiniteValueException ex) {
            observer.computationFailed(NAME, "expected value", ex);
            return OptionalDouble.empty();
        }
    }

    public Optional<ZScoreStatistics> getStatistics(List<Double> values) {
        Objects.requireNonNull(values, "values");
        if (values.isEmpty()) {
            return Optional.empty();
        }
        try {
            double[] data = SeriesMath.requireFinite(SeriesMath.toArray(values));
            double[] sorted = SeriesMath.sortedCopy(data);
            double mean = SeriesMath.mean(data);
            double variance = SeriesMath.variance(data, mean);
            return Optional.of(new ZScoreStatistics(
                    mean,
                    SeriesMath.median(sorted),
                    Math.sqrt(variance),
                    variance,
                    sorted[0],
                    sorted[sorted.length - 1],
                    data.length));
        } catch (NonFiniteValueException | ArithmeticException ex) {
            observer.computationFailed(NAME, "statistics", ex);
            return Optional.empty();
        }
    }

    public double getThreshold() {
        return threshold;
    }

    public int getMinSamples() {
        return minSamples;
    }
}
