package com.opsbrief.insights.analytics;

import com.opsbrief.insights.model.AnomalyRecord;
import com.opsbrief.insights.model.AnomalySeverity;
import com.opsbrief.insights.model.AnomalyType;
import com.opsbrief.insights.model.DetectionMethod;
import com.opsbrief.insights.model.IqrStatistics;
import com.opsbrief.insights.model.MetricSeries;
import com.opsbrief.insights.model.RangeEstimate;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Flags points outside {@code [Q1 - m * IQR, Q3 + m * IQR]}. Quartiles come from linear
 * interpolation, so a single extreme point moves the fence far less than it moves a mean.
 */
public class IqrDetector implements AnomalyDetector {

    public static final double DEFAULT_MULTIPLIER = 1.5d;
    public static final int DEFAULT_MIN_SAMPLES = 10;

    private static final String NAME = "iqr";
    private static final double CONFIDENCE_DEVIATION_CAP = 3.0d;

    private final double multiplier;
    private final int minSamples;
    private final AnalysisObserver observer;

    public IqrDetector() {
        this(DEFAULT_MULTIPLIER, DEFAULT_MIN_SAMPLES);
    }

    public IqrDetector(double multiplier, int minSamples) {
        this(multiplier, minSamples, new LoggingAnalysisObserver());
    }

    public IqrDetector(double multiplier, int minSamples, AnalysisObserver observer) {
        if (!(multiplier >= 0d) || Double.isInfinite(multiplier)) {
            throw new IllegalArgumentException("multiplier must be a non-negative number");
        }
        if (minSamples < 2) {
            throw new IllegalArgumentException("minSamples must be at least 2");
        }
        this.multiplier = multiplier;
        this.minSamples = minSamples;
        this.observer = Objects.requireNonNull(observer, "observer");
    }

    @Override
    public DetectionMethod method() {
        return DetectionMethod.IQR;
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
            Fence fence = fence(SeriesMath.sortedCopy(data));
            if (fence.iqr() == 0d) {
                observer.degenerateSeries(NAME, "interquartile range is 0, deviations reported as 0");
            }

            List<AnomalyRecord> anomalies = new ArrayList<>();
            for (int i = 0; i < data.length; i++) {
                double value = data[i];
                if (value < fence.lower()) {
                    double deviation = fence.iqr() > 0 ? Math.abs(value - fence.lower()) / fence.iqr() : 0d;
                    anomalies.add(new AnomalyRecord(i, deviation, AnomalyType.DROP, severityFor(deviation)));
                } else if (value > fence.upper()) {
                    double deviation = fence.iqr() > 0 ? Math.abs(value - fence.upper()) / fence.iqr() : 0d;
                    anomalies.add(new AnomalyRecord(i, deviation, AnomalyType.SPIKE, severityFor(deviation)));
                }
            }
            observer.detectionCompleted(NAME, anomalies.size(), String.format(Locale.ROOT,
                    "Q1=%.2f, Q3=%.2f, IQR=%.2f, bounds=[%.2f, %.2f]",
                    fence.q1(), fence.q3(), fence.iqr(), fence.lower(), fence.upper()));
            return List.copyOf(anomalies);
        } catch (NonFiniteValueException | ArithmeticException ex) {
            observer.computationFailed(NAME, "detection", ex);
            return List.of();
        }
    }

    public AnomalySeverity severityFor(double deviation) {
        return SeverityScale.IQR.classify(deviation);
    }

    /**
     * Same 30/70 blend as the z-score detector, with the deviation saturating at 3 IQRs.
     */
    @Override
    public double calculateConfidence(List<Double> values, double deviation) {
        Objects.requireNonNull(values, "values");
        return SeriesMath.blendedConfidence(values.size(), deviation, CONFIDENCE_DEVIATION_CAP);
    }

    /**
     * Midpoint of the expected range.
     */
    @Override
    public OptionalDouble calculateExpectedValue(List<Double> values, int index) {
        Objects.requireNonNull(values, "values");
        Objects.checkIndex(index, values.size());
        return calculateExpectedRange(values)
                .map(range -> OptionalDouble.of(range.midpoint()))
                .orElseGet(OptionalDouble::empty);
    }

    public Optional<RangeEstimate> calculateExpectedRange(List<Double> values) {
        return statistics(values, "expected range").map(IqrStatistics::expectedRange);
    }

    public Optional<IqrStatistics> getStatistics(List<Double> values) {
        return statistics(values, "statistics");
    }

    /**
     * Whether {@code value} falls outside the fence built from {@code history}. False when no fence
     * can be built or the value itself is not finite.
     */
    public boolean isOutlier(double value, List<Double> history) {
        Objects.requireNonNull(history, "history");
        if (!Double.isFinite(value)) {
            observer.computationFailed(NAME, "outlier check", new NonFiniteValueException(value));
            return false;
        }
        return calculateExpectedRange(history)
                .map(range -> !range.contains(value))
                .orElse(false);
    }

    public double getMultiplier() {
        return multiplier;
    }

    public int getMinSamples() {
        return minSamples;
    }

    private Optional<IqrStatistics> statistics(List<Double> values, String operation) {
        Objects.requireNonNull(values, "values");
        if (values.isEmpty()) {
            return Optional.empty();
        }
        try {
            double[] sorted = SeriesMath.sortedCopy(SeriesMath.requireFinite(SeriesMath.toArray(values)));
            Fence fence = fence(sorted);
            return Optional.of(new IqrStatistics(
                    fence.q1(),
                    fence.median(),
                    fence.q3(),
                    fence.iqr(),
                    fence.lower(),
                    fence.upper(),
                    sorted[0],
                    sorted[sorted.length - 1],
                    sorted.length));
        } catch (NonFiniteValueException | ArithmeticException ex) {
            observer.computationFailed(NAME, operation, ex);
            return Optional.empty();
        }
    }

    private Fence fence(double[] sorted) {
        double q1 = SeriesMath.percentile(sorted, 25);
        double median = SeriesMath.percentile(sorted, 50);
        double q3 = SeriesMath.percentile(sorted, 75);
        double iqr = SeriesMath.requireFinite("interquartile range", q3 - q1);
        return new Fence(q1, median, q3, iqr,
                SeriesMath.requireFinite("lower bound", q1 - multiplier * iqr),
                SeriesMath.requireFinite("upper bound", q3 + multiplier * iqr));
    }

    private record Fence(double q1, double median, double q3, double iqr, double lower, double upper) {
    }
}
