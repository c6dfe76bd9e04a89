package com.opsbrief.insights.analytics;

import com.opsbrief.insights.model.AnomalyRecord;
import com.opsbrief.insights.model.DecompositionResult;
import com.opsbrief.insights.model.MetricSeries;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Additive decomposition {@code value = trend + seasonal + residual} with a centered moving
 * average trend. Anomaly scoring on the residual removes the expected periodic swing from the
 * deviation.
 *
 * <p>At least two full periods are needed; shorter series come back with the series as trend and
 * zero seasonal and residual components.
 */
public class SeasonalDecomposer {

    public static final int DEFAULT_PERIOD = 7;
    public static final double DEFAULT_RESIDUAL_THRESHOLD = 2.0d;

    private static final String NAME = "seasonal";
    // residual spread below this fraction of the series level is rounding noise
    private static final double RESIDUAL_TOLERANCE = 1e-9d;

    private final int period;
    private final double residualThreshold;
    private final AnalysisObserver observer;

    public SeasonalDecomposer() {
        this(DEFAULT_PERIOD, DEFAULT_RESIDUAL_THRESHOLD);
    }

    public SeasonalDecomposer(int period, double residualThreshold) {
        this(period, residualThreshold, new LoggingAnalysisObserver());
    }

    public SeasonalDecomposer(int period, double residualThreshold, AnalysisObserver observer) {
        requireValidPeriod(period);
        requireValidThreshold(residualThreshold);
        this.period = period;
        this.residualThreshold = residualThreshold;
        this.observer = Objects.requireNonNull(observer, "observer");
    }

    public DecompositionResult decompose(MetricSeries series) {
        return decompose(series, period);
    }

    public DecompositionResult decompose(List<Double> values, int period) {
        return decompose(MetricSeries.of(values), period);
    }

    public DecompositionResult decompose(MetricSeries series, int period) {
        Objects.requireNonNull(series, "series");
        requireValidPeriod(period);
        if (series.size() < 2 * period) {
            observer.insufficientData(NAME, series.size(), 2 * period);
            return DecompositionResult.withoutSeasonality(series.values(), period);
        }
        try {
            double[] data = SeriesMath.requireFinite(series.toArray());
            double[] trend = movingAverage(data, period);
            double[] seasonal = seasonalComponent(data, trend, period);
            double[] residual = new double[data.length];
            for (int i = 0; i < data.length; i++) {
                residual[i] = data[i] - trend[i] - seasonal[i];
            }
            double residualVariance = SeriesMath.variance(residual);
            double seasonalStrength = strength(SeriesMath.variance(seasonal), residualVariance);
            double trendStrength = strength(SeriesMath.variance(trend), residualVariance);
            observer.analysisCompleted(NAME, String.format(Locale.ROOT,
                    "period=%d, seasonalStrength=%.3f, trendStrength=%.3f", period, seasonalStrength, trendStrength));
            return new DecompositionResult(
                    SeriesMath.toList(trend),
                    SeriesMath.toList(seasonal),
                    SeriesMath.toList(residual),
                    period,
                    seasonalStrength,
                    trendStrength,
                    true);
        } catch (NonFiniteValueException | ArithmeticException ex) {
            observer.computationFailed(NAME, "decomposition", ex);
            return DecompositionResult.withoutSeasonality(series.values(), period);
        }
    }

    public List<AnomalyRecord> detectSeasonalAnomalies(MetricSeries series) {
        return detectSeasonalAnomalies(series, period, residualThreshold);
    }

    public List<AnomalyRecord> detectSeasonalAnomalies(MetricSeries series, int period, double threshold) {
        requireValidThreshold(threshold);
        return residualAnomalies(decompose(series, period), threshold);
    }

    /**
     * Residual points more than {@code threshold} standard deviations from the residual mean.
     * The deviation of each record is that residual z-score.
     */
    public List<AnomalyRecord> residualAnomalies(DecompositionResult decomposition, double threshold) {
        Objects.requireNonNull(decomposition, "decomposition");
        requireValidThreshold(threshold);
        if (!decomposition.seasonalityDetected()) {
            return List.of();
        }
        try {
            double[] residual = SeriesMath.requireFinite(SeriesMath.toArray(decomposition.residual()));
            double mean = SeriesMath.mean(residual);
            double std = SeriesMath.standardDeviation(residual, mean);
            if (std <= RESIDUAL_TOLERANCE * Math.max(1d, maxAbs(decomposition.trend()))) {
                observer.degenerateSeries(NAME, "residual standard deviation is 0");
                return List.of();
            }
            List<AnomalyRecord> anomalies = SeriesMath.zScoreOutliers(residual, mean, std, threshold);
            observer.detectionCompleted(NAME, anomalies.size(),
                    String.format(Locale.ROOT, "residual std=%.2f, threshold=%s", std, threshold));
            return anomalies;
        } catch (NonFiniteValueException | ArithmeticException ex) {
            observer.computationFailed(NAME, "residual detection", ex);
            return List.of();
        }
    }

    /**
     * The series with its seasonal component removed.
     */
    public List<Double> adjustForSeasonality(MetricSeries series, int period) {
        DecompositionResult decomposition = decompose(series, period);
        if (!decomposition.seasonalityDetected()) {
            return series.values();
        }
        List<Double> adjusted = new ArrayList<>(series.size());
        for (int i = 0; i < series.size(); i++) {
            adjusted.add(series.value(i) - decomposition.seasonal().get(i));
        }
        return List.copyOf(adjusted);
    }

    /**
     * Last trend value plus the seasonal value of each following phase. Without detectable
     * seasonality the last observed value is repeated.
     */
    public List<Double> predictSeasonalPattern(MetricSeries series, int period, int periodsAhead) {
        Objects.requireNonNull(series, "series");
        if (periodsAhead < 1) {
            throw new IllegalArgumentException("periodsAhead must be at least 1");
        }
        DecompositionResult decomposition = decompose(series, period);
        if (!decomposition.seasonalityDetected()) {
            double last = series.isEmpty() ? 0d : series.value(series.size() - 1);
            return Collections.nCopies(periodsAhead, last);
        }
        double lastTrend = decomposition.trend().get(decomposition.size() - 1);
        List<Double> predictions = new ArrayList<>(periodsAhead);
        for (int i = 0; i < periodsAhead; i++) {
            int phase = (decomposition.size() + i) % period;
            predictions.add(lastTrend + decomposition.seasonal().get(phase));
        }
        return List.copyOf(predictions);
    }

    public int getPeriod() {
        return period;
    }

    public double getResidualThreshold() {
        return residualThreshold;
    }

    /**
     * Centered moving average over one full cycle: a plain mean of {@code period} points for odd
     * periods, a 2 x period average over {@code period + 1} points with half-weighted ends for even
     * ones. Windows are shifted inward at the edges so each still covers a whole cycle.
     */
    static double[] movingAverage(double[] data, int period) {
        int n = data.length;
        int half = period / 2;
        boolean even = period % 2 == 0;
        int span = even ? period + 1 : period;
        double[] trend = new double[n];
        for (int i = 0; i < n; i++) {
            int start = Math.min(Math.max(i - half, 0), n - span);
            double sum = 0d;
            if (even) {
                sum += 0.5d * data[start] + 0.5d * data[start + period];
                for (int j = start + 1; j < start + period; j++) {
                    sum += data[j];
                }
            } else {
                for (int j = start; j < start + period; j++) {
                    sum += data[j];
                }
            }
            trend[i] = sum / period;
        }
        return trend;
    }

    private static double[] seasonalComponent(double[] data, double[] trend, int period) {
        double[] phaseAverages = new double[period];
        int[] phaseCounts = new int[period];
        for (int i = 0; i < data.length; i++) {
            phaseAverages[i % period] += data[i] - trend[i];
            phaseCounts[i % period]++;
        }
        for (int phase = 0; phase < period; phase++) {
            phaseAverages[phase] /= phaseCounts[phase];
        }
        double offset = SeriesMath.mean(phaseAverages);
        double[] seasonal = new double[data.length];
        for (int i = 0; i < data.length; i++) {
            seasonal[i] = phaseAverages[i % period] - offset;
        }
        return seasonal;
    }

    private static double maxAbs(List<Double> values) {
        double max = 0d;
        for (double value : values) {
            max = Math.max(max, Math.abs(value));
        }
        return max;
    }

    private static double strength(double componentVariance, double residualVariance) {
        double total = componentVariance + residualVariance;
        if (total == 0d) {
            return 0d;
        }
        return SeriesMath.clamp(componentVariance / total, 0d, 1d);
    }

    private static void requireValidPeriod(int period) {
        if (period < 2) {
            throw new IllegalArgumentException("period must be at least 2");
        }
    }

    private static void requireValidThreshold(double threshold) {
        if (!(threshold > 0d) || Double.isInfinite(threshold)) {
            throw new IllegalArgumentException("threshold must be a positive number");
        }
    }
}
