package com.opsbrief.insights.analytics;

import com.opsbrief.insights.model.AnomalyRecord;
import com.opsbrief.insights.model.AnomalyType;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Descriptive statistics shared by the analyzers. Variance and standard deviation are population
 * measures (divisor {@code n}).
 *
 * <p>Finite input can still overflow. Mean, variance and the linear fit throw
 * {@link NonFiniteValueException} when their result is not finite.
 */
final class SeriesMath {

    static final int FULL_SAMPLE_SIZE = 100;
    static final double SAMPLE_WEIGHT = 0.3d;
    static final double DEVIATION_WEIGHT = 0.7d;

    private SeriesMath() {
    }

    static double[] requireFinite(double[] data) {
        for (int i = 0; i < data.length; i++) {
            if (!Double.isFinite(data[i])) {
                throw new NonFiniteValueException(i, data[i]);
            }
        }
        return data;
    }

    static double requireFinite(String quantity, double value) {
        if (!Double.isFinite(value)) {
            throw new NonFiniteValueException(quantity, value);
        }
        return value;
    }

    static double[] toArray(List<Double> values) {
        double[] data = new double[values.size()];
        for (int i = 0; i < data.length; i++) {
            data[i] = values.get(i);
        }
        return data;
    }

    static List<Double> toList(double[] data) {
        return Arrays.stream(data).boxed().toList();
    }

    static double mean(double[] data) {
        double sum = 0d;
        for (double value : data) {
            sum += value;
        }
        if (data.length == 0) {
            return Double.NaN;
        }
        return requireFinite("mean", sum / data.length);
    }

    static double variance(double[] data, double mean) {
        double sum = 0d;
        for (double value : data) {
            double delta = value - mean;
            sum += delta * delta;
        }
        return requireFinite("variance", sum / data.length);
    }

    static double variance(double[] data) {
        return data.length == 0 ? 0d : variance(data, mean(data));
    }

    static double standardDeviation(double[] data, double mean) {
        return Math.sqrt(variance(data, mean));
    }

    static boolean isConstant(double[] data) {
        for (int i = 1; i < data.length; i++) {
            if (data[i] != data[0]) {
                return false;
            }
        }
        return true;
    }

    static double[] sortedCopy(double[] data) {
        double[] sorted = data.clone();
        Arrays.sort(sorted);
        return sorted;
    }

    /**
     * Percentile by linear interpolation between closest ranks, {@code index = p / 100 * (n - 1)}.
     */
    static double percentile(double[] sortedValues, double percentile) {
        if (sortedValues.length == 0) {
            return 0d;
        }
        double index = percentile / 100.0 * (sortedValues.length - 1);
        int lower = (int) Math.floor(index);
        int upper = (int) Math.ceil(index);
        if (lower == upper) {
            return sortedValues[lower];
        }
        double weight = index - lower;
        return sortedValues[lower] * (1 - weight) + sortedValues[upper] * weight;
    }

    static double median(double[] sortedValues) {
        return percentile(sortedValues, 50);
    }

    static double clamp(double value, double min, double max) {
        if (Double.isNaN(value)) {
            return min;
        }
        return Math.min(Math.max(value, min), max);
    }

    /**
     * 30/70 blend of sample size (saturating at {@value #FULL_SAMPLE_SIZE} points) and deviation
     * (saturating at {@code deviationCap}).
     */
    static double blendedConfidence(int sampleSize, double deviation, double deviationCap) {
        double sampleFactor = Math.min(sampleSize / (double) FULL_SAMPLE_SIZE, 1.0d);
        double deviationFactor = Math.min(deviation / deviationCap, 1.0d);
        return clamp(sampleFactor * SAMPLE_WEIGHT + deviationFactor * DEVIATION_WEIGHT, 0d, 1d);
    }

    static LinearFit linearFit(double[] x, double[] y) {
        int n = y.length;
        if (n < 2) {
            return new LinearFit(0d, n == 1 ? y[0] : 0d, 0d);
        }
        double meanX = mean(x);
        double meanY = mean(y);
        double sxx = 0d;
        double sxy = 0d;
        for (int i = 0; i < n; i++) {
            double dx = x[i] - meanX;
            sxx += dx * dx;
            sxy += dx * (y[i] - meanY);
        }
        if (sxx == 0d) {
            return new LinearFit(0d, meanY, 0d);
        }
        double slope = requireFinite("slope", sxy / sxx);
        double intercept = requireFinite("intercept", meanY - slope * meanX);
        double ssRes = 0d;
        double ssTot = 0d;
        for (int i = 0; i < n; i++) {
            double predicted = intercept + slope * x[i];
            ssRes += (y[i] - predicted) * (y[i] - predicted);
            ssTot += (y[i] - meanY) * (y[i] - meanY);
        }
        double rSquared = ssTot == 0d ? 0d : clamp(1d - ssRes / ssTot, 0d, 1d);
        return new LinearFit(slope, intercept, rSquared);
    }

    /**
     * Points more than {@code threshold} standard deviations from {@code mean}, scored and
     * classified on the z-score scale. {@code std} must be positive.
     */
    static List<AnomalyRecord> zScoreOutliers(double[] data, double mean, double std, double threshold) {
        List<AnomalyRecord> anomalies = new ArrayList<>();
        for (int i = 0; i < data.length; i++) {
            double zScore = Math.abs(data[i] - mean) / std;
            if (zScore > threshold) {
                AnomalyType type = data[i] > mean ? AnomalyType.SPIKE : AnomalyType.DROP;
                anomalies.add(new AnomalyRecord(i, zScore, type, SeverityScale.Z_SCORE.classify(zScore)));
            }
        }
        return List.copyOf(anomalies);
    }

    record LinearFit(double slope, double intercept, double rSquared) {
    }
}
