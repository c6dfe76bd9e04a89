package com.opsbrief.insights.analytics;

import com.opsbrief.insights.model.AnomalySeverity;

/**
 * Maps a non-negative deviation magnitude onto {@link AnomalySeverity}. Thresholds are strictly
 * descending, which makes the mapping monotone in the deviation.
 */
public final class SeverityScale {

    public static final SeverityScale Z_SCORE = new SeverityScale(5.0d, 4.0d, 3.5d, 3.0d);
    public static final SeverityScale IQR = new SeverityScale(3.0d, 2.0d, 1.0d, 0.5d);
    public static final SeverityScale PERCENT_CHANGE = new SeverityScale(50.0d, 30.0d, 15.0d, 10.0d);

    private final double critical;
    private final double high;
    private final double medium;
    private final double low;

    public SeverityScale(double critical, double high, double medium, double low) {
        if (!Double.isFinite(critical) || !Double.isFinite(high) || !Double.isFinite(medium) || !Double.isFinite(low)) {
            throw new IllegalArgumentException("severity thresholds must be finite");
        }
        if (!(critical > high && high > medium && medium > low)) {
            throw new IllegalArgumentException("severity thresholds must be strictly descending");
        }
        this.critical = critical;
        this.high = high;
        this.medium = medium;
        this.low = low;
    }

    public AnomalySeverity classify(double deviation) {
        if (deviation >= critical) {
            return AnomalySeverity.CRITICAL;
        }
        if (deviation >= high) {
            return AnomalySeverity.HIGH;
        }
        if (deviation >= medium) {
            return AnomalySeverity.MEDIUM;
        }
        if (deviation >= low) {
            return AnomalySeverity.LOW;
        }
        return AnomalySeverity.INFO;
    }

    /**
     * Smallest deviation classified as {@code severity}; 0 for {@link AnomalySeverity#INFO}.
     */
    public double lowerBoundOf(AnomalySeverity severity) {
        return switch (severity) {
            case CRITICAL -> critical;
            case HIGH -> high;
            case MEDIUM -> medium;
            case LOW -> low;
            case INFO -> 0d;
        };
    }

    @Override
    public String toString() {
        return "SeverityScale[critical=" + critical + ", high=" + high + ", medium=" + medium + ", low=" + low + "]";
    }
}
