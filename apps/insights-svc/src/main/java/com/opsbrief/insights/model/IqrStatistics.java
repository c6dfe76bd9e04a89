package com.opsbrief.insights.model;

public record IqrStatistics(
        double q1,
        double median,
        double q3,
        double iqr,
        double lowerBound,
        double upperBound,
        double min,
        double max,
        int count
) {
    public RangeEstimate expectedRange() {
        return new RangeEstimate(lowerBound, upperBound);
    }
}
