package com.opsbrief.insights.model;

public record RangeEstimate(double lowerBound, double upperBound) {

    public RangeEstimate {
        if (lowerBound > upperBound) {
            throw new IllegalArgumentException("lowerBound must not exceed upperBound");
        }
    }

    public boolean contains(double value) {
        return value >= lowerBound && value <= upperBound;
    }

    public double width() {
        return upperBound - lowerBound;
    }

    public double midpoint() {
        return (lowerBound + upperBound) / 2d;
    }
}
