package com.opsbrief.insights.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Ordered values of one KPI, optionally paired with timestamps. Instances are immutable: both lists
 * are copied on construction, so analyzers can never observe later changes made by the caller.
 */
public record MetricSeries(List<Double> values, List<Instant> timestamps) {

    public MetricSeries {
        Objects.requireNonNull(values, "values");
        values = List.copyOf(values);
        timestamps = timestamps == null ? List.of() : List.copyOf(timestamps);
        if (!timestamps.isEmpty() && timestamps.size() != values.size()) {
            throw new IllegalArgumentException("timestamps must be empty or match values in size ("
                    + timestamps.size() + " != " + values.size() + ")");
        }
        for (int i = 1; i < timestamps.size(); i++) {
            if (timestamps.get(i).isBefore(timestamps.get(i - 1))) {
                throw new IllegalArgumentException("timestamps must be in ascending order (index " + i + ")");
            }
        }
    }

    public static MetricSeries of(List<Double> values) {
        return new MetricSeries(values, List.of());
    }

    public static MetricSeries of(double... values) {
        Objects.requireNonNull(values, "values");
        List<Double> boxed = new ArrayList<>(values.length);
        for (double value : values) {
            boxed.add(value);
        }
        return new MetricSeries(boxed, List.of());
    }

    public int size() {
        return values.size();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public boolean hasTimestamps() {
        return !timestamps.isEmpty();
    }

    public double value(int index) {
        return values.get(index);
    }

    public Optional<Instant> timestamp(int index) {
        Objects.checkIndex(index, values.size());
        return hasTimestamps() ? Optional.of(timestamps.get(index)) : Optional.empty();
    }

    public double[] toArray() {
        double[] data = new double[values.size()];
        for (int i = 0; i < data.length; i++) {
            data[i] = values.get(i);
        }
        return data;
    }

    /**
     * Sub-series {@code [fromIndex, toIndex)}, timestamps included when present.
     */
    public MetricSeries slice(int fromIndex, int toIndex) {
        List<Instant> slicedTimestamps = hasTimestamps() ? timestamps.subList(fromIndex, toIndex) : List.of();
        return new MetricSeries(values.subList(fromIndex, toIndex), slicedTimestamps);
    }
}
