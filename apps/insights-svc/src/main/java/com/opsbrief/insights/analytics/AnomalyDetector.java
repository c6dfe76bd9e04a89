package com.opsbrief.insights.analytics;

import com.opsbrief.insights.model.AnomalyRecord;
import com.opsbrief.insights.model.DetectionMethod;
import com.opsbrief.insights.model.MetricSeries;
import java.time.Instant;
import java.util.List;
import java.util.OptionalDouble;

/**
 * Point anomaly detector over a single metric series. Implementations are stateless and never
 * throw for short, constant or non-finite data; they return an empty list instead.
 */
public interface AnomalyDetector {

    DetectionMethod method();

    List<AnomalyRecord> detect(MetricSeries series);

    default List<AnomalyRecord> detect(List<Double> values) {
        return detect(MetricSeries.of(values));
    }

    default List<AnomalyRecord> detect(List<Double> values, List<Instant> timestamps) {
        return detect(new MetricSeries(values, timestamps));
    }

    /**
     * Confidence in {@code [0, 1]} for an anomaly of the given deviation within {@code values}.
     */
    double calculateConfidence(List<Double> values, double deviation);

    /**
     * Value the detector considers normal at {@code index}.
     */
    OptionalDouble calculateExpectedValue(List<Double> values, int index);
}
