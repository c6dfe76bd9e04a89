package com.opsbrief.insights.model;

import java.time.Instant;

/**
 * Anomaly enriched with the values a consumer needs to render or persist it.
 *
 * @param timestamp null when the analyzed series carried no timestamps
 */
public record DetectedAnomaly(
        int index,
        Instant timestamp,
        DetectionMethod method,
        AnomalyType anomalyType,
        AnomalySeverity severity,
        double actualValue,
        double expectedValue,
        double deviation,
        double confidence
) {
}
