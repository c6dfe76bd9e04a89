package com.opsbrief.insights.model;

import java.util.Objects;

/**
 * A single flagged point. {@code index} refers to the position in the series passed to the call
 * that produced the record and has no meaning outside it.
 */
public record AnomalyRecord(
        int index,
        double deviation,
        AnomalyType anomalyType,
        AnomalySeverity severity
) {
    public AnomalyRecord {
        if (index < 0) {
            throw new IllegalArgumentException("index must not be negative");
        }
        Objects.requireNonNull(anomalyType, "anomalyType");
        Objects.requireNonNull(severity, "severity");
    }
}
