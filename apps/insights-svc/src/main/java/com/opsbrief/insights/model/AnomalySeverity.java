package com.opsbrief.insights.model;

/**
 * Ordinal alert priority. Declaration order is significant: later constants are more severe.
 */
public enum AnomalySeverity {
    INFO,
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    public boolean isAtLeast(AnomalySeverity other) {
        return compareTo(other) >= 0;
    }
}
