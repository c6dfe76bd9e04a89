package com.opsbrief.insights.model;

import java.util.List;
import java.util.Optional;

public record MetricAnalysis(
        int sampleCount,
        double currentValue,
        double previousValue,
        double absoluteChange,
        double percentageChange,
        List<DetectedAnomaly> anomalies,
        TrendRecord trend,
        Optional<ZScoreStatistics> statistics,
        Optional<DecompositionResult> decomposition
) {
    public MetricAnalysis {
        anomalies = List.copyOf(anomalies);
    }

    public static MetricAnalysis empty() {
        return new MetricAnalysis(0, 0d, 0d, 0d, 0d, List.of(), TrendRecord.neutral(), Optional.empty(), Optional.empty());
    }

    public boolean hasAnomalyAtLeast(AnomalySeverity severity) {
        return anomalies.stream().anyMatch(anomaly -> anomaly.severity().isAtLeast(severity));
    }
}
