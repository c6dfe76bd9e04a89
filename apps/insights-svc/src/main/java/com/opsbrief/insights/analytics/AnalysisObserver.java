package com.opsbrief.insights.analytics;

/**
 * Receives what the analyzers would otherwise log. Implementations must be thread-safe since a
 * single analyzer instance may be shared by concurrent callers.
 */
public interface AnalysisObserver {

    AnalysisObserver NO_OP = new AnalysisObserver() {
    };

    default void insufficientData(String analyzer, int samples, int required) {
    }

    default void degenerateSeries(String analyzer, String reason) {
    }

    default void detectionCompleted(String analyzer, int anomalyCount, String details) {
    }

    default void analysisCompleted(String analyzer, String details) {
    }

    default void computationFailed(String analyzer, String operation, RuntimeException error) {
    }
}
