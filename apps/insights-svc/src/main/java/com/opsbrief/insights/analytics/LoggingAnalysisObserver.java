package com.opsbrief.insights.analytics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class LoggingAnalysisObserver implements AnalysisObserver {

    private static final Logger log = LoggerFactory.getLogger(LoggingAnalysisObserver.class);

    @Override
    public void insufficientData(String analyzer, int samples, int required) {
        log.warn("Insufficient samples for {} analysis: {} < {}", analyzer, samples, required);
    }

    @Override
    public void degenerateSeries(String analyzer, String reason) {
        log.warn("Skipping {} analysis: {}", analyzer, reason);
    }

    @Override
    public void detectionCompleted(String analyzer, int anomalyCount, String details) {
        log.info("{} detection found {} anomalies ({})", analyzer, anomalyCount, details);
    }

    @Override
    public void analysisCompleted(String analyzer, String details) {
        log.debug("{} analysis completed ({})", analyzer, details);
    }

    @Override
    public void computationFailed(String analyzer, String operation, RuntimeException error) {
        log.error("Error in {} {}: {}", analyzer, operation, error.getMessage(), error);
    }
}
