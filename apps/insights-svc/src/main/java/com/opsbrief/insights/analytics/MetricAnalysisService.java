package com.opsbrief.insights.analytics;

import com.opsbrief.insights.model.AnomalyRecord;
import com.opsbrief.insights.model.DecompositionResult;
import com.opsbrief.insights.model.DetectedAnomaly;
import com.opsbrief.insights.model.DetectionMethod;
import com.opsbrief.insights.model.MetricAnalysis;
import com.opsbrief.insights.model.MetricSeries;
import com.opsbrief.insights.model.TrendRecord;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Runs the analyzers over one metric and merges their output. Methods run in declaration order of
 * {@link DetectionMethod}; a point already flagged by an earlier method is not reported again.
 */
@Service
public class MetricAnalysisService {

    private static final Logger log = LoggerFactory.getLogger(MetricAnalysisService.class);
    private static final Set<DetectionMethod> DEFAULT_METHODS = EnumSet.of(DetectionMethod.Z_SCORE, DetectionMethod.IQR);

    private final ZScoreDetector zScoreDetector;
    private final IqrDetector iqrDetector;
    private final TrendAnalyzer trendAnalyzer;
    private final SeasonalDecomposer seasonalDecomposer;

    public MetricAnalysisService(ZScoreDetector zScoreDetector,
                                 IqrDetector iqrDetector,
                                 TrendAnalyzer trendAnalyzer,
                                 SeasonalDecomposer seasonalDecomposer) {
        this.zScoreDetector = zScoreDetector;
        this.iqrDetector = iqrDetector;
        this.trendAnalyzer = trendAnalyzer;
        this.seasonalDecomposer = seasonalDecomposer;
    }

    public MetricAnalysis analyze(MetricSeries series) {
        return analyze(series, DEFAULT_METHODS);
    }

    public MetricAnalysis analyze(MetricSeries series, Set<DetectionMethod> methods) {
        Objects.requireNonNull(series, "series");
        Objects.requireNonNull(methods, "methods");
        if (series.isEmpty()) {
            return MetricAnalysis.empty();
        }

        List<DetectedAnomaly> anomalies = new ArrayList<>();
        Set<Integer> flagged = new HashSet<>();
        Optional<DecompositionResult> decomposition = Optional.empty();
        for (DetectionMethod method : DetectionMethod.values()) {
            if (!methods.contains(method)) {
                continue;
            }
            switch (method) {
                case Z_SCORE -> collect(series, zScoreDetector, anomalies, flagged);
                case IQR -> collect(series, iqrDetector, anomalies, flagged);
                case SEASONAL_RESIDUAL -> {
                    DecompositionResult result = seasonalDecomposer.decompose(series);
                    decomposition = Optional.of(result);
                    collectResidual(series, result, anomalies, flagged);
                }
            }
        }

        TrendRecord trend = trendAnalyzer.analyze(series);
        double current = series.value(series.size() - 1);
        double previous = series.size() >= 2 ? series.value(series.size() - 2) : current;
        double absoluteChange = current - previous;
        double percentageChange = previous == 0d ? 0d : absoluteChange / Math.abs(previous) * 100d;

        log.debug("Metric analysis: samples={} anomalies={} methods={} trend={}",
                series.size(), anomalies.size(), methods, trend.direction());
        return new MetricAnalysis(
                series.size(),
                current,
                previous,
                absoluteChange,
                percentageChange,
                anomalies,
                trend,
                zScoreDetector.getStatistics(series.values()),
                decomposition);
    }

    private void collect(MetricSeries series, AnomalyDetector detector, List<DetectedAnomaly> anomalies, Set<Integer> flagged) {
        List<Double> values = series.values();
        for (AnomalyRecord record : detector.detect(series)) {
            if (!flagged.add(record.index())) {
                continue;
            }
            double actual = values.get(record.index());
            anomalies.add(new DetectedAnomaly(
                    record.index(),
                    series.timestamp(record.index()).orElse(null),
                    detector.method(),
                    record.anomalyType(),
                    record.severity(),
                    actual,
                    detector.calculateExpectedValue(values, record.index()).orElse(actual),
                    record.deviation(),
                    detector.calculateConfidence(values, record.deviation())));
        }
    }

    private void collectResidual(MetricSeries series, DecompositionResult decomposition,
                                 List<DetectedAnomaly> anomalies, Set<Integer> flagged) {
        List<Double> values = series.values();
        List<AnomalyRecord> records = seasonalDecomposer.residualAnomalies(decomposition, seasonalDecomposer.getResidualThreshold());
        for (AnomalyRecord record : records) {
            if (!flagged.add(record.index())) {
                continue;
            }
            double actual = values.get(record.index());
            anomalies.add(new DetectedAnomaly(
                    record.index(),
                    series.timestamp(record.index()).orElse(null),
                    DetectionMethod.SEASONAL_RESIDUAL,
                    record.anomalyType(),
                    record.severity(),
                    actual,
                    actual - decomposition.residual().get(record.index()),
                    record.deviation(),
                    zScoreDetector.calculateConfidence(values, record.deviation())));
        }
    }
}
