package com.opsbrief.insights.analytics;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

import com.opsbrief.insights.model.AnomalyRecord;
import com.opsbrief.insights.model.AnomalySeverity;
import com.opsbrief.insights.model.AnomalyType;
import com.opsbrief.insights.model.IqrStatistics;
import com.opsbrief.insights.model.RangeEstimate;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.junit.jupiter.api.Test;

class IqrDetectorTest {

    private static final List<Double> NORMAL = List.of(50.0, 52.0, 48.0, 51.0, 49.0, 53.0, 47.0, 50.0, 52.0, 48.0, 51.0, 49.0);
    private static final List<Double> SHORT_SPIKE = List.of(10.0, 12.0, 11.0, 13.0, 12.0, 10.0, 11.0, 12.0, 13.0, 100.0);

    private final IqrDetector detector = new IqrDetector(1.5, 10, AnalysisObserver.NO_OP);

    @Test
    void normalSeriesHasNoAnomalies() {
        assertThat(detector.detect(NORMAL)).isEmpty();
    }

    @Test
    void flagsSpikeAboveUpperFence() {
        List<AnomalyRecord> anomalies = detector.detect(SHORT_SPIKE);

        assertThat(anomalies).singleElement().satisfies(anomaly -> {
            assertThat(anomaly.index()).isEqualTo(9);
            assertThat(anomaly.anomalyType()).isEqualTo(AnomalyType.SPIKE);
            assertThat(anomaly.deviation()).isCloseTo((100.0 - 15.375) / 1.75, within(1e-9));
            assertThat(anomaly.severity()).isEqualTo(AnomalySeverity.CRITICAL);
        });
    }

    @Test
    void flagsDropBelowLowerFence() {
        List<Double> values = List.of(50.0, 52.0, 48.0, 51.0, 49.0, 53.0, 47.0, 5.0, 52.0, 48.0, 51.0, 49.0);

        assertThat(detector.detect(values)).singleElement().satisfies(anomaly -> {
            assertThat(anomaly.index()).isEqualTo(7);
            assertThat(anomaly.anomalyType()).isEqualTo(AnomalyType.DROP);
        });
    }

    @Test
    void flagsSpikeAndDropInOneSeries() {
        List<Double> values = List.of(50.0, 52.0, 100.0, 51.0, 49.0, 10.0, 47.0, 50.0, 52.0, 48.0, 51.0, 49.0);

        assertThat(detector.detect(values))
                .extracting(AnomalyRecord::index, AnomalyRecord::anomalyType)
                .containsExactly(
                        tuple(2, AnomalyType.SPIKE),
                        tuple(5, AnomalyType.DROP));
    }

    @Test
    void statisticsReportOrderedQuartiles() {
        IqrStatistics stats = detector.getStatistics(SHORT_SPIKE).orElseThrow();

        assertThat(stats.q1()).isEqualTo(11.0);
        assertThat(stats.median()).isEqualTo(12.0);
        assertThat(stats.q3()).isCloseTo(12.75, within(1e-12));
        assertThat(stats.q1()).isLessThan(stats.median());
        assertThat(stats.median()).isLessThan(stats.q3());
        assertThat(stats.iqr()).isPositive();
        assertThat(stats.lowerBound()).isCloseTo(8.375, within(1e-12));
        assertThat(stats.upperBound()).isCloseTo(15.375, within(1e-12));
        assertThat(stats.min()).isEqualTo(10.0);
        assertThat(stats.max()).isEqualTo(100.0);
        assertThat(stats.count()).isEqualTo(10);
    }

    @Test
    void constantSeriesCollapsesFenceWithoutAnomalies() {
        List<Double> values = Collections.nCopies(20, 50.0);

        assertThat(detector.detect(values)).isEmpty();
        assertThat(detector.calculateExpectedRange(values)).hasValue(new RangeEstimate(50.0, 50.0));
    }

    @Test
    void zeroIqrReportsZeroDeviation() {
        List<Double> values = new ArrayList<>(Collections.nCopies(10, 5.0));
        values.add(9.0);

        assertThat(detector.detect(values)).singleElement().satisfies(anomaly -> {
            assertThat(anomaly.index()).isEqualTo(10);
            assertThat(anomaly.deviation()).isZero();
            assertThat(anomaly.severity()).isEqualTo(AnomalySeverity.INFO);
        });
    }

    @Test
    void insufficientSamplesReturnEmpty() {
        assertThat(detector.detect(List.of(50.0, 52.0, 48.0))).isEmpty();
        assertThat(detector.detect(List.of())).isEmpty();
    }

    @Test
    void expectedRangeContainsNormalValues() {
        RangeEstimate range = detector.calculateExpectedRange(NORMAL).orElseThrow();

        assertThat(range.lowerBound()).isLessThan(range.upperBound());
        assertThat(NORMAL).allMatch(range::contains);
        assertThat(detector.calculateExpectedValue(NORMAL, 3)).hasValue(50.0);
    }

    @Test
    void isOutlierChecksAgainstHistory() {
        assertThat(detector.isOutlier(50.0, NORMAL)).isFalse();
        assertThat(detector.isOutlier(200.0, NORMAL)).isTrue();
        assertThat(detector.isOutlier(-50.0, NORMAL)).isTrue();
        assertThat(detector.isOutlier(Double.NaN, NORMAL)).isFalse();
        assertThat(detector.isOutlier(200.0, List.of())).isFalse();
    }

    @Test
    void smallerMultiplierIsStricter() {
        List<Double> values = List.of(50.0, 52.0, 48.0, 51.0, 49.0, 53.0, 47.0, 80.0, 52.0, 48.0, 51.0, 49.0);

        int strict = new IqrDetector(1.0, 10, AnalysisObserver.NO_OP).detect(values).size();
        int lenient = new IqrDetector(3.0, 10, AnalysisObserver.NO_OP).detect(values).size();

        assertThat(strict).isGreaterThanOrEqualTo(lenient);
    }

    @Test
    void confidenceCapsDeviationAtThreeIqr() {
        assertThat(detector.calculateConfidence(NORMAL, 3.0)).isGreaterThan(0.7);
        assertThat(detector.calculateConfidence(NORMAL, 0.5)).isLessThan(detector.calculateConfidence(NORMAL, 3.0));
        assertThat(detector.calculateConfidence(NORMAL, 1000.0)).isEqualTo(detector.calculateConfidence(NORMAL, 3.0));
        assertThat(detector.calculateConfidence(NORMAL, 0.0)).isBetween(0.0, 1.0);
    }

    @Test
    void repeatedDetectionYieldsEqualRecords() {
        List<Double> values = List.of(50.0, 52.0, 100.0, 51.0, 49.0, 10.0, 47.0, 50.0, 52.0, 48.0, 51.0, 49.0);

        List<AnomalyRecord> first = detector.detect(values);

        assertThat(first).hasSize(2);
        assertThat(detector.detect(values)).isEqualTo(first);
    }

    @Test
    void timestampedSeriesIsScoredLikeValues() {
        List<Instant> timestamps = new ArrayList<>();
        for (int i = 0; i < SHORT_SPIKE.size(); i++) {
            timestamps.add(Instant.parse("2024-03-01T00:00:00Z").plus(Duration.ofDays(i)));
        }

        assertThat(detector.detect(SHORT_SPIKE, timestamps))
                .isEqualTo(detector.detect(SHORT_SPIKE))
                .singleElement()
                .extracting(AnomalyRecord::index)
                .isEqualTo(9);
    }

    @Test
    void expectedRangeSpansTheFence() {
        RangeEstimate range = detector.calculateExpectedRange(SHORT_SPIKE).orElseThrow();

        assertThat(range).isEqualTo(detector.getStatistics(SHORT_SPIKE).orElseThrow().expectedRange());
        assertThat(range.width()).isCloseTo(15.375 - 8.375, within(1e-12));
        assertThat(range.midpoint()).isCloseTo(11.875, within(1e-12));
    }

    @Test
    void overflowingFenceYieldsNoRange() {
        AnalysisObserver observer = mock(AnalysisObserver.class);
        IqrDetector watched = new IqrDetector(1.5, 10, observer);
        List<Double> values = new ArrayList<>();
        for (int i = 0; i < 12; i++) {
            values.add(i % 2 == 0 ? 1.5e308 : 1.0e308);
        }

        assertThat(watched.detect(values)).isEmpty();
        assertThat(watched.getStatistics(values)).isEmpty();
        verify(observer).computationFailed(eq("iqr"), eq("detection"), any(NonFiniteValueException.class));
        verify(observer).computationFailed(eq("iqr"), eq("statistics"), any(NonFiniteValueException.class));
    }

    @Test
    void nonFiniteHistoryYieldsNoRange() {
        List<Double> values = new ArrayList<>(NORMAL);
        values.set(0, Double.POSITIVE_INFINITY);

        assertThat(detector.detect(values)).isEmpty();
        assertThat(detector.calculateExpectedRange(values)).isEmpty();
        assertThat(detector.getStatistics(values)).isEmpty();
    }
}
