package com.opsbrief.insights.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class MetricSeriesTest {

    @Test
    void copiesValuesOnConstruction() {
        List<Double> values = new ArrayList<>(List.of(1.0, 2.0, 3.0));
        MetricSeries series = MetricSeries.of(values);

        values.set(0, 99.0);

        assertThat(series.value(0)).isEqualTo(1.0);
        assertThat(series.hasTimestamps()).isFalse();
        assertThat(series.timestamp(0)).isEmpty();
    }

    @Test
    void rejectsTimestampCountMismatch() {
        assertThatThrownBy(() -> new MetricSeries(List.of(1.0, 2.0), List.of(Instant.parse("2024-03-01T00:00:00Z"))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("timestamps");
    }

    @Test
    void rejectsTimestampsOutOfOrder() {
        List<Instant> timestamps = List.of(Instant.parse("2024-03-02T00:00:00Z"), Instant.parse("2024-03-01T00:00:00Z"));

        assertThatThrownBy(() -> new MetricSeries(List.of(1.0, 2.0), timestamps))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("ascending");
    }

    @Test
    void rejectsNullValues() {
        assertThatThrownBy(() -> MetricSeries.of((List<Double>) null)).isInstanceOf(NullPointerException.class);
    }

    @Test
    void sliceKeepsTimestamps() {
        Instant start = Instant.parse("2024-03-01T00:00:00Z");
        MetricSeries series = new MetricSeries(
                List.of(1.0, 2.0, 3.0, 4.0),
                List.of(start, start.plusSeconds(60), start.plusSeconds(120), start.plusSeconds(180)));

        MetricSeries slice = series.slice(1, 3);

        assertThat(slice.values()).containsExactly(2.0, 3.0);
        assertThat(slice.timestamps()).containsExactly(start.plusSeconds(60), start.plusSeconds(120));
    }
}
