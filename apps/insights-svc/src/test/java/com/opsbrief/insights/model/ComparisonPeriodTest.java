package com.opsbrief.insights.model;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class ComparisonPeriodTest {

    @Test
    void windowMatchesDayCount() {
        assertThat(ComparisonPeriod.WEEK_OVER_WEEK.days()).isEqualTo(7);
        assertThat(ComparisonPeriod.YEAR_OVER_YEAR.days()).isEqualTo(365);
        for (ComparisonPeriod period : ComparisonPeriod.values()) {
            assertThat(period.window()).isEqualTo(Duration.ofDays(period.days()));
        }
    }
}
