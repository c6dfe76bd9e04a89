package com.opsbrief.insights.model;

import java.time.Duration;

public enum ComparisonPeriod {
    WEEK_OVER_WEEK(7),
    MONTH_OVER_MONTH(30),
    QUARTER_OVER_QUARTER(90),
    YEAR_OVER_YEAR(365);

    private final int days;

    ComparisonPeriod(int days) {
        this.days = days;
    }

    public int days() {
        return days;
    }

    public Duration window() {
        return Duration.ofDays(days());
    }
}
