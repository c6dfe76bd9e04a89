package com.opsbrief.insights.model;

public enum AnomalyType {
    SPIKE,
    DROP
}
