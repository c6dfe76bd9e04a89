package com.opsbrief.insights.model;

public enum DetectionMethod {
    Z_SCORE,
    IQR,
    SEASONAL_RESIDUAL
}
