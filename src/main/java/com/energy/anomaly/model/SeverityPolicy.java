package com.energy.anomaly.model;

public enum SeverityPolicy {
    Z_SCORE,
    PERCENTILE
}
