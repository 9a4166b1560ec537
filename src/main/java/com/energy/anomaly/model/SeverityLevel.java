package com.energy.anomaly.model;

public enum SeverityLevel {
    MINOR(1),
    MODERATE(2),
    CRITICAL(3);

    private final int alertLevel;

    SeverityLevel(int alertLevel) {
        this.alertLevel = alertLevel;
    }

    public int getAlertLevel() { return alertLevel; }

    public static SeverityLevel fromMagnitude(double magnitude, double moderateThreshold, double criticalThreshold) {
        if (magnitude > criticalThreshold) return CRITICAL;
        if (magnitude > moderateThreshold) return MODERATE;
        return MINOR;
    }
}
