package com.energy.anomaly.model;

public enum ScalingMethod {
    ROBUST,
    STANDARD
}
