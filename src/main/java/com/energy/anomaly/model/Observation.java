package com.energy.anomaly.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

/**
 * One metering reading. Feature values may be {@code NaN} when the source cell
 * was missing or not numeric; they are imputed when the feature matrix is built.
 */
@Value
@Builder(toBuilder = true)
public class Observation {

    LocalDateTime timestamp;

    double usageKwh;

    double co2Tco2;

    double powerFactor;

    public double valueOf(Feature feature) {
        return switch (feature) {
            case USAGE -> usageKwh;
            case EMISSIONS -> co2Tco2;
            case POWER_FACTOR -> powerFactor;
        };
    }
}
