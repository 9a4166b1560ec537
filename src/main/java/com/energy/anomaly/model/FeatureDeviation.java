package com.energy.anomaly.model;

import lombok.Builder;
import lombok.Value;

/**
 * A feature of a single row whose z-score exceeded the minor threshold.
 */
@Value
@Builder
public class FeatureDeviation {

    Feature feature;

    double value;

    double zScore;

    // Signed deviation from the column mean, in percent. Infinite when the mean is zero.
    double deviationPct;

    boolean high;
}
