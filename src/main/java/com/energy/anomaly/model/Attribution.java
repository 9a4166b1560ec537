package com.energy.anomaly.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class Attribution {

    // Null when no single feature deviates on its own
    Feature primaryFeature;

    List<FeatureDeviation> deviations;

    String anomalyLabel;

    String diagnosis;

    public boolean hasPrimaryFeature() {
        return primaryFeature != null;
    }
}
