package com.energy.anomaly.engine.severity;

import com.energy.anomaly.config.DetectionConfig;
import com.energy.anomaly.model.FeatureDeviation;
import com.energy.anomaly.model.FeatureMatrix;
import com.energy.anomaly.model.ScoreResult;
import com.energy.anomaly.model.SeverityLevel;
import com.energy.anomaly.model.SeverityPolicy;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Severity from per-feature z-scores.
 *
 * Magnitude = max over deviating features (z > minor threshold) of weight x z.
 * CRITICAL above the critical threshold, MODERATE above the moderate threshold,
 * MINOR otherwise, including rows with no deviating feature.
 */
@Component
public class ZScoreSeverityClassifier implements SeverityClassifier {

    private final DetectionConfig config;

    public ZScoreSeverityClassifier(DetectionConfig config) {
        this.config = config;
    }

    @Override
    public SeverityPolicy getSupportedPolicy() {
        return SeverityPolicy.Z_SCORE;
    }

    @Override
    public SeverityLevel[] classify(FeatureMatrix raw, ScoreResult lead, double[] weights, boolean[] anomalous) {
        DetectionConfig.SeveritySettings settings = config.getSeverity();
        SeverityLevel[] levels = new SeverityLevel[anomalous.length];
        for (int row = 0; row < anomalous.length; row++) {
            if (!anomalous[row]) continue;
            double magnitude = magnitude(raw.deviations(row, settings.getMinorZ()), raw, weights);
            levels[row] = SeverityLevel.fromMagnitude(magnitude, settings.getModerate(), settings.getCritical());
        }
        return levels;
    }

    static double magnitude(List<FeatureDeviation> deviations, FeatureMatrix raw, double[] weights) {
        double max = 0.0;
        for (FeatureDeviation deviation : deviations) {
            double weighted = weights[raw.getFeatures().indexOf(deviation.getFeature())] * deviation.getZScore();
            if (weighted > max) max = weighted;
        }
        return max;
    }
}
