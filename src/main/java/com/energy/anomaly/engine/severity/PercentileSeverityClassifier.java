package com.energy.anomaly.engine.severity;

import com.energy.anomaly.config.DetectionConfig;
import com.energy.anomaly.engine.Percentiles;
import com.energy.anomaly.model.FeatureMatrix;
import com.energy.anomaly.model.ScoreResult;
import com.energy.anomaly.model.SeverityLevel;
import com.energy.anomaly.model.SeverityPolicy;
import org.springframework.stereotype.Component;

/**
 * Severity from the rank of the lead scorer's raw score within this run:
 * CRITICAL above the critical percentile, MODERATE above the moderate percentile.
 * Cut-points are recomputed from the full score distribution on every run.
 */
@Component
public class PercentileSeverityClassifier implements SeverityClassifier {

    private final DetectionConfig config;

    public PercentileSeverityClassifier(DetectionConfig config) {
        this.config = config;
    }

    @Override
    public SeverityPolicy getSupportedPolicy() {
        return SeverityPolicy.PERCENTILE;
    }

    @Override
    public SeverityLevel[] classify(FeatureMatrix raw, ScoreResult lead, double[] weights, boolean[] anomalous) {
        DetectionConfig.SeveritySettings settings = config.getSeverity();
        double[] scores = lead.getScores();
        double moderate = Percentiles.of(scores, settings.getModeratePercentile());
        double critical = Percentiles.of(scores, settings.getCriticalPercentile());

        SeverityLevel[] levels = new SeverityLevel[anomalous.length];
        for (int row = 0; row < anomalous.length; row++) {
            if (anomalous[row]) {
                levels[row] = SeverityLevel.fromMagnitude(scores[row], moderate, critical);
            }
        }
        return levels;
    }
}
