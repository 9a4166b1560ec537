package com.energy.anomaly.engine.severity;

import com.energy.anomaly.model.FeatureMatrix;
import com.energy.anomaly.model.ScoreResult;
import com.energy.anomaly.model.SeverityLevel;
import com.energy.anomaly.model.SeverityPolicy;

/**
 * Maps flagged rows to an ordinal severity.
 */
public interface SeverityClassifier {

    SeverityPolicy getSupportedPolicy();

    /**
     * @param raw       unscaled feature matrix of the run
     * @param lead      result of the strategy's lead scorer
     * @param weights   per-feature importance weights in canonical order
     * @param anomalous aggregated decision per row
     * @return severity per row; null for rows that are not anomalous
     */
    SeverityLevel[] classify(FeatureMatrix raw, ScoreResult lead, double[] weights, boolean[] anomalous);
}
