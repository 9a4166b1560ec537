package com.energy.anomaly.engine;

import com.energy.anomaly.model.FeatureMatrix;
import com.energy.anomaly.model.ScoreResult;
import com.energy.anomaly.model.ScorerType;

/**
 * Interface for all outlier scorers.
 * Each implementation wraps one statistical estimator and handles a specific ScorerType.
 */
public interface OutlierScorer {

    /**
     * The scorer type this implementation handles.
     */
    ScorerType getSupportedType();

    /**
     * Fit the estimator on the scaled matrix and score every row of it.
     *
     * @param scaled feature matrix already transformed by the run's scaler
     * @return per-row flags and scores, aligned with the matrix rows
     * @throws com.energy.anomaly.exception.EstimatorException if the matrix has fewer
     *         rows than the estimator's configuration needs
     */
    ScoreResult score(FeatureMatrix scaled);
}
