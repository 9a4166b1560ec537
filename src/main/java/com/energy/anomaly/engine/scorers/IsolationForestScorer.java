package com.energy.anomaly.engine.scorers;

import com.energy.anomaly.config.DetectionConfig;
import com.energy.anomaly.engine.OutlierScorer;
import com.energy.anomaly.engine.Percentiles;
import com.energy.anomaly.engine.isolationforest.IsolationForest;
import com.energy.anomaly.exception.EstimatorException;
import com.energy.anomaly.model.FeatureMatrix;
import com.energy.anomaly.model.ScoreResult;
import com.energy.anomaly.model.ScorerType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Scores rows with an Isolation Forest trained on the run's own data.
 *
 * Scoring:
 *   Anomaly score ranges from 0.0 (normal) to 1.0 (anomalous): short average
 *   isolation paths give high scores. The decision threshold is the
 *   (1 - contamination) percentile of the run's scores, so roughly the
 *   contamination fraction of rows is flagged.
 *
 * The result also carries per-feature importance weights derived from same-leaf
 * variance, normalized to a mean of 1, when enabled.
 */
@Component
public class IsolationForestScorer implements OutlierScorer {

    private static final Logger log = LoggerFactory.getLogger(IsolationForestScorer.class);

    private static final int MIN_ROWS = 2;

    private final DetectionConfig config;

    public IsolationForestScorer(DetectionConfig config) {
        this.config = config;
    }

    @Override
    public ScorerType getSupportedType() {
        return ScorerType.ISOLATION_FOREST;
    }

    @Override
    public ScoreResult score(FeatureMatrix scaled) {
        if (scaled.rowCount() < MIN_ROWS) {
            throw new EstimatorException(String.format(
                    "Isolation Forest needs at least %d rows, got %d", MIN_ROWS, scaled.rowCount()));
        }
        double contamination = config.getContamination();
        if (contamination <= 0.0 || contamination > 0.5) {
            throw new EstimatorException(String.format(
                    "contamination must be in (0, 0.5], got %.3f", contamination));
        }

        DetectionConfig.IsolationForestSettings settings = config.getIsolationForest();
        double[][] data = scaled.toArray();

        IsolationForest forest = new IsolationForest();
        forest.train(data, settings.getNumTrees(), settings.getSampleSize(), config.getRandomSeed());

        double[] scores = forest.anomalyScores(data);
        int[] flags = Percentiles.flagAbove(scores, (1.0 - contamination) * 100.0);

        double[] weights = null;
        if (settings.isFeatureImportance()) {
            weights = normalize(forest.leafVarianceImportance(data));
        }

        log.debug("Isolation Forest: {} trees, sample size {}, feature weights {}",
                settings.getNumTrees(), forest.getSampleSize(), weights);

        return ScoreResult.builder()
                .scorerType(ScorerType.ISOLATION_FOREST)
                .flags(flags)
                .scores(scores)
                .featureWeights(weights)
                .build();
    }

    /**
     * Rescale to mean 1; null when there is no variance to go by.
     */
    static double[] normalize(double[] importance) {
        double sum = 0.0;
        for (double v : importance) sum += v;
        if (sum <= 0.0 || !Double.isFinite(sum)) {
            return null;
        }
        double[] weights = new double[importance.length];
        for (int i = 0; i < importance.length; i++) {
            weights[i] = importance[i] * importance.length / sum;
        }
        return weights;
    }
}
