package com.energy.anomaly.engine.scorers;

import com.energy.anomaly.config.DetectionConfig;
import com.energy.anomaly.engine.OutlierScorer;
import com.energy.anomaly.engine.Percentiles;
import com.energy.anomaly.engine.covariance.MinCovDet;
import com.energy.anomaly.exception.EstimatorException;
import com.energy.anomaly.model.FeatureMatrix;
import com.energy.anomaly.model.ScoreResult;
import com.energy.anomaly.model.ScorerType;
import org.springframework.stereotype.Component;

/**
 * Elliptic envelope: fits a robust (minimum covariance determinant) center and
 * scatter and flags rows whose squared robust Mahalanobis distance is above the
 * (1 - contamination) percentile of the run's distances.
 */
@Component
public class RobustCovarianceScorer implements OutlierScorer {

    private final DetectionConfig config;

    public RobustCovarianceScorer(DetectionConfig config) {
        this.config = config;
    }

    @Override
    public ScorerType getSupportedType() {
        return ScorerType.ROBUST_COVARIANCE;
    }

    @Override
    public ScoreResult score(FeatureMatrix scaled) {
        if (scaled.rowCount() <= scaled.featureCount()) {
            throw new EstimatorException(String.format(
                    "Robust covariance needs more rows than features (rows=%d, features=%d)",
                    scaled.rowCount(), scaled.featureCount()));
        }
        DetectionConfig.RobustCovarianceSettings settings = config.getRobustCovariance();
        double[][] data = scaled.toArray();

        MinCovDet mcd = new MinCovDet(settings.getNumStarts(), settings.getMaxConcentrationSteps(),
                config.getRandomSeed()).fit(data);
        double[] distances = mcd.mahalanobis(data);
        int[] flags = Percentiles.flagAbove(distances, (1.0 - config.getContamination()) * 100.0);

        return ScoreResult.builder()
                .scorerType(ScorerType.ROBUST_COVARIANCE)
                .flags(flags)
                .scores(distances)
                .build();
    }
}
