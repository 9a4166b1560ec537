package com.energy.anomaly.engine.scorers;

import com.energy.anomaly.config.DetectionConfig;
import com.energy.anomaly.engine.OutlierScorer;
import com.energy.anomaly.engine.Percentiles;
import com.energy.anomaly.exception.EstimatorException;
import com.energy.anomaly.model.FeatureMatrix;
import com.energy.anomaly.model.ScoreResult;
import com.energy.anomaly.model.ScorerType;
import org.apache.commons.math3.ml.distance.DistanceMeasure;
import org.apache.commons.math3.ml.distance.EuclideanDistance;
import org.springframework.stereotype.Component;


/**
 * Scores each row by its mean Euclidean distance to its k nearest neighbors in the
 * scaled space, the row itself counted as its own nearest neighbor at distance 0.
 * Rows above the configured percentile of that distance are flagged.
 */
@Component
public class NearestNeighborScorer implements OutlierScorer {

    private final DetectionConfig config;
    private final DistanceMeasure distance = new EuclideanDistance();

    public NearestNeighborScorer(DetectionConfig config) {
        this.config = config;
    }

    @Override
    public ScorerType getSupportedType() {
        return ScorerType.NEAREST_NEIGHBORS;
    }

    @Override
    public ScoreResult score(FeatureMatrix scaled) {
        DetectionConfig.NearestNeighborSettings settings = config.getNearestNeighbors();
        int k = settings.getNeighborCount();
        int n = scaled.rowCount();
        if (k < 1) {
            throw new EstimatorException("neighbor count must be at least 1, got " + k);
        }
        if (k > n) {
            throw new EstimatorException(String.format(
                    "Expected neighbor count <= number of rows, but rows = %d, neighbor count = %d", n, k));
        }

        double[][] data = scaled.toArray();
        double[] meanDistances = new double[n];
        for (int i = 0; i < n; i++) {
            meanDistances[i] = meanNeighborDistance(data, i, k);
        }

        return ScoreResult.builder()
                .scorerType(ScorerType.NEAREST_NEIGHBORS)
                .flags(Percentiles.flagAbove(meanDistances, settings.getFlagPercentile()))
                .scores(meanDistances)
                .build();
    }

    private double meanNeighborDistance(double[][] data, int query, int k) {
        // k smallest distances seen so far, ascending
        double[] nearest = new double[k];
        int filled = 0;
        for (double[] candidate : data) {
            double d = distance.compute(data[query], candidate);
            if (filled < k) {
                filled++;
            } else if (d >= nearest[k - 1]) {
                continue;
            }
            int pos = filled - 1;
            while (pos > 0 && nearest[pos - 1] > d) {
                nearest[pos] = nearest[pos - 1];
                pos--;
            }
            nearest[pos] = d;
        }
        double sum = 0.0;
        for (double d : nearest) sum += d;
        return sum / k;
    }
}
