package com.energy.anomaly.model;

import lombok.Builder;
import lombok.Value;

/**
 * Per-row output of one outlier scorer over a scaled feature matrix.
 *
 * Flags use the -1 (outlier) / +1 (inlier) convention so that several results
 * can be combined by averaging. Scores are oriented so that higher means more
 * anomalous; their scale depends on the scorer.
 */
@Value
@Builder
public class ScoreResult {

    ScorerType scorerType;

    int[] flags;

    double[] scores;

    // Per-feature weights in canonical order: forest leaf-variance importance or PCA loadings. Null when not produced.
    double[] featureWeights;

    public static final int OUTLIER = -1;
    public static final int INLIER = 1;

    public int size() {
        return flags.length;
    }

    public boolean isOutlier(int row) {
        return flags[row] == OUTLIER;
    }

    public int outlierCount() {
        int count = 0;
        for (int flag : flags) {
            if (flag == OUTLIER) count++;
        }
        return count;
    }
}
