package com.energy.anomaly.engine;

import org.apache.commons.math3.stat.descriptive.rank.Percentile;

/**
 * Percentiles with linear interpolation between closest ranks, the convention
 * used for every threshold in a run.
 */
public final class Percentiles {

    private Percentiles() {}

    /**
     * @param values     the distribution (not modified)
     * @param percentile in (0, 100]
     */
    public static double of(double[] values, double percentile) {
        return new Percentile()
                .withEstimationType(Percentile.EstimationType.R_7)
                .evaluate(values, percentile);
    }

    /**
     * Flags (-1 outlier / +1 inlier) for values strictly above the given percentile.
     */
    public static int[] flagAbove(double[] scores, double percentile) {
        double threshold = of(scores, percentile);
        int[] flags = new int[scores.length];
        for (int i = 0; i < scores.length; i++) {
            flags[i] = scores[i] > threshold ? -1 : 1;
        }
        return flags;
    }
}
