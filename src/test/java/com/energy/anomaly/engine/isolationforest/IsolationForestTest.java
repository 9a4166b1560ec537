package com.energy.anomaly.engine.isolationforest;

import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class IsolationForestTest {

    @Test
    void averagePathLength_knownValues() {
        assertThat(IsolationNode.averagePathLength(1)).isEqualTo(0.0);
        assertThat(IsolationNode.averagePathLength(2)).isEqualTo(1.0);
        assertThat(IsolationNode.averagePathLength(256)).isCloseTo(10.24, within(0.01));
    }

    @Test
    void anomalyScore_isolatedPointScoresHigherThanClusterPoints() {
        double[][] data = clusterWithOutlier();
        IsolationForest forest = new IsolationForest();
        forest.train(data, 100, 256, 42L);

        double outlierScore = forest.anomalyScore(data[data.length - 1]);
        double inlierScore = forest.anomalyScore(data[0]);

        assertThat(outlierScore).isGreaterThan(0.6);
        assertThat(outlierScore).isGreaterThan(inlierScore);
    }

    @Test
    void train_sameSeed_sameScores() {
        double[][] data = clusterWithOutlier();
        IsolationForest first = new IsolationForest();
        first.train(data, 50, 64, 7L);
        IsolationForest second = new IsolationForest();
        second.train(data, 50, 64, 7L);

        assertThat(first.anomalyScores(data)).containsExactly(second.anomalyScores(data));
    }

    @Test
    void train_sampleSizeCappedByRowCount() {
        IsolationForest forest = new IsolationForest();
        forest.train(clusterWithOutlier(), 10, 256, 1L);

        assertThat(forest.getSampleSize()).isEqualTo(101);
        assertThat(forest.getTrees()).hasSize(10);
    }

    @Test
    void leafVarianceImportance_dominatedBySpreadFeature() {
        Random random = new Random(3);
        double[][] data = new double[200][];
        for (int i = 0; i < data.length; i++) {
            // feature 0 spread over [0, 100), feature 1 nearly constant
            data[i] = new double[]{random.nextDouble() * 100.0, 1.0 + random.nextDouble() * 0.01};
        }
        IsolationForest forest = new IsolationForest();
        forest.train(data, 50, 256, 42L);

        double[] importance = forest.leafVarianceImportance(data);

        assertThat(importance).hasSize(2);
        assertThat(importance[0]).isGreaterThan(importance[1]);
    }

    private static double[][] clusterWithOutlier() {
        Random random = new Random(11);
        double[][] data = new double[101][];
        for (int i = 0; i < 100; i++) {
            data[i] = new double[]{random.nextGaussian(), random.nextGaussian(), random.nextGaussian()};
        }
        data[100] = new double[]{25.0, -25.0, 25.0};
        return data;
    }
}
