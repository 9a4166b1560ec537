package com.energy.anomaly.engine.scorers;

import com.energy.anomaly.config.DetectionConfig;
import com.energy.anomaly.engine.scaling.StandardScaler;
import com.energy.anomaly.exception.EstimatorException;
import com.energy.anomaly.model.DetectionStrategy;
import com.energy.anomaly.model.FeatureMatrix;
import com.energy.anomaly.model.ScoreResult;
import com.energy.anomaly.testutil.TestDataFactory;
import org.apache.commons.math3.ml.distance.EuclideanDistance;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class NearestNeighborScorerTest {

    private final DetectionConfig config = TestDataFactory.createConfig(DetectionStrategy.NEAREST_NEIGHBORS);
    private final NearestNeighborScorer scorer = new NearestNeighborScorer(config);

    @Test
    void score_meanDistanceCountsSelfAsFirstNeighbor() {
        config.getNearestNeighbors().setNeighborCount(2);
        FeatureMatrix points = FeatureMatrix.of(new double[][]{
                {0.0, 0.0, 0.0}, {1.0, 0.0, 0.0}, {3.0, 0.0, 0.0}});

        ScoreResult result = scorer.score(points);

        // nearest two of row 0: itself (0) and row 1 (1)
        assertThat(result.getScores()[0]).isCloseTo(0.5, within(1e-9));
        assertThat(result.getScores()[2]).isCloseTo(1.0, within(1e-9));
    }

    @Test
    void score_matchesSortedDistances() {
        Random random = new Random(5);
        double[][] data = new double[40][];
        for (int i = 0; i < data.length; i++) {
            data[i] = new double[]{random.nextGaussian(), random.nextGaussian(), random.nextGaussian()};
        }

        ScoreResult result = scorer.score(FeatureMatrix.of(data));

        EuclideanDistance euclidean = new EuclideanDistance();
        for (int i = 0; i < data.length; i++) {
            double[] distances = new double[data.length];
            for (int j = 0; j < data.length; j++) {
                distances[j] = euclidean.compute(data[i], data[j]);
            }
            Arrays.sort(distances);
            double expected = 0.0;
            for (int j = 0; j < 5; j++) expected += distances[j];
            assertThat(result.getScores()[i]).isCloseTo(expected / 5, within(1e-12));
        }
    }

    @Test
    void score_flagsRowsAboveNinetiethPercentile() {
        FeatureMatrix scaled = new StandardScaler().fitTransform(FeatureMatrix.fromObservations(
                TestDataFactory.createReadingsWithSpike(100, 20, 500.0, 0.90)));

        ScoreResult result = scorer.score(scaled);

        assertThat(result.isOutlier(20)).isTrue();
        assertThat(result.outlierCount()).isBetween(1, 10);
    }

    @Test
    void score_neighborCountAboveRowCount_throwsEstimatorException() {
        config.getNearestNeighbors().setNeighborCount(10);
        FeatureMatrix scaled = FeatureMatrix.fromObservations(TestDataFactory.createNormalReadings(4, 1L));

        assertThatThrownBy(() -> scorer.score(scaled))
                .isInstanceOf(EstimatorException.class)
                .hasMessageContaining("rows = 4, neighbor count = 10");
    }
}
