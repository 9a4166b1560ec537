package com.energy.anomaly.engine.scorers;

import com.energy.anomaly.config.DetectionConfig;
import com.energy.anomaly.engine.scaling.RobustScaler;
import com.energy.anomaly.exception.EstimatorException;
import com.energy.anomaly.model.DetectionStrategy;
import com.energy.anomaly.model.FeatureMatrix;
import com.energy.anomaly.model.ScoreResult;
import com.energy.anomaly.model.ScorerType;
import com.energy.anomaly.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class IsolationForestScorerTest {

    private DetectionConfig config;
    private IsolationForestScorer scorer;
    private FeatureMatrix scaled;

    @BeforeEach
    void setUp() {
        config = TestDataFactory.createConfig(DetectionStrategy.ISOLATION_FOREST);
        scorer = new IsolationForestScorer(config);
        scaled = new RobustScaler().fitTransform(FeatureMatrix.fromObservations(
                TestDataFactory.createReadingsWithSpike(100, 42, 500.0, 0.90)));
    }

    @Test
    void score_flagsSpikeAndRoughlyContaminationFraction() {
        ScoreResult result = scorer.score(scaled);

        assertThat(result.getScorerType()).isEqualTo(ScorerType.ISOLATION_FOREST);
        assertThat(result.isOutlier(42)).isTrue();
        assertThat(result.outlierCount()).isBetween(1, 10);
    }

    @Test
    void score_sameSeed_identicalOutput() {
        ScoreResult first = scorer.score(scaled);
        ScoreResult second = scorer.score(scaled);

        assertThat(first.getFlags()).containsExactly(second.getFlags());
        assertThat(first.getScores()).containsExactly(second.getScores());
        assertThat(first.getFeatureWeights()).containsExactly(second.getFeatureWeights());
    }

    @Test
    void score_featureWeightsAverageToOne() {
        double[] weights = scorer.score(scaled).getFeatureWeights();

        assertThat(weights).hasSize(3);
        assertThat((weights[0] + weights[1] + weights[2]) / 3.0).isCloseTo(1.0, within(1e-9));
    }

    @Test
    void score_featureImportanceDisabled_noWeights() {
        config.getIsolationForest().setFeatureImportance(false);

        assertThat(scorer.score(scaled).getFeatureWeights()).isNull();
    }

    @Test
    void score_singleRow_throwsEstimatorException() {
        FeatureMatrix single = FeatureMatrix.of(new double[][]{{1.0, 2.0, 3.0}});

        assertThatThrownBy(() -> scorer.score(single))
                .isInstanceOf(EstimatorException.class)
                .hasMessageContaining("at least 2 rows");
    }

    @Test
    void normalize_allZero_returnsNull() {
        assertThat(IsolationForestScorer.normalize(new double[]{0.0, 0.0, 0.0})).isNull();
        assertThat(IsolationForestScorer.normalize(new double[]{1.0, 2.0, 3.0}))
                .containsExactly(0.5, 1.0, 1.5);
    }
}
