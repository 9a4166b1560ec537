package com.energy.anomaly.model;

import com.energy.anomaly.exception.DataException;
import com.energy.anomaly.testutil.TestDataFactory;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;

import static com.energy.anomaly.testutil.TestDataFactory.START;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class FeatureMatrixTest {

    @Test
    void fromObservations_noRows_throwsDataException() {
        assertThatThrownBy(() -> FeatureMatrix.fromObservations(Collections.emptyList()))
                .isInstanceOf(DataException.class)
                .hasMessageContaining("no rows");
    }

    @Test
    void fromObservations_columnWithoutNumbers_throwsDataException() {
        List<Observation> observations = List.of(
                TestDataFactory.createObservation(START, 1.0, Double.NaN, 0.9),
                TestDataFactory.createObservation(START, 2.0, Double.NaN, 0.9));

        assertThatThrownBy(() -> FeatureMatrix.fromObservations(observations))
                .isInstanceOf(DataException.class)
                .hasMessageContaining("co2_tco2");
    }

    @Test
    void fromObservations_missingValueFilledWithColumnMean() {
        List<Observation> observations = List.of(
                TestDataFactory.createObservation(START, 10.0, 0.1, 0.9),
                TestDataFactory.createObservation(START, Double.NaN, 0.2, 0.8),
                TestDataFactory.createObservation(START, 30.0, 0.3, 0.7));

        FeatureMatrix matrix = FeatureMatrix.fromObservations(observations);

        assertThat(matrix.value(1, Feature.USAGE)).isEqualTo(20.0);
        assertThat(matrix.mean(0)).isCloseTo(20.0, within(1e-9));
    }

    @Test
    void statistics_useSampleStandardDeviation() {
        FeatureMatrix matrix = FeatureMatrix.of(new double[][]{
                {2.0, 1.0, 0.9}, {4.0, 1.0, 0.9}, {4.0, 1.0, 0.9}, {4.0, 1.0, 0.9},
                {5.0, 1.0, 0.9}, {5.0, 1.0, 0.9}, {7.0, 1.0, 0.9}, {9.0, 1.0, 0.9}});

        assertThat(matrix.mean(0)).isCloseTo(5.0, within(1e-9));
        // sum of squares 32 over n - 1 = 7
        assertThat(matrix.stdDev(0)).isCloseTo(Math.sqrt(32.0 / 7.0), within(1e-9));
    }

    @Test
    void zScore_constantColumn_isZeroAtMean() {
        FeatureMatrix matrix = FeatureMatrix.of(new double[][]{{1.0, 5.0, 0.9}, {2.0, 5.0, 0.9}});

        assertThat(matrix.zScore(0, 1)).isEqualTo(0.0);
    }

    @Test
    void deviationPct_zeroMean_isInfinite() {
        FeatureMatrix matrix = FeatureMatrix.of(new double[][]{{-1.0, 1.0, 0.9}, {1.0, 1.0, 0.9}});

        assertThat(matrix.deviationPct(1, 0)).isEqualTo(Double.POSITIVE_INFINITY);
        assertThat(matrix.deviationPct(0, 0)).isEqualTo(Double.NEGATIVE_INFINITY);
    }

    @Test
    void deviations_onlyFeaturesAboveThreshold() {
        List<Observation> observations = TestDataFactory.createReadingsWithSpike(100, 10, 500.0, 0.90);
        FeatureMatrix matrix = FeatureMatrix.fromObservations(observations);

        List<FeatureDeviation> deviations = matrix.deviations(10, 1.5);

        assertThat(deviations).extracting(FeatureDeviation::getFeature).containsExactly(Feature.USAGE);
        assertThat(deviations.get(0).isHigh()).isTrue();
        assertThat(deviations.get(0).getZScore()).isGreaterThan(9.0);
    }

    @Test
    void withValues_keepsOriginalUntouched() {
        FeatureMatrix raw = FeatureMatrix.of(new double[][]{{1.0, 2.0, 3.0}, {4.0, 5.0, 6.0}});
        FeatureMatrix derived = raw.withValues(new double[][]{{0.0, 0.0, 0.0}, {1.0, 1.0, 1.0}});

        assertThat(raw.value(1, 2)).isEqualTo(6.0);
        assertThat(derived.value(1, 2)).isEqualTo(1.0);
        assertThat(derived.getFeatures()).isEqualTo(raw.getFeatures());
    }
}
