package com.energy.anomaly.service;

import com.energy.anomaly.config.DetectionConfig;
import com.energy.anomaly.engine.OutlierScorer;
import com.energy.anomaly.engine.ResultAssembler;
import com.energy.anomaly.engine.ScoreAggregator;
import com.energy.anomaly.engine.attribution.FeatureAttributor;
import com.energy.anomaly.engine.severity.PercentileSeverityClassifier;
import com.energy.anomaly.engine.severity.ZScoreSeverityClassifier;
import com.energy.anomaly.ingest.CsvObservationReader;
import com.energy.anomaly.model.AnomalyRecord;
import com.energy.anomaly.model.DetectionStrategy;
import com.energy.anomaly.model.FeatureMatrix;
import com.energy.anomaly.model.Observation;
import com.energy.anomaly.model.ScoreResult;
import com.energy.anomaly.model.ScorerType;
import com.energy.anomaly.testutil.TestDataFactory;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

/**
 * Orchestration checks with stubbed scorers.
 */
@ExtendWith(MockitoExtension.class)
class AnomalyAnalysisServiceMockTest {

    private static final int ROWS = 10;

    @Mock private OutlierScorer forestScorer;
    @Mock private OutlierScorer covarianceScorer;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private AnomalyAnalysisService service;

    @BeforeEach
    void setUp() {
        DetectionConfig config = TestDataFactory.createConfig(DetectionStrategy.ENSEMBLE);
        when(forestScorer.getSupportedType()).thenReturn(ScorerType.ISOLATION_FOREST);
        when(covarianceScorer.getSupportedType()).thenReturn(ScorerType.ROBUST_COVARIANCE);

        service = new AnomalyAnalysisService(
                config,
                new CsvObservationReader(TestDataFactory.FIXED_CLOCK),
                List.of(forestScorer, covarianceScorer),
                List.of(new ZScoreSeverityClassifier(config), new PercentileSeverityClassifier(config)),
                new ScoreAggregator(),
                new FeatureAttributor(config),
                new ResultAssembler(),
                objectMapper,
                TestDataFactory.FIXED_CLOCK);
    }

    private static ScoreResult result(ScorerType type, int... outlierRows) {
        int[] flags = new int[ROWS];
        Arrays.fill(flags, ScoreResult.INLIER);
        for (int row : outlierRows) {
            flags[row] = ScoreResult.OUTLIER;
        }
        return ScoreResult.builder()
                .scorerType(type)
                .flags(flags)
                .scores(new double[ROWS])
                .build();
    }

    @Test
    void analyze_onlyRowsFlaggedByMajorityAreReported() {
        List<Observation> observations = TestDataFactory.createNormalReadings(ROWS, 3L);
        when(forestScorer.score(any(FeatureMatrix.class)))
                .thenReturn(result(ScorerType.ISOLATION_FOREST, 1, 4, 7));
        when(covarianceScorer.score(any(FeatureMatrix.class)))
                .thenReturn(result(ScorerType.ROBUST_COVARIANCE, 4, 7, 8));

        List<AnomalyRecord> records = service.analyze(observations);

        assertThat(records).extracting(AnomalyRecord::getDate).containsExactly(
                observations.get(4).getTimestamp().format(ResultAssembler.DATE_FORMAT),
                observations.get(7).getTimestamp().format(ResultAssembler.DATE_FORMAT));
    }

    @Test
    void analyze_missingTimestampsShareOneDefault() {
        List<Observation> observations = new ArrayList<>();
        for (Observation o : TestDataFactory.createNormalReadings(ROWS, 3L)) {
            observations.add(o.toBuilder().timestamp(null).build());
        }
        when(forestScorer.score(any(FeatureMatrix.class)))
                .thenReturn(result(ScorerType.ISOLATION_FOREST, 2, 5));
        when(covarianceScorer.score(any(FeatureMatrix.class)))
                .thenReturn(result(ScorerType.ROBUST_COVARIANCE, 2, 5));

        List<AnomalyRecord> records = service.analyze(observations);

        assertThat(records).hasSize(2);
        assertThat(records).extracting(AnomalyRecord::getDate).containsOnly("2024-03-01 12:00:00");
    }

    @Test
    void analyzeToJson_unexpectedScorerFailure_rendersEstimatorError() throws Exception {
        when(forestScorer.score(any(FeatureMatrix.class))).thenThrow(new IllegalArgumentException("singular matrix"));

        String json = service.analyzeToJson(TestDataFactory.createNormalReadings(ROWS, 3L));

        assertThat(objectMapper.readTree(json).get("error").asText())
                .isEqualTo("Isolation Forest failed: singular matrix");
    }

    @Test
    void analyzeToJson_nothingFlagged_rendersEmptyArray() {
        when(forestScorer.score(any(FeatureMatrix.class))).thenReturn(result(ScorerType.ISOLATION_FOREST, 0));
        when(covarianceScorer.score(any(FeatureMatrix.class))).thenReturn(result(ScorerType.ROBUST_COVARIANCE, 9));

        assertThat(service.analyzeToJson(TestDataFactory.createNormalReadings(ROWS, 3L))).isEqualTo("[]");
    }

    @Test
    void renderError_singleEntryObject() {
        assertThat(service.renderError("No CSV file provided")).isEqualTo("{\"error\":\"No CSV file provided\"}");
    }
}
