package com.energy.anomaly.service;

import com.energy.anomaly.config.DetectionConfig;
import com.energy.anomaly.engine.OutlierScorer;
import com.energy.anomaly.engine.ResultAssembler;
import com.energy.anomaly.engine.ScoreAggregator;
import com.energy.anomaly.engine.attribution.FeatureAttributor;
import com.energy.anomaly.engine.scaling.Scalers;
import com.energy.anomaly.engine.severity.SeverityClassifier;
import com.energy.anomaly.exception.AnalysisException;
import com.energy.anomaly.exception.ComputationException;
import com.energy.anomaly.exception.DataException;
import com.energy.anomaly.exception.EstimatorException;
import com.energy.anomaly.ingest.CsvObservationReader;
import com.energy.anomaly.model.AnomalyRecord;
import com.energy.anomaly.model.Attribution;
import com.energy.anomaly.model.DetectionStrategy;
import com.energy.anomaly.model.FeatureMatrix;
import com.energy.anomaly.model.Observation;
import com.energy.anomaly.model.ScoreResult;
import com.energy.anomaly.model.ScorerType;
import com.energy.anomaly.model.SeverityLevel;
import com.energy.anomaly.model.SeverityPolicy;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonWriteFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Main orchestrator for an analysis run.
 *
 * Flow:
 * 1. Build the raw feature matrix (missing values imputed with column means)
 * 2. Fit the strategy's scaler once and derive the scaled matrix
 * 3. Run every scorer of the strategy on the scaled matrix
 * 4. Aggregate their flags into one decision per row
 * 5. Classify severity and attribute the primary issue for each flagged row
 * 6. Assemble output records in original row order
 *
 * Each call owns all of its intermediate state; nothing is shared between runs.
 */
@Service
public class AnomalyAnalysisService {

    private static final Logger log = LoggerFactory.getLogger(AnomalyAnalysisService.class);

    private final DetectionConfig config;
    private final CsvObservationReader reader;
    private final Map<ScorerType, OutlierScorer> scorerMap;
    private final Map<SeverityPolicy, SeverityClassifier> classifierMap;
    private final ScoreAggregator aggregator;
    private final FeatureAttributor attributor;
    private final ResultAssembler assembler;
    // escapes non-ASCII characters such as the sigma in diagnosis text
    private final ObjectWriter jsonWriter;
    private final Clock clock;

    public AnomalyAnalysisService(DetectionConfig config,
                                  CsvObservationReader reader,
                                  List<OutlierScorer> scorers,
                                  List<SeverityClassifier> classifiers,
                                  ScoreAggregator aggregator,
                                  FeatureAttributor attributor,
                                  ResultAssembler assembler,
                                  ObjectMapper objectMapper,
                                  Clock clock) {
        this.config = config;
        this.reader = reader;
        this.aggregator = aggregator;
        this.attributor = attributor;
        this.assembler = assembler;
        this.jsonWriter = objectMapper.writer().with(JsonWriteFeature.ESCAPE_NON_ASCII);
        this.clock = clock;

        this.scorerMap = new EnumMap<>(ScorerType.class);
        for (OutlierScorer scorer : scorers) {
            scorerMap.put(scorer.getSupportedType(), scorer);
            log.debug("Registered outlier scorer: {} -> {}",
                    scorer.getSupportedType(), scorer.getClass().getSimpleName());
        }
        this.classifierMap = new EnumMap<>(SeverityPolicy.class);
        for (SeverityClassifier classifier : classifiers) {
            classifierMap.put(classifier.getSupportedPolicy(), classifier);
        }
    }

    /**
     * Analyze a CSV file and render the result as JSON: an array of anomaly records,
     * or {@code {"error": message}} on any failure. Never throws.
     */
    public String analyzeToJson(Path csvPath) {
        return renderSafely(() -> analyze(reader.read(csvPath)));
    }

    /**
     * Variant of {@link #analyzeToJson(Path)} for a path given as text, e.g. a
     * command-line argument. An invalid path is reported as an error object.
     */
    public String analyzeToJson(String csvPath) {
        return renderSafely(() -> analyze(reader.read(toPath(csvPath))));
    }

    /**
     * In-memory variant of {@link #analyzeToJson(Path)}.
     */
    public String analyzeToJson(List<Observation> observations) {
        return renderSafely(() -> analyze(observations));
    }

    /**
     * Run the configured strategy over the observations.
     *
     * @return one record per anomalous row, in input order
     * @throws AnalysisException on invalid input or estimator failure
     */
    public List<AnomalyRecord> analyze(List<Observation> observations) {
        DetectionStrategy strategy = config.getStrategy();
        FeatureMatrix raw = FeatureMatrix.fromObservations(observations);
        log.info("Analyzing {} rows with strategy {}", raw.rowCount(), strategy);

        FeatureMatrix scaled = Scalers.create(strategy.getScalingMethod()).fitTransform(raw);

        List<ScoreResult> results = new ArrayList<>();
        for (ScorerType type : strategy.getScorers()) {
            results.add(runScorer(type, scaled));
        }
        ScoreResult lead = results.get(0);

        boolean[] anomalous = aggregator.aggregate(results);
        double[] weights = featureWeights(strategy, lead, raw.featureCount());

        SeverityClassifier classifier = classifierMap.get(strategy.getSeverityPolicy());
        if (classifier == null) {
            throw new IllegalStateException("No severity classifier registered for " + strategy.getSeverityPolicy());
        }
        SeverityLevel[] severities = classifier.classify(raw, lead, weights, anomalous);

        LocalDateTime defaultTimestamp = null;
        List<AnomalyRecord> records = new ArrayList<>();
        for (int row = 0; row < anomalous.length; row++) {
            if (!anomalous[row]) continue;

            Observation observation = observations.get(row);
            if (observation.getTimestamp() == null) {
                if (defaultTimestamp == null) {
                    defaultTimestamp = LocalDateTime.now(clock).truncatedTo(ChronoUnit.SECONDS);
                }
                observation = observation.toBuilder().timestamp(defaultTimestamp).build();
            }

            Attribution attribution = attributor.attribute(raw, row, lead, weights);
            log.debug("Row {} flagged: severity={}, primary={}, deviations={}",
                    row, severities[row], attribution.getPrimaryFeature(), attribution.getDeviations());
            records.add(assembler.assemble(observation, raw, row, severities[row], attribution));
        }

        log.info("Strategy {} flagged {} of {} rows", strategy, records.size(), raw.rowCount());
        return records;
    }

    private static Path toPath(String csvPath) {
        try {
            return Path.of(csvPath);
        } catch (InvalidPathException e) {
            throw new DataException("Invalid file path: " + e.getMessage(), e);
        }
    }

    private ScoreResult runScorer(ScorerType type, FeatureMatrix scaled) {
        OutlierScorer scorer = scorerMap.get(type);
        if (scorer == null) {
            throw new IllegalStateException("No outlier scorer registered for " + type);
        }
        try {
            ScoreResult result = scorer.score(scaled);
            log.debug("{} flagged {} rows", type.getDisplayName(), result.outlierCount());
            return result;
        } catch (AnalysisException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new EstimatorException(type.getDisplayName() + " failed: " + e.getMessage(), e);
        }
    }

    /**
     * Importance weights for z-score ranking: the lead scorer's own weights when it
     * produces importance (not PCA loadings), uniform otherwise.
     */
    private double[] featureWeights(DetectionStrategy strategy, ScoreResult lead, int featureCount) {
        if (strategy.getLeadScorer() == ScorerType.ISOLATION_FOREST && lead.getFeatureWeights() != null) {
            return lead.getFeatureWeights();
        }
        double[] uniform = new double[featureCount];
        Arrays.fill(uniform, 1.0);
        return uniform;
    }

    private String renderSafely(Supplier<List<AnomalyRecord>> analysis) {
        try {
            return jsonWriter.writeValueAsString(analysis.get());
        } catch (AnalysisException e) {
            log.error("Analysis failed: {}", e.getMessage(), e);
            return renderError(e.getMessage());
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize analysis result", e);
            return renderError("Failed to serialize result: " + e.getOriginalMessage());
        } catch (RuntimeException e) {
            ComputationException wrapped = new ComputationException(
                    "Unexpected computation failure: " + e.getMessage(), e);
            log.error("Analysis failed unexpectedly", wrapped);
            return renderError(wrapped.getMessage());
        }
    }

    public String renderError(String message) {
        try {
            return jsonWriter.writeValueAsString(Map.of("error", message == null ? "Unknown error" : message));
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize error message", e);
            return "{\"error\":\"Unknown error\"}";
        }
    }
}
