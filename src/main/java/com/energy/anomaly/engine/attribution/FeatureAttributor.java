package com.energy.anomaly.engine.attribution;

import com.energy.anomaly.config.DetectionConfig;
import com.energy.anomaly.model.Attribution;
import com.energy.anomaly.model.AttributionMode;
import com.energy.anomaly.model.FeatureDeviation;
import com.energy.anomaly.model.FeatureMatrix;
import com.energy.anomaly.model.ScoreResult;
import com.energy.anomaly.model.ScorerType;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Failure-mode attribution for a flagged row: picks the primary issue feature
 * among the row's deviating features and renders the diagnosis text.
 *
 * Primary issue by attribution mode of the lead scorer:
 *   WEIGHTED_DEVIATION - largest importance weight x z-score
 *   LARGEST_DEVIATION  - largest z-score
 *   LARGEST_LOADING    - largest summed principal component loading
 * Ties go to the first feature in canonical order. A row with no deviating
 * feature gets the generic label and no primary issue.
 */
@Component
public class FeatureAttributor {

    static final String GENERIC_LABEL = "Anomaly";
    static final String GENERIC_DIAGNOSIS = "Multivariate pattern anomaly detected";

    static final double POOR_POWER_FACTOR = 0.85;
    static final double OVER_COMPENSATED_POWER_FACTOR = 0.98;

    private final DetectionConfig config;

    public FeatureAttributor(DetectionConfig config) {
        this.config = config;
    }

    public Attribution attribute(FeatureMatrix raw, int row, ScoreResult lead, double[] weights) {
        List<FeatureDeviation> deviations = raw.deviations(row, config.getSeverity().getMinorZ());
        ScorerType scorerType = lead.getScorerType();
        FeatureDeviation primary = selectPrimary(deviations, raw, scorerType.getAttributionMode(),
                rankingWeights(scorerType.getAttributionMode(), lead, weights));

        StringBuilder diagnosis = new StringBuilder();
        if (primary == null) {
            diagnosis.append(GENERIC_DIAGNOSIS);
        } else {
            diagnosis.append(describe(primary));
            List<String> others = deviations.stream()
                    .filter(d -> d != primary)
                    .map(d -> d.getFeature().getColumnName())
                    .collect(Collectors.toList());
            if (!others.isEmpty()) {
                diagnosis.append(". Also showing abnormal ").append(String.join(", ", others));
            }
        }
        if (scorerType.reportsScore()) {
            diagnosis.append(scoreSuffix(scorerType, raw, row, primary, lead.getScores()[row]));
        }

        return Attribution.builder()
                .primaryFeature(primary == null ? null : primary.getFeature())
                .deviations(deviations)
                .anomalyLabel(primary == null ? GENERIC_LABEL : primary.getFeature().getAnomalyLabel())
                .diagnosis(diagnosis.toString())
                .build();
    }

    /**
     * Feature-specific failure mode text.
     */
    static String describe(FeatureDeviation deviation) {
        return switch (deviation.getFeature()) {
            case USAGE -> (deviation.isHigh() ? "High" : "Low") + " energy consumption detected";
            case EMISSIONS -> (deviation.isHigh() ? "Elevated" : "Reduced") + " CO2 emissions detected";
            case POWER_FACTOR -> describePowerFactor(deviation.getValue());
        };
    }

    static String describePowerFactor(double powerFactor) {
        if (powerFactor < POOR_POWER_FACTOR) {
            return "Poor power factor indicating reactive power issues";
        }
        if (powerFactor > OVER_COMPENSATED_POWER_FACTOR) {
            return "Power factor over-compensation detected";
        }
        return "Abnormal power factor fluctuation";
    }

    private static double[] rankingWeights(AttributionMode mode, ScoreResult lead, double[] weights) {
        if (mode == AttributionMode.LARGEST_LOADING && lead.getFeatureWeights() != null) {
            return lead.getFeatureWeights();
        }
        return weights;
    }

    private static FeatureDeviation selectPrimary(List<FeatureDeviation> deviations, FeatureMatrix raw,
                                                  AttributionMode mode, double[] weights) {
        FeatureDeviation best = null;
        double bestRank = Double.NEGATIVE_INFINITY;
        for (FeatureDeviation deviation : deviations) {
            double weight = weights[raw.getFeatures().indexOf(deviation.getFeature())];
            double rank = switch (mode) {
                case WEIGHTED_DEVIATION -> weight * deviation.getZScore();
                case LARGEST_DEVIATION -> deviation.getZScore();
                case LARGEST_LOADING -> weight;
            };
            // strict comparison keeps the earliest feature on ties
            if (best == null || rank > bestRank) {
                best = deviation;
                bestRank = rank;
            }
        }
        return best;
    }

    private static String scoreSuffix(ScorerType scorerType, FeatureMatrix raw, int row,
                                      FeatureDeviation primary, double score) {
        if (scorerType.getAttributionMode() == AttributionMode.LARGEST_DEVIATION) {
            double z = primary != null ? primary.getZScore() : maxZScore(raw, row);
            return String.format(Locale.ROOT, " (deviation: %.2fσ, %s: %.2f)",
                    z, scorerType.getReportedScoreName(), score);
        }
        return String.format(Locale.ROOT, " (%s: %.2f)", scorerType.getReportedScoreName(), score);
    }

    private static double maxZScore(FeatureMatrix raw, int row) {
        double max = 0.0;
        for (int j = 0; j < raw.featureCount(); j++) {
            max = Math.max(max, raw.zScore(row, j));
        }
        return max;
    }
}
