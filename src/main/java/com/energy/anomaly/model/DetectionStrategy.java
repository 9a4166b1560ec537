package com.energy.anomaly.model;

import java.util.List;

/**
 * Selectable detection pipelines. The first scorer of a strategy is its lead:
 * its scores and feature weights drive severity and attribution.
 */
public enum DetectionStrategy {
    ENSEMBLE(List.of(ScorerType.ISOLATION_FOREST, ScorerType.ROBUST_COVARIANCE),
            ScalingMethod.ROBUST, SeverityPolicy.Z_SCORE),
    ISOLATION_FOREST(List.of(ScorerType.ISOLATION_FOREST),
            ScalingMethod.ROBUST, SeverityPolicy.Z_SCORE),
    ROBUST_COVARIANCE(List.of(ScorerType.ROBUST_COVARIANCE),
            ScalingMethod.ROBUST, SeverityPolicy.Z_SCORE),
    NEAREST_NEIGHBORS(List.of(ScorerType.NEAREST_NEIGHBORS),
            ScalingMethod.STANDARD, SeverityPolicy.PERCENTILE),
    PCA_RECONSTRUCTION(List.of(ScorerType.PCA_RECONSTRUCTION),
            ScalingMethod.STANDARD, SeverityPolicy.PERCENTILE);

    private final List<ScorerType> scorers;
    private final ScalingMethod scalingMethod;
    private final SeverityPolicy severityPolicy;

    DetectionStrategy(List<ScorerType> scorers, ScalingMethod scalingMethod, SeverityPolicy severityPolicy) {
        this.scorers = scorers;
        this.scalingMethod = scalingMethod;
        this.severityPolicy = severityPolicy;
    }

    public List<ScorerType> getScorers() { return scorers; }

    public ScorerType getLeadScorer() { return scorers.get(0); }

    public ScalingMethod getScalingMethod() { return scalingMethod; }

    public SeverityPolicy getSeverityPolicy() { return severityPolicy; }
}
