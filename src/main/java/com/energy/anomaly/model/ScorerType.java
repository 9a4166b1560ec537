package com.energy.anomaly.model;

public enum ScorerType {
    ISOLATION_FOREST("Isolation Forest", AttributionMode.WEIGHTED_DEVIATION, null),
    ROBUST_COVARIANCE("Robust Covariance", AttributionMode.WEIGHTED_DEVIATION, null),
    NEAREST_NEIGHBORS("Nearest Neighbors", AttributionMode.LARGEST_DEVIATION, "distance"),
    PCA_RECONSTRUCTION("PCA Reconstruction", AttributionMode.LARGEST_LOADING, "reconstruction error");

    private final String displayName;
    private final AttributionMode attributionMode;
    // Name under which the raw score is quoted in diagnosis text; null when not reported
    private final String reportedScoreName;

    ScorerType(String displayName, AttributionMode attributionMode, String reportedScoreName) {
        this.displayName = displayName;
        this.attributionMode = attributionMode;
        this.reportedScoreName = reportedScoreName;
    }

    public String getDisplayName() { return displayName; }

    public AttributionMode getAttributionMode() { return attributionMode; }

    public String getReportedScoreName() { return reportedScoreName; }

    public boolean reportsScore() { return reportedScoreName != null; }
}
