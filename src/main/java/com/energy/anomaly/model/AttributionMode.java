package com.energy.anomaly.model;

/**
 * How the primary issue feature is chosen among the deviating features of a flagged row.
 */
public enum AttributionMode {
    // importance weight x z-score
    WEIGHTED_DEVIATION,
    // standalone z-score
    LARGEST_DEVIATION,
    // summed principal component loading magnitude
    LARGEST_LOADING
}
