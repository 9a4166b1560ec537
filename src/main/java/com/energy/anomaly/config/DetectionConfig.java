package com.energy.anomaly.config;

import com.energy.anomaly.model.DetectionStrategy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "detection")
public class DetectionConfig {

    // Detection pipeline used for every analysis run.
    private DetectionStrategy strategy = DetectionStrategy.ENSEMBLE;

    // Expected fraction of anomalous rows; calibrates the forest and covariance thresholds.
    private double contamination = 0.10;

    // Seed for every randomized estimator, so identical input gives identical output.
    private long randomSeed = 42L;

    private IsolationForestSettings isolationForest = new IsolationForestSettings();

    private RobustCovarianceSettings robustCovariance = new RobustCovarianceSettings();

    private NearestNeighborSettings nearestNeighbors = new NearestNeighborSettings();

    private PcaSettings pca = new PcaSettings();

    private SeveritySettings severity = new SeveritySettings();

    @Data
    public static class IsolationForestSettings {
        private int numTrees = 200;
        // Sub-sample per tree, capped by the row count
        private int sampleSize = 256;
        // Weight z-scores by same-leaf variance; uniform weights when off
        private boolean featureImportance = true;
    }

    @Data
    public static class RobustCovarianceSettings {
        private int numStarts = 30;
        private int maxConcentrationSteps = 30;
    }

    @Data
    public static class NearestNeighborSettings {
        private int neighborCount = 5;
        private double flagPercentile = 90.0;
    }

    @Data
    public static class PcaSettings {
        private int components = 2;
        private double flagPercentile = 90.0;
    }

    @Data
    public static class SeveritySettings {
        // z-score policy
        private double minorZ = 1.5;
        private double moderate = 2.0;
        private double critical = 3.0;
        // percentile policy
        private double moderatePercentile = 95.0;
        private double criticalPercentile = 98.0;
    }
}
