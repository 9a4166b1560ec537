package com.energy.anomaly.engine.scorers;

import com.energy.anomaly.config.DetectionConfig;
import com.energy.anomaly.engine.OutlierScorer;
import com.energy.anomaly.engine.Percentiles;
import com.energy.anomaly.exception.EstimatorException;
import com.energy.anomaly.model.FeatureMatrix;
import com.energy.anomaly.model.ScoreResult;
import com.energy.anomaly.model.ScorerType;
import org.apache.commons.math3.linear.EigenDecomposition;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.stat.correlation.Covariance;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.stream.IntStream;

/**
 * Projects the scaled rows onto their leading principal components and scores each
 * row by its squared reconstruction error. Rows above the configured percentile of
 * that error are flagged.
 *
 * The result carries per-feature loadings (absolute component weights summed over
 * the retained components) for attribution.
 */
@Component
public class PcaReconstructionScorer implements OutlierScorer {

    private final DetectionConfig config;

    public PcaReconstructionScorer(DetectionConfig config) {
        this.config = config;
    }

    @Override
    public ScorerType getSupportedType() {
        return ScorerType.PCA_RECONSTRUCTION;
    }

    @Override
    public ScoreResult score(FeatureMatrix scaled) {
        DetectionConfig.PcaSettings settings = config.getPca();
        int m = settings.getComponents();
        int n = scaled.rowCount();
        int p = scaled.featureCount();
        int limit = Math.min(n, p);
        if (m < 1 || m > limit) {
            throw new EstimatorException(String.format(
                    "components=%d must be between 1 and min(rows, features)=%d", m, limit));
        }

        double[][] data = scaled.toArray();
        double[] mean = new double[p];
        for (double[] row : data) {
            for (int j = 0; j < p; j++) mean[j] += row[j];
        }
        for (int j = 0; j < p; j++) mean[j] /= n;

        RealMatrix centered = MatrixUtils.createRealMatrix(n, p);
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < p; j++) {
                centered.setEntry(i, j, data[i][j] - mean[j]);
            }
        }

        RealMatrix components = principalComponents(centered, m);   // m x p
        RealMatrix projected = centered.multiply(components.transpose()); // n x m
        RealMatrix reconstructed = projected.multiply(components);        // n x p

        double[] errors = new double[n];
        for (int i = 0; i < n; i++) {
            double sum = 0.0;
            for (int j = 0; j < p; j++) {
                double diff = centered.getEntry(i, j) - reconstructed.getEntry(i, j);
                sum += diff * diff;
            }
            errors[i] = sum;
        }

        double[] loadings = new double[p];
        for (int c = 0; c < m; c++) {
            for (int j = 0; j < p; j++) {
                loadings[j] += Math.abs(components.getEntry(c, j));
            }
        }

        return ScoreResult.builder()
                .scorerType(ScorerType.PCA_RECONSTRUCTION)
                .flags(Percentiles.flagAbove(errors, settings.getFlagPercentile()))
                .scores(errors)
                .featureWeights(loadings)
                .build();
    }

    /**
     * Eigenvectors of the covariance matrix with the m largest eigenvalues, one per row.
     */
    private RealMatrix principalComponents(RealMatrix centered, int m) {
        int p = centered.getColumnDimension();
        if (centered.getRowDimension() < 2) {
            throw new EstimatorException("PCA needs at least 2 rows");
        }
        RealMatrix covariance = new Covariance(centered).getCovarianceMatrix();
        EigenDecomposition eigen = new EigenDecomposition(covariance);
        double[] eigenvalues = eigen.getRealEigenvalues();

        int[] order = IntStream.range(0, eigenvalues.length).boxed()
                .sorted(Comparator.comparingDouble((Integer i) -> eigenvalues[i]).reversed())
                .mapToInt(Integer::intValue)
                .toArray();

        RealMatrix components = MatrixUtils.createRealMatrix(m, p);
        for (int c = 0; c < m; c++) {
            components.setRow(c, eigen.getEigenvector(order[c]).toArray());
        }
        return components;
    }
}
