package com.energy.anomaly.model;

import com.energy.anomaly.exception.DataException;
import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;

import java.util.ArrayList;
import java.util.List;

/**
 * Immutable rows x features table over the canonical feature order, with cached
 * column mean and sample standard deviation.
 *
 * A scaled matrix is derived with {@link #withValues(double[][])}; the raw matrix
 * is kept for z-scores and for reporting real-world values.
 */
public final class FeatureMatrix {

    private final List<Feature> features;
    private final double[][] values;
    private final double[] means;
    private final double[] stdDevs;

    private FeatureMatrix(List<Feature> features, double[][] values) {
        this.features = features;
        this.values = values;
        this.means = new double[features.size()];
        this.stdDevs = new double[features.size()];

        Mean mean = new Mean();
        StandardDeviation stdDev = new StandardDeviation(true);
        for (int j = 0; j < features.size(); j++) {
            double[] column = column(j);
            means[j] = mean.evaluate(column);
            stdDevs[j] = stdDev.evaluate(column);
        }
    }

    /**
     * Build the matrix from observations, replacing missing ({@code NaN}) values
     * with the mean of the observed values in the same column.
     *
     * @throws DataException if there are no observations or a column has no numeric value
     */
    public static FeatureMatrix fromObservations(List<Observation> observations) {
        if (observations == null || observations.isEmpty()) {
            throw new DataException("Input contains no rows");
        }
        List<Feature> features = Feature.canonicalOrder();
        int n = observations.size();
        double[][] data = new double[n][features.size()];

        for (int j = 0; j < features.size(); j++) {
            Feature feature = features.get(j);
            double sum = 0.0;
            int present = 0;
            for (int i = 0; i < n; i++) {
                double v = observations.get(i).valueOf(feature);
                data[i][j] = v;
                if (Double.isFinite(v)) {
                    sum += v;
                    present++;
                }
            }
            if (present == 0) {
                throw new DataException("Column '" + feature.getColumnName() + "' contains no numeric values");
            }
            double fill = sum / present;
            for (int i = 0; i < n; i++) {
                if (!Double.isFinite(data[i][j])) {
                    data[i][j] = fill;
                }
            }
        }
        return new FeatureMatrix(features, data);
    }

    public static FeatureMatrix of(double[][] data) {
        if (data == null || data.length == 0) {
            throw new DataException("Input contains no rows");
        }
        List<Feature> features = Feature.canonicalOrder();
        for (double[] row : data) {
            if (row.length != features.size()) {
                throw new DataException("Expected " + features.size() + " features per row, got " + row.length);
            }
        }
        return new FeatureMatrix(features, deepCopy(data));
    }

    /**
     * Derive a matrix with the same shape and feature order, e.g. after scaling.
     */
    public FeatureMatrix withValues(double[][] transformed) {
        if (transformed.length != values.length) {
            throw new IllegalArgumentException("Row count mismatch: " + transformed.length + " vs " + values.length);
        }
        return new FeatureMatrix(features, deepCopy(transformed));
    }

    public int rowCount() { return values.length; }

    public int featureCount() { return features.size(); }

    public List<Feature> getFeatures() { return features; }

    public double value(int row, int col) { return values[row][col]; }

    public double value(int row, Feature feature) { return values[row][features.indexOf(feature)]; }

    public double[] column(int col) {
        double[] column = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            column[i] = values[i][col];
        }
        return column;
    }

    public double[][] toArray() { return deepCopy(values); }

    public double mean(int col) { return means[col]; }

    public double stdDev(int col) { return stdDevs[col]; }

    /**
     * Absolute z-score of a cell. A zero standard deviation yields 0 for a value
     * equal to the mean and positive infinity otherwise.
     */
    public double zScore(int row, int col) {
        double diff = Math.abs(values[row][col] - means[col]);
        if (stdDevs[col] == 0.0) {
            return diff == 0.0 ? 0.0 : Double.POSITIVE_INFINITY;
        }
        return diff / stdDevs[col];
    }

    /**
     * Signed deviation from the column mean in percent; infinite when the mean is zero.
     */
    public double deviationPct(int row, int col) {
        double diff = values[row][col] - means[col];
        if (means[col] == 0.0) {
            return diff >= 0 ? Double.POSITIVE_INFINITY : Double.NEGATIVE_INFINITY;
        }
        return diff / means[col] * 100.0;
    }

    /**
     * Features of a row whose z-score is strictly above the threshold, in canonical order.
     */
    public List<FeatureDeviation> deviations(int row, double minZ) {
        List<FeatureDeviation> result = new ArrayList<>();
        for (int j = 0; j < features.size(); j++) {
            double z = zScore(row, j);
            if (z > minZ) {
                result.add(FeatureDeviation.builder()
                        .feature(features.get(j))
                        .value(values[row][j])
                        .zScore(z)
                        .deviationPct(deviationPct(row, j))
                        .high(values[row][j] > means[j])
                        .build());
            }
        }
        return result;
    }

    private static double[][] deepCopy(double[][] data) {
        double[][] copy = new double[data.length][];
        for (int i = 0; i < data.length; i++) {
            copy[i] = data[i].clone();
        }
        return copy;
    }
}
