package com.energy.anomaly.engine.covariance;

import com.energy.anomaly.engine.Percentiles;
import org.apache.commons.math3.distribution.ChiSquaredDistribution;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.linear.SingularValueDecomposition;

import java.util.Arrays;
import java.util.Comparator;
import java.util.Random;
import java.util.stream.IntStream;

/**
 * Minimum Covariance Determinant estimator of location and scatter.
 *
 * Looks for the subset of h = ceil((n + p + 1) / 2) rows whose empirical covariance
 * has the smallest determinant, starting from random subsets and improving each with
 * concentration steps (refit on the h rows closest to the current estimate). The raw
 * estimate is rescaled for consistency with a normal distribution and reweighted on
 * the rows inside the 97.5% chi-square quantile.
 */
public class MinCovDet {

    private final int numStarts;
    private final int maxSteps;
    private final long seed;

    private RealVector location;
    private RealMatrix covariance;
    private RealMatrix precision;

    public MinCovDet(int numStarts, int maxSteps, long seed) {
        this.numStarts = numStarts;
        this.maxSteps = maxSteps;
        this.seed = seed;
    }

    /**
     * @param data n x p samples, n > p
     */
    public MinCovDet fit(double[][] data) {
        int n = data.length;
        int p = data[0].length;
        if (n <= p) {
            throw new IllegalArgumentException(String.format(
                    "Minimum covariance determinant needs more rows than features (rows=%d, features=%d)", n, p));
        }
        int h = (int) Math.ceil(0.5 * (n + p + 1));
        h = Math.min(h, n);

        Random random = new Random(seed);
        int[] best = null;
        double bestDet = Double.POSITIVE_INFINITY;

        for (int start = 0; start < Math.max(1, numStarts); start++) {
            int[] subset = randomSubset(n, h, random);
            int[] refined = concentrate(data, subset);
            double det = determinant(data, refined);
            if (det < bestDet || best == null) {
                bestDet = det;
                best = refined;
            }
        }

        // Raw estimate, corrected for consistency
        Estimate raw = Estimate.of(data, best);
        ChiSquaredDistribution chi2 = new ChiSquaredDistribution(p);
        double median = Percentiles.of(raw.squaredDistances(data), 50.0);
        double correction = median / chi2.inverseCumulativeProbability(0.5);
        if (correction > 0.0 && Double.isFinite(correction)) {
            raw = raw.scaled(correction);
        }

        // Reweighting step
        double[] rawDistances = raw.squaredDistances(data);
        double cutoff = chi2.inverseCumulativeProbability(0.975);
        int[] inliers = IntStream.range(0, n).filter(i -> rawDistances[i] < cutoff).toArray();
        Estimate result = inliers.length > p ? Estimate.of(data, inliers) : raw;

        this.location = result.location;
        this.covariance = result.covariance;
        this.precision = result.precision;
        return this;
    }

    /**
     * Squared Mahalanobis distances of the rows to the fitted location.
     */
    public double[] mahalanobis(double[][] data) {
        if (location == null) {
            throw new IllegalStateException("MinCovDet used before fit");
        }
        return new Estimate(location, covariance, precision).squaredDistances(data);
    }

    public RealVector getLocation() { return location; }

    private int[] concentrate(double[][] data, int[] subset) {
        int h = subset.length;
        int[] current = subset;
        double currentDet = determinant(data, current);
        for (int step = 0; step < maxSteps; step++) {
            double[] distances = Estimate.of(data, current).squaredDistances(data);
            int[] next = IntStream.range(0, data.length).boxed()
                    .sorted(Comparator.comparingDouble(i -> distances[i]))
                    .limit(h)
                    .mapToInt(Integer::intValue)
                    .sorted()
                    .toArray();
            double nextDet = determinant(data, next);
            if (Arrays.equals(next, current) || nextDet >= currentDet) {
                break;
            }
            current = next;
            currentDet = nextDet;
        }
        return current;
    }

    private static double determinant(double[][] data, int[] rows) {
        return Math.abs(new LUDecomposition(Estimate.of(data, rows).covariance).getDeterminant());
    }

    private static int[] randomSubset(int n, int size, Random random) {
        int[] indices = IntStream.range(0, n).toArray();
        for (int i = 0; i < size; i++) {
            int j = i + random.nextInt(n - i);
            int tmp = indices[i];
            indices[i] = indices[j];
            indices[j] = tmp;
        }
        int[] subset = Arrays.copyOf(indices, size);
        Arrays.sort(subset);
        return subset;
    }

    private static final class Estimate {
        final RealVector location;
        final RealMatrix covariance;
        final RealMatrix precision;

        Estimate(RealVector location, RealMatrix covariance, RealMatrix precision) {
            this.location = location;
            this.covariance = covariance;
            this.precision = precision;
        }

        // Maximum-likelihood mean and covariance of the selected rows
        static Estimate of(double[][] data, int[] rows) {
            int p = data[0].length;
            double[] mean = new double[p];
            for (int r : rows) {
                for (int j = 0; j < p; j++) mean[j] += data[r][j];
            }
            for (int j = 0; j < p; j++) mean[j] /= rows.length;

            double[][] cov = new double[p][p];
            for (int r : rows) {
                for (int a = 0; a < p; a++) {
                    double da = data[r][a] - mean[a];
                    for (int b = a; b < p; b++) {
                        cov[a][b] += da * (data[r][b] - mean[b]);
                    }
                }
            }
            for (int a = 0; a < p; a++) {
                for (int b = a; b < p; b++) {
                    cov[a][b] /= rows.length;
                    cov[b][a] = cov[a][b];
                }
            }
            RealMatrix covariance = MatrixUtils.createRealMatrix(cov);
            return new Estimate(new ArrayRealVector(mean), covariance, pseudoInverse(covariance));
        }

        Estimate scaled(double factor) {
            return new Estimate(location, covariance.scalarMultiply(factor), precision.scalarMultiply(1.0 / factor));
        }

        double[] squaredDistances(double[][] data) {
            double[] center = location.toArray();
            double[][] inverse = precision.getData();
            int p = center.length;
            double[] diff = new double[p];
            double[] distances = new double[data.length];
            for (int i = 0; i < data.length; i++) {
                for (int a = 0; a < p; a++) {
                    diff[a] = data[i][a] - center[a];
                }
                double sum = 0.0;
                for (int a = 0; a < p; a++) {
                    double row = 0.0;
                    for (int b = 0; b < p; b++) {
                        row += inverse[a][b] * diff[b];
                    }
                    sum += diff[a] * row;
                }
                distances[i] = sum;
            }
            return distances;
        }

        // Singular scatter (e.g. a constant column) falls back to the pseudo-inverse
        private static RealMatrix pseudoInverse(RealMatrix matrix) {
            return new SingularValueDecomposition(matrix).getSolver().getInverse();
        }
    }
}
