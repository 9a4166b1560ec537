package com.energy.anomaly.engine.isolationforest;

/**
 * Immutable isolation tree node: either a split on one feature or a leaf that
 * remembers how many sample rows ended there.
 */
public final class IsolationNode {

    private static final double EULER_GAMMA = 0.5772156649;

    private final int feature;
    private final double threshold;
    private final IsolationNode below;
    private final IsolationNode atOrAbove;
    private final int size;

    private IsolationNode(int feature, double threshold, IsolationNode below, IsolationNode atOrAbove, int size) {
        this.feature = feature;
        this.threshold = threshold;
        this.below = below;
        this.atOrAbove = atOrAbove;
        this.size = size;
    }

    static IsolationNode split(int feature, double threshold, IsolationNode below, IsolationNode atOrAbove) {
        return new IsolationNode(feature, threshold, below, atOrAbove, 0);
    }

    static IsolationNode leaf(int size) {
        return new IsolationNode(-1, Double.NaN, null, null, size);
    }

    public boolean isLeaf() {
        return below == null;
    }

    /**
     * Node on the next level that a point descends to.
     */
    IsolationNode next(double[] point) {
        return point[feature] < threshold ? below : atOrAbove;
    }

    /**
     * Expected depth of an unsuccessful binary search tree lookup among n points,
     * c(n) = 2H(n-1) - 2(n-1)/n. Used both to adjust leaf depths and to normalize scores.
     */
    public static double averagePathLength(int n) {
        if (n <= 1) return 0.0;
        if (n == 2) return 1.0;
        double harmonic = Math.log(n - 1.0) + EULER_GAMMA;
        return 2.0 * harmonic - 2.0 * (n - 1.0) / n;
    }

    public int getSize() { return size; }
}
