package com.energy.anomaly.engine.isolationforest;

import java.util.Random;

/**
 * One randomly grown isolation tree over a sub-sample of the training rows.
 *
 * Each split draws a feature and a threshold uniformly between that feature's
 * minimum and maximum among the rows at the node. Growth stops at the depth
 * limit, at a single row, or when the drawn feature is constant at the node.
 */
public class IsolationTree {

    private final IsolationNode root;

    private IsolationTree(IsolationNode root) {
        this.root = root;
    }

    /**
     * @param data   the full training matrix
     * @param rows   indices of the sampled rows; reordered in place while growing
     */
    static IsolationTree grow(double[][] data, int[] rows, int maxDepth, Random random) {
        return new IsolationTree(grow(data, rows, 0, rows.length, 0, maxDepth, random));
    }

    // Grows the subtree over rows[from, to)
    private static IsolationNode grow(double[][] data, int[] rows, int from, int to,
                                      int depth, int maxDepth, Random random) {
        int count = to - from;
        if (depth >= maxDepth || count <= 1) {
            return IsolationNode.leaf(count);
        }

        int feature = random.nextInt(data[rows[from]].length);
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (int i = from; i < to; i++) {
            double v = data[rows[i]][feature];
            min = Math.min(min, v);
            max = Math.max(max, v);
        }
        if (min >= max) {
            return IsolationNode.leaf(count);
        }

        double threshold = min + random.nextDouble() * (max - min);
        int mid = partition(data, rows, from, to, feature, threshold);

        return IsolationNode.split(feature, threshold,
                grow(data, rows, from, mid, depth + 1, maxDepth, random),
                grow(data, rows, mid, to, depth + 1, maxDepth, random));
    }

    // Moves rows below the threshold to the front of the range; returns the first index at or above it
    private static int partition(double[][] data, int[] rows, int from, int to, int feature, double threshold) {
        int mid = from;
        for (int i = from; i < to; i++) {
            if (data[rows[i]][feature] < threshold) {
                int tmp = rows[mid];
                rows[mid] = rows[i];
                rows[i] = tmp;
                mid++;
            }
        }
        return mid;
    }

    /**
     * Depth at which the point reaches a leaf, plus the expected remaining depth
     * for the rows that leaf still holds.
     */
    public double pathLength(double[] point) {
        IsolationNode node = root;
        int depth = 0;
        while (!node.isLeaf()) {
            node = node.next(point);
            depth++;
        }
        return depth + IsolationNode.averagePathLength(node.getSize());
    }

    public IsolationNode leafOf(double[] point) {
        IsolationNode node = root;
        while (!node.isLeaf()) {
            node = node.next(point);
        }
        return node;
    }
}
