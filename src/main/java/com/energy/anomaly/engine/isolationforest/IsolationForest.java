package com.energy.anomaly.engine.isolationforest;

import org.apache.commons.math3.stat.descriptive.moment.Variance;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.stream.IntStream;

/**
 * Isolation Forest (Liu, Ting and Zhou, 2008) trained on the rows it scores.
 *
 * Every tree is grown on a random sub-sample without replacement; a row's score
 * is 2^(-E[h(x)] / c(psi)), where E[h(x)] is its mean path length over the trees
 * and c(psi) the expected path length for the sub-sample size psi. Scores near 1
 * mark rows that are isolated quickly.
 */
public class IsolationForest {

    private final List<IsolationTree> trees = new ArrayList<>();
    private int sampleSize;

    /**
     * @param data       training rows, each a feature vector
     * @param numTrees   number of trees in the forest
     * @param sampleSize sub-sample size per tree, capped by the row count
     * @param seed       random seed; the same seed grows the same forest
     */
    public void train(double[][] data, int numTrees, int sampleSize, long seed) {
        this.sampleSize = Math.min(sampleSize, data.length);
        int maxDepth = (int) Math.ceil(Math.log(this.sampleSize) / Math.log(2));
        trees.clear();

        Random random = new Random(seed);
        int[] all = IntStream.range(0, data.length).toArray();
        for (int t = 0; t < numTrees; t++) {
            trees.add(IsolationTree.grow(data, drawSample(all, this.sampleSize, random), maxDepth, random));
        }
    }

    /**
     * @return score between 0.0 (normal) and 1.0 (anomalous); 0.0 for an untrained forest
     */
    public double anomalyScore(double[] point) {
        double normalizer = IsolationNode.averagePathLength(sampleSize);
        if (trees.isEmpty() || normalizer <= 0.0) return 0.0;

        double meanPath = 0.0;
        for (IsolationTree tree : trees) {
            meanPath += tree.pathLength(point);
        }
        meanPath /= trees.size();
        return Math.pow(2.0, -meanPath / normalizer);
    }

    public double[] anomalyScores(double[][] data) {
        double[] scores = new double[data.length];
        for (int i = 0; i < data.length; i++) {
            scores[i] = anomalyScore(data[i]);
        }
        return scores;
    }

    /**
     * Per-feature importance from same-leaf variance: for every tree, the rows of
     * {@code data} are grouped by the leaf they fall into, and the population
     * variance of each feature within every group of two or more rows is summed.
     * The totals are averaged over the trees.
     */
    public double[] leafVarianceImportance(double[][] data) {
        int numFeatures = data[0].length;
        double[] importance = new double[numFeatures];
        if (trees.isEmpty()) return importance;

        Variance variance = new Variance(false);
        for (IsolationTree tree : trees) {
            // groups kept in first-seen order so the sums do not depend on hashing
            Map<IsolationNode, List<double[]>> byLeaf = new IdentityHashMap<>();
            List<List<double[]>> groups = new ArrayList<>();
            for (double[] row : data) {
                byLeaf.computeIfAbsent(tree.leafOf(row), leaf -> {
                    List<double[]> members = new ArrayList<>();
                    groups.add(members);
                    return members;
                }).add(row);
            }
            for (List<double[]> members : groups) {
                if (members.size() < 2) continue;
                double[] column = new double[members.size()];
                for (int f = 0; f < numFeatures; f++) {
                    for (int m = 0; m < members.size(); m++) {
                        column[m] = members.get(m)[f];
                    }
                    importance[f] += variance.evaluate(column);
                }
            }
        }

        for (int f = 0; f < numFeatures; f++) {
            importance[f] /= trees.size();
        }
        return importance;
    }

    // Partial Fisher-Yates shuffle of the row indices; the whole table when it is not larger than the sample
    private static int[] drawSample(int[] all, int size, Random random) {
        int[] indices = all.clone();
        if (size >= indices.length) {
            return indices;
        }
        for (int i = 0; i < size; i++) {
            int j = i + random.nextInt(indices.length - i);
            int tmp = indices[i];
            indices[i] = indices[j];
            indices[j] = tmp;
        }
        return Arrays.copyOf(indices, size);
    }

    public List<IsolationTree> getTrees() { return trees; }
    public int getSampleSize() { return sampleSize; }
}
