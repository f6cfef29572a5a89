package com.sales.forecast.engine.gbt;

import java.util.Arrays;
import java.util.Comparator;

/**
 * Least-squares regression tree. Splits are exact: every distinct threshold of every feature is
 * scored by the reduction in squared error, and a split is only taken when both children keep
 * at least {@code minSamplesLeaf} rows.
 */
public class RegressionTree {

    private RegressionNode root;

    public RegressionTree() {}

    public RegressionTree(RegressionNode root) {
        this.root = root;
    }

    /**
     * @param data     feature rows
     * @param targets  value to fit per row (the current residuals when boosting)
     * @param rows     indices into {@code data} used for this tree
     * @param gains    per-feature accumulator; each split adds its error reduction
     */
    public static RegressionTree build(double[][] data, double[] targets, int[] rows,
                                       int maxDepth, int minSamplesLeaf, double[] gains) {
        return new RegressionTree(buildNode(data, targets, rows, 0, maxDepth, Math.max(1, minSamplesLeaf), gains));
    }

    private static RegressionNode buildNode(double[][] data, double[] targets, int[] rows,
                                            int depth, int maxDepth, int minSamplesLeaf, double[] gains) {
        int n = rows.length;
        double sum = 0.0;
        for (int row : rows) sum += targets[row];
        double mean = n == 0 ? 0.0 : sum / n;

        if (depth >= maxDepth || n < 2 * minSamplesLeaf) {
            return RegressionNode.leaf(mean);
        }

        int numFeatures = data[rows[0]].length;
        double parentScore = sum * sum / n;
        double bestGain = 0.0;
        int bestFeature = -1;
        double bestThreshold = 0.0;

        Integer[] order = new Integer[n];
        for (int feature = 0; feature < numFeatures; feature++) {
            for (int i = 0; i < n; i++) order[i] = rows[i];
            final int f = feature;
            // Stable sort keeps ties in row order so identical inputs give identical trees
            Arrays.sort(order, Comparator.comparingDouble(r -> data[r][f]));

            double leftSum = 0.0;
            for (int i = 0; i < n - 1; i++) {
                leftSum += targets[order[i]];
                int leftCount = i + 1;
                int rightCount = n - leftCount;
                if (leftCount < minSamplesLeaf) continue;
                if (rightCount < minSamplesLeaf) break;

                double current = data[order[i]][f];
                double next = data[order[i + 1]][f];
                if (current >= next) continue;

                double rightSum = sum - leftSum;
                double gain = leftSum * leftSum / leftCount + rightSum * rightSum / rightCount - parentScore;
                if (gain > bestGain) {
                    bestGain = gain;
                    bestFeature = f;
                    bestThreshold = current + (next - current) / 2.0;
                }
            }
        }

        if (bestFeature < 0) {
            return RegressionNode.leaf(mean);
        }

        int leftCount = 0;
        for (int row : rows) {
            if (data[row][bestFeature] < bestThreshold) leftCount++;
        }
        int[] leftRows = new int[leftCount];
        int[] rightRows = new int[n - leftCount];
        int li = 0, ri = 0;
        for (int row : rows) {
            if (data[row][bestFeature] < bestThreshold) {
                leftRows[li++] = row;
            } else {
                rightRows[ri++] = row;
            }
        }

        gains[bestFeature] += bestGain;
        RegressionNode left = buildNode(data, targets, leftRows, depth + 1, maxDepth, minSamplesLeaf, gains);
        RegressionNode right = buildNode(data, targets, rightRows, depth + 1, maxDepth, minSamplesLeaf, gains);
        return RegressionNode.internalNode(bestFeature, bestThreshold, left, right);
    }

    public double predict(double[] point) {
        return root.predict(point);
    }

    public RegressionNode getRoot() { return root; }
    public void setRoot(RegressionNode root) { this.root = root; }
}
