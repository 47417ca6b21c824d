package com.market.anomaly.engine.classifier;

import java.util.Arrays;
import java.util.Comparator;
import java.util.Random;

/**
 * Weighted CART classification tree for the binary anomaly target.
 *
 * Splits minimise weighted Gini impurity. At each node up to {@code maxFeatures}
 * non-constant features are tried, drawn in random order.
 */
public class DecisionTree {

    private TreeNode root;

    public DecisionTree() {}

    public DecisionTree(TreeNode root) {
        this.root = root;
    }

    /**
     * Grow a tree on the rows with positive weight.
     *
     * @param features    full training matrix
     * @param labels      class per row (0 or 1)
     * @param weights     per-row sample weight; rows with weight 0 are not part of this tree
     * @param maxDepth    depth limit (root is depth 0)
     * @param minSamplesSplit minimum distinct rows a node needs to be split
     * @param maxFeatures number of non-constant candidate features per split
     * @param random      source of feature order
     * @param importances accumulator receiving the impurity decrease of every split, per feature
     */
    public static DecisionTree grow(double[][] features, int[] labels, double[] weights,
                                    int maxDepth, int minSamplesSplit, int maxFeatures,
                                    Random random, double[] importances) {
        int count = 0;
        for (double w : weights) if (w > 0) count++;
        int[] rows = new int[count];
        int k = 0;
        for (int i = 0; i < weights.length; i++) {
            if (weights[i] > 0) rows[k++] = i;
        }
        Grower grower = new Grower(features, labels, weights, maxDepth, minSamplesSplit,
                maxFeatures, random, importances);
        return new DecisionTree(grower.grow(rows, 0));
    }

    public double positiveProbability(double[] point) {
        return root.positiveProbability(point);
    }

    public TreeNode getRoot() { return root; }
    public void setRoot(TreeNode root) { this.root = root; }

    private static final class Grower {

        private final double[][] x;
        private final int[] y;
        private final double[] w;
        private final int maxDepth;
        private final int minSamplesSplit;
        private final int maxFeatures;
        private final Random random;
        private final double[] importances;

        Grower(double[][] x, int[] y, double[] w, int maxDepth, int minSamplesSplit,
               int maxFeatures, Random random, double[] importances) {
            this.x = x;
            this.y = y;
            this.w = w;
            this.maxDepth = maxDepth;
            this.minSamplesSplit = minSamplesSplit;
            this.maxFeatures = maxFeatures;
            this.random = random;
            this.importances = importances;
        }

        TreeNode grow(int[] rows, int depth) {
            double w0 = 0, w1 = 0;
            for (int row : rows) {
                if (y[row] == 1) w1 += w[row];
                else w0 += w[row];
            }
            double total = w0 + w1;
            double positiveFraction = total > 0 ? w1 / total : 0.0;

            if (depth >= maxDepth || rows.length < minSamplesSplit || w0 == 0 || w1 == 0) {
                return TreeNode.leaf(positiveFraction);
            }

            double parentImpurity = total * gini(w0, w1);
            int bestFeature = -1;
            double bestThreshold = 0;
            double bestDecrease = -1;

            int numFeatures = x[0].length;
            int[] order = shuffledFeatures(numFeatures);
            int visited = 0;

            for (int f : order) {
                if (visited >= maxFeatures) break;
                Integer[] sorted = sortByFeature(rows, f);
                double lo = x[sorted[0]][f];
                double hi = x[sorted[sorted.length - 1]][f];
                if (lo >= hi) continue; // constant here, does not count toward maxFeatures
                visited++;

                double left0 = 0, left1 = 0;
                for (int i = 0; i < sorted.length - 1; i++) {
                    int row = sorted[i];
                    if (y[row] == 1) left1 += w[row];
                    else left0 += w[row];

                    double current = x[row][f];
                    double next = x[sorted[i + 1]][f];
                    if (current == next) continue;

                    double right0 = w0 - left0;
                    double right1 = w1 - left1;
                    double decrease = parentImpurity
                            - (left0 + left1) * gini(left0, left1)
                            - (right0 + right1) * gini(right0, right1);
                    if (decrease > bestDecrease) {
                        bestDecrease = decrease;
                        bestFeature = f;
                        bestThreshold = midpoint(current, next);
                    }
                }
            }

            if (bestFeature < 0) {
                return TreeNode.leaf(positiveFraction);
            }

            importances[bestFeature] += Math.max(0.0, bestDecrease);

            int leftCount = 0;
            for (int row : rows) {
                if (x[row][bestFeature] <= bestThreshold) leftCount++;
            }
            int[] leftRows = new int[leftCount];
            int[] rightRows = new int[rows.length - leftCount];
            int li = 0, ri = 0;
            for (int row : rows) {
                if (x[row][bestFeature] <= bestThreshold) leftRows[li++] = row;
                else rightRows[ri++] = row;
            }

            TreeNode left = grow(leftRows, depth + 1);
            TreeNode right = grow(rightRows, depth + 1);
            return TreeNode.split(bestFeature, bestThreshold, left, right);
        }

        private int[] shuffledFeatures(int numFeatures) {
            int[] order = new int[numFeatures];
            for (int i = 0; i < numFeatures; i++) order[i] = i;
            // Fisher-Yates
            for (int i = numFeatures - 1; i > 0; i--) {
                int j = random.nextInt(i + 1);
                int tmp = order[i];
                order[i] = order[j];
                order[j] = tmp;
            }
            return order;
        }

        private Integer[] sortByFeature(int[] rows, int feature) {
            Integer[] sorted = new Integer[rows.length];
            for (int i = 0; i < rows.length; i++) sorted[i] = rows[i];
            Arrays.sort(sorted, Comparator.comparingDouble(row -> x[row][feature]));
            return sorted;
        }
    }

    static double gini(double w0, double w1) {
        double total = w0 + w1;
        if (total <= 0) return 0.0;
        double p0 = w0 / total;
        double p1 = w1 / total;
        return 1.0 - p0 * p0 - p1 * p1;
    }

    // Halfway between two adjacent distinct values, kept strictly below the upper one
    static double midpoint(double lower, double upper) {
        double mid = lower + (upper - lower) / 2.0;
        if (mid >= upper || Double.isInfinite(mid)) {
            mid = lower;
        }
        return mid;
    }
}
