package com.market.anomaly.engine.classifier;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Bagged ensemble of {@link DecisionTree}s with balanced class weights.
 *
 * Anomalies are rare, so each class is weighted by {@code n / (2 * n_class)}:
 * both classes contribute the same total weight to every split decision.
 * Each tree is grown on a bootstrap sample and considers {@code floor(sqrt(d))}
 * features per split. Probability is the mean of the trees' leaf probabilities.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class RandomForestClassifier implements AnomalyClassifier {

    @JsonProperty("numTrees")
    private int numTrees;

    @JsonProperty("maxDepth")
    private int maxDepth;

    @JsonProperty("minSamplesSplit")
    private int minSamplesSplit;

    @JsonProperty("randomSeed")
    private long randomSeed;

    @JsonProperty("decisionThreshold")
    private double decisionThreshold;

    @JsonProperty("featureCount")
    private int featureCount;

    @JsonProperty("trees")
    private List<DecisionTree> trees = new ArrayList<>();

    @JsonProperty("importances")
    private double[] importances = new double[0];

    public RandomForestClassifier() {}

    /**
     * @param numTrees          number of trees in the ensemble (typically 100)
     * @param maxDepth          maximum tree depth (typically 10)
     * @param minSamplesSplit   minimum rows a node needs before it may split (at least 2)
     * @param randomSeed        seed for bootstrap sampling and feature order
     * @param decisionThreshold probability above which a row is predicted anomalous
     */
    public RandomForestClassifier(int numTrees, int maxDepth, int minSamplesSplit,
                                  long randomSeed, double decisionThreshold) {
        if (numTrees < 1) throw new IllegalArgumentException("numTrees must be >= 1, got " + numTrees);
        if (maxDepth < 1) throw new IllegalArgumentException("maxDepth must be >= 1, got " + maxDepth);
        this.numTrees = numTrees;
        this.maxDepth = maxDepth;
        this.minSamplesSplit = Math.max(2, minSamplesSplit);
        this.randomSeed = randomSeed;
        this.decisionThreshold = decisionThreshold;
    }

    @Override
    public void fit(double[][] features, int[] labels) {
        if (features == null || features.length == 0) {
            throw new IllegalArgumentException("Cannot fit on an empty feature matrix");
        }
        if (labels == null || labels.length != features.length) {
            throw new IllegalArgumentException(String.format("Found %d feature rows but %d labels",
                    features.length, labels == null ? 0 : labels.length));
        }
        int d = features[0].length;
        if (d == 0) {
            throw new IllegalArgumentException("Feature matrix has no columns");
        }
        int n = features.length;
        int[] classCounts = new int[2];
        for (int i = 0; i < n; i++) {
            if (features[i].length != d) {
                throw new IllegalArgumentException("Row " + i + " has " + features[i].length
                        + " features, expected " + d);
            }
            if (labels[i] != 0 && labels[i] != 1) {
                throw new IllegalArgumentException("Labels must be 0 or 1, found " + labels[i] + " at row " + i);
            }
            classCounts[labels[i]]++;
        }

        double[] classWeights = new double[2];
        for (int c = 0; c < 2; c++) {
            classWeights[c] = classCounts[c] > 0 ? (double) n / (2.0 * classCounts[c]) : 0.0;
        }

        int maxFeatures = Math.max(1, (int) Math.sqrt(d));
        Random random = new Random(randomSeed);
        List<DecisionTree> grown = new ArrayList<>(numTrees);
        double[] summedImportances = new double[d];

        for (int t = 0; t < numTrees; t++) {
            Random treeRandom = new Random(random.nextLong());
            double[] weights = bootstrapWeights(labels, classWeights, treeRandom);
            double[] treeImportances = new double[d];

            grown.add(DecisionTree.grow(features, labels, weights, maxDepth, minSamplesSplit,
                    maxFeatures, treeRandom, treeImportances));

            double treeTotal = sum(treeImportances);
            if (treeTotal > 0) {
                for (int f = 0; f < d; f++) summedImportances[f] += treeImportances[f] / treeTotal;
            }
        }

        double total = sum(summedImportances);
        if (total > 0) {
            for (int f = 0; f < d; f++) summedImportances[f] /= total;
        }

        // Assign only once fitting has fully succeeded
        this.trees = grown;
        this.importances = summedImportances;
        this.featureCount = d;
    }

    @Override
    public double[] predictProbability(double[][] features) {
        requireFitted();
        double[] probabilities = new double[features.length];
        for (int i = 0; i < features.length; i++) {
            double[] point = features[i];
            if (point.length != featureCount) {
                throw new IllegalArgumentException("Row " + i + " has " + point.length
                        + " features, model was trained on " + featureCount);
            }
            double sum = 0.0;
            for (DecisionTree tree : trees) {
                sum += tree.positiveProbability(point);
            }
            probabilities[i] = sum / trees.size();
        }
        return probabilities;
    }

    @Override
    public int[] predict(double[][] features) {
        double[] probabilities = predictProbability(features);
        int[] predictions = new int[probabilities.length];
        for (int i = 0; i < probabilities.length; i++) {
            predictions[i] = probabilities[i] > decisionThreshold ? 1 : 0;
        }
        return predictions;
    }

    @Override
    public double[] featureImportances() {
        requireFitted();
        return importances.clone();
    }

    @JsonIgnore
    public boolean isFitted() {
        return trees != null && !trees.isEmpty();
    }

    private void requireFitted() {
        if (!isFitted()) {
            throw new IllegalStateException("RandomForestClassifier has not been fitted");
        }
    }

    private static double[] bootstrapWeights(int[] labels, double[] classWeights, Random random) {
        int n = labels.length;
        int[] draws = new int[n];
        for (int i = 0; i < n; i++) {
            draws[random.nextInt(n)]++;
        }
        double[] weights = new double[n];
        for (int i = 0; i < n; i++) {
            weights[i] = draws[i] * classWeights[labels[i]];
        }
        return weights;
    }

    private static double sum(double[] values) {
        double total = 0.0;
        for (double v : values) total += v;
        return total;
    }

    public int getNumTrees() { return numTrees; }
    public int getMaxDepth() { return maxDepth; }
    public int getMinSamplesSplit() { return minSamplesSplit; }
    public long getRandomSeed() { return randomSeed; }
    public double getDecisionThreshold() { return decisionThreshold; }
    public int getFeatureCount() { return featureCount; }
    public List<DecisionTree> getTrees() { return trees; }
}
