package com.market.anomaly.engine.classifier;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public class TreeNode {

    @JsonProperty("f")
    private int splitFeature;

    @JsonProperty("v")
    private double splitValue;

    @JsonProperty("l")
    private TreeNode left;

    @JsonProperty("r")
    private TreeNode right;

    @JsonProperty("p")
    private double positiveFraction; // weighted share of the anomalous class (leaf nodes)

    @JsonProperty("e")
    private boolean leaf;

    public TreeNode() {}

    public static TreeNode split(int splitFeature, double splitValue, TreeNode left, TreeNode right) {
        TreeNode node = new TreeNode();
        node.splitFeature = splitFeature;
        node.splitValue = splitValue;
        node.left = left;
        node.right = right;
        node.leaf = false;
        return node;
    }

    public static TreeNode leaf(double positiveFraction) {
        TreeNode node = new TreeNode();
        node.positiveFraction = positiveFraction;
        node.leaf = true;
        return node;
    }

    /**
     * Rows with {@code point[splitFeature] <= splitValue} go left.
     */
    public double positiveProbability(double[] point) {
        TreeNode node = this;
        while (!node.leaf) {
            node = point[node.splitFeature] <= node.splitValue ? node.left : node.right;
        }
        return node.positiveFraction;
    }

    // Getters for serialization
    public int getSplitFeature() { return splitFeature; }
    public double getSplitValue() { return splitValue; }
    public TreeNode getLeft() { return left; }
    public TreeNode getRight() { return right; }
    public double getPositiveFraction() { return positiveFraction; }
    public boolean isLeaf() { return leaf; }
}
