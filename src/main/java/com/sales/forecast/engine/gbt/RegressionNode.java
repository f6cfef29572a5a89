package com.sales.forecast.engine.gbt;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public class RegressionNode {

    @JsonProperty("f")
    private int splitFeature;

    @JsonProperty("v")
    private double splitValue;

    @JsonProperty("l")
    private RegressionNode left;

    @JsonProperty("r")
    private RegressionNode right;

    @JsonProperty("w")
    private double leafValue; // mean residual of the samples that reached this leaf

    @JsonProperty("e")
    private boolean external; // true if this is a leaf node

    public RegressionNode() {}

    public static RegressionNode internalNode(int splitFeature, double splitValue,
                                              RegressionNode left, RegressionNode right) {
        RegressionNode node = new RegressionNode();
        node.splitFeature = splitFeature;
        node.splitValue = splitValue;
        node.left = left;
        node.right = right;
        node.external = false;
        return node;
    }

    public static RegressionNode leaf(double value) {
        RegressionNode node = new RegressionNode();
        node.leafValue = value;
        node.external = true;
        return node;
    }

    public double predict(double[] point) {
        RegressionNode node = this;
        while (!node.external) {
            node = point[node.splitFeature] < node.splitValue ? node.left : node.right;
        }
        return node.leafValue;
    }

    // Getters for serialization
    public int getSplitFeature() { return splitFeature; }
    public double getSplitValue() { return splitValue; }
    public RegressionNode getLeft() { return left; }
    public RegressionNode getRight() { return right; }
    public double getLeafValue() { return leafValue; }
    public boolean isExternal() { return external; }
}
