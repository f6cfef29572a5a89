package com.sales.forecast.engine.gbt;

import com.sales.forecast.model.FeatureImportance;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Additive ensemble of regression trees fitted to squared-error residuals.
 *
 * prediction(x) = baseScore + learningRate * sum(tree_i(x))
 */
public class GradientBoostedModel implements ForecastModel {

    private double baseScore;
    private double learningRate;
    private List<RegressionTree> trees;
    private List<String> featureNames;
    private double[] featureGains;
    private int bestIteration;

    public GradientBoostedModel() {
        this.trees = new ArrayList<>();
        this.featureNames = new ArrayList<>();
        this.featureGains = new double[0];
    }

    public GradientBoostedModel(double baseScore, double learningRate, List<RegressionTree> trees,
                                List<String> featureNames, double[] featureGains, int bestIteration) {
        this.baseScore = baseScore;
        this.learningRate = learningRate;
        this.trees = new ArrayList<>(trees);
        this.featureNames = new ArrayList<>(featureNames);
        this.featureGains = featureGains;
        this.bestIteration = bestIteration;
    }

    @Override
    public double[] predict(double[][] features) {
        double[] out = new double[features.length];
        for (int i = 0; i < features.length; i++) {
            out[i] = predictOne(features[i]);
        }
        return out;
    }

    public double predictOne(double[] point) {
        if (point.length != featureNames.size()) {
            throw new IllegalArgumentException("Expected " + featureNames.size() + " features, got " + point.length);
        }
        double sum = 0.0;
        for (RegressionTree tree : trees) {
            sum += tree.predict(point);
        }
        return baseScore + learningRate * sum;
    }

    @Override
    public List<String> featureNames() {
        return List.copyOf(featureNames);
    }

    /**
     * Total squared-error reduction contributed by each feature, normalised to sum to 1.
     */
    @Override
    public List<FeatureImportance> featureImportances() {
        double total = 0.0;
        for (double gain : featureGains) total += gain;

        List<FeatureImportance> importances = new ArrayList<>(featureNames.size());
        for (int i = 0; i < featureNames.size(); i++) {
            double gain = i < featureGains.length ? featureGains[i] : 0.0;
            importances.add(new FeatureImportance(featureNames.get(i), total > 0 ? gain / total : 0.0));
        }
        importances.sort(Comparator.comparingDouble(FeatureImportance::importance).reversed());
        return importances;
    }

    // Getters/setters for serialization
    public double getBaseScore() { return baseScore; }
    public void setBaseScore(double baseScore) { this.baseScore = baseScore; }
    public double getLearningRate() { return learningRate; }
    public void setLearningRate(double learningRate) { this.learningRate = learningRate; }
    public List<RegressionTree> getTrees() { return trees; }
    public void setTrees(List<RegressionTree> trees) { this.trees = trees; }
    public List<String> getFeatureNames() { return featureNames; }
    public void setFeatureNames(List<String> featureNames) { this.featureNames = featureNames; }
    public double[] getFeatureGains() { return featureGains; }
    public void setFeatureGains(double[] featureGains) { this.featureGains = featureGains; }
    public int getBestIteration() { return bestIteration; }
    public void setBestIteration(int bestIteration) { this.bestIteration = bestIteration; }
}
