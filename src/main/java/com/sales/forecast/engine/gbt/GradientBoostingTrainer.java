package com.sales.forecast.engine.gbt;

import com.sales.forecast.config.ForecastProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

/**
 * Squared-error gradient boosting. Each round fits a tree to the current residuals on a
 * row subsample. With a validation set, boosting stops once validation error has not improved
 * for {@code earlyStoppingRounds} rounds and the ensemble is cut back to its best round.
 */
@Component
public class GradientBoostingTrainer implements ModelTrainer {

    private static final Logger log = LoggerFactory.getLogger(GradientBoostingTrainer.class);

    private final ForecastProperties.Model config;

    public GradientBoostingTrainer(ForecastProperties properties) {
        this.config = properties.getModel();
    }

    @Override
    public ForecastModel fit(List<String> featureNames, double[][] features, double[] targets,
                             ValidationSet validation) {
        if (features.length == 0) {
            throw new IllegalArgumentException("Cannot train on an empty feature matrix");
        }
        if (features.length != targets.length) {
            throw new IllegalArgumentException("Rows and targets differ: " + features.length + " vs " + targets.length);
        }

        int n = features.length;
        double baseScore = 0.0;
        for (double y : targets) baseScore += y;
        baseScore /= n;

        double learningRate = config.getLearningRate();
        int sampleSize = Math.max(1, (int) Math.round(n * Math.min(1.0, config.getSubsample())));
        Random random = new Random(config.getSeed());

        double[] predictions = new double[n];
        Arrays.fill(predictions, baseScore);
        double[] residuals = new double[n];

        boolean validating = validation != null && !validation.isEmpty();
        double[] validationPredictions = null;
        if (validating) {
            validationPredictions = new double[validation.targets().length];
            Arrays.fill(validationPredictions, baseScore);
        }

        List<RegressionTree> trees = new ArrayList<>();
        List<double[]> gainsPerTree = new ArrayList<>();
        double bestError = Double.POSITIVE_INFINITY;
        int bestIteration = -1;

        for (int round = 0; round < config.getNumTrees(); round++) {
            for (int i = 0; i < n; i++) residuals[i] = targets[i] - predictions[i];

            double[] gains = new double[featureNames.size()];
            int[] rows = subsample(n, sampleSize, random);
            RegressionTree tree = RegressionTree.build(features, residuals, rows,
                    config.getMaxDepth(), config.getMinSamplesLeaf(), gains);
            trees.add(tree);
            gainsPerTree.add(gains);

            for (int i = 0; i < n; i++) predictions[i] += learningRate * tree.predict(features[i]);

            if (validating) {
                double error = 0.0;
                for (int i = 0; i < validationPredictions.length; i++) {
                    validationPredictions[i] += learningRate * tree.predict(validation.features()[i]);
                    double diff = validation.targets()[i] - validationPredictions[i];
                    error += diff * diff;
                }
                error /= validationPredictions.length;

                if (error < bestError) {
                    bestError = error;
                    bestIteration = round;
                } else if (round - bestIteration >= config.getEarlyStoppingRounds()) {
                    log.info("Early stopping at round {}; best round {} with validation MSE {}",
                            round + 1, bestIteration + 1, String.format("%.4f", bestError));
                    break;
                }
            }
        }

        int kept = validating ? bestIteration + 1 : trees.size();
        double[] featureGains = new double[featureNames.size()];
        for (int t = 0; t < kept; t++) {
            double[] gains = gainsPerTree.get(t);
            for (int f = 0; f < featureGains.length; f++) featureGains[f] += gains[f];
        }

        log.info("Trained gradient boosted model: {} trees, {} samples, {} features",
                kept, n, featureNames.size());

        return new GradientBoostedModel(baseScore, learningRate, trees.subList(0, kept),
                featureNames, featureGains, kept);
    }

    private static int[] subsample(int n, int size, Random random) {
        int[] indices = new int[n];
        for (int i = 0; i < n; i++) indices[i] = i;
        if (size >= n) return indices;
        // Fisher-Yates shuffle on indices
        for (int i = 0; i < size; i++) {
            int j = i + random.nextInt(n - i);
            int tmp = indices[i];
            indices[i] = indices[j];
            indices[j] = tmp;
        }
        return Arrays.copyOf(indices, size);
    }
}
