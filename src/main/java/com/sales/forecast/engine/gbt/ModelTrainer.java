package com.sales.forecast.engine.gbt;

import java.util.List;

public interface ModelTrainer {

    default ForecastModel fit(List<String> featureNames, double[][] features, double[] targets) {
        return fit(featureNames, features, targets, null);
    }

    /**
     * @param validation held-out rows used for early stopping, or null to train every round
     */
    ForecastModel fit(List<String> featureNames, double[][] features, double[] targets, ValidationSet validation);
}
