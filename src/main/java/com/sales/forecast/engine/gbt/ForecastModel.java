package com.sales.forecast.engine.gbt;

import com.sales.forecast.model.FeatureImportance;

import java.util.List;

/**
 * A trained regressor over a fixed, ordered list of feature columns.
 */
public interface ForecastModel {

    /**
     * @param features one row per sample, columns in {@link #featureNames()} order
     */
    double[] predict(double[][] features);

    List<String> featureNames();

    /**
     * Importance per feature, highest first.
     */
    List<FeatureImportance> featureImportances();
}
