package com.sales.forecast.exception;

import java.util.List;

public class FeatureSchemaMismatchException extends ForecastException {
    public FeatureSchemaMismatchException(List<String> expected, List<String> actual) {
        super("FEATURE_SCHEMA_MISMATCH",
              "Feature columns " + actual + " do not match the training columns " + expected + ".");
    }
}
