package com.sales.forecast.model;

public record FeatureImportance(String feature, double importance) {
}
