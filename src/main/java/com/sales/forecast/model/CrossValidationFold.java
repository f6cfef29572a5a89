package com.sales.forecast.model;

public record CrossValidationFold(int fold, int trainSize, int testSize, double mae, double rmse) {
}
