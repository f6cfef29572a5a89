package com.sales.forecast.engine.features;

import com.sales.forecast.model.FeatureMatrix;

public record FitResult(FeatureMatrix features, LearnedStatistics learned) {
}
