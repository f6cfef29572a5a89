package com.sales.forecast.engine.features;

/**
 * Persisted output of a training run besides the model itself.
 */
public record TrainingArtifacts(LearnedStatistics learned, TrailingHistory history) {
}
