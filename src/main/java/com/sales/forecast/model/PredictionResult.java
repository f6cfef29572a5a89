package com.sales.forecast.model;

import java.util.List;
import java.util.Set;

/**
 * @param droppedRows         rows that could not be predicted because a feature was undefined
 * @param unresolvedEntities  entities whose covariates could not be carried forward
 */
public record PredictionResult(List<Prediction> predictions, int droppedRows, Set<EntityKey> unresolvedEntities) {

    public PredictionResult {
        predictions = List.copyOf(predictions);
        unresolvedEntities = Set.copyOf(unresolvedEntities);
    }
}
