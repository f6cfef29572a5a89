package com.sales.forecast.model;

import java.time.LocalDate;
import java.util.List;

/**
 * Outcome of one training run.
 *
 * @param droppedTrainRows  training rows excluded because a feature was undefined
 * @param droppedTestRows   test rows excluded for the same reason
 * @param folds             cross-validation folds, empty when cross-validation was not requested
 */
public record TrainingReport(DatasetSummary summary,
                             LocalDate cutoff,
                             int trainRows,
                             int testRows,
                             int droppedTrainRows,
                             int droppedTestRows,
                             BaselineComparison evaluation,
                             List<FeatureImportance> importances,
                             List<CrossValidationFold> folds) {

    public TrainingReport {
        importances = List.copyOf(importances);
        folds = List.copyOf(folds);
    }
}
