package com.sales.forecast.engine.features;

/**
 * Value given to a historical-mean feature when the row's group never occurred in the reference panel.
 */
public enum AggregateFallback {
    /** Leave the feature undefined; the row is excluded from fitting and prediction. */
    LEAVE_NULL,
    /** Use the global target mean of the reference panel. */
    GLOBAL_MEAN
}
