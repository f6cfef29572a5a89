package com.sales.forecast.model;

/**
 * Error metrics of a prediction vector against actuals.
 *
 * @param mape mean absolute percentage error over non-zero actuals, in percent;
 *             null when every actual is zero
 */
public record ForecastMetrics(double mae, double rmse, Double mape) {
}
