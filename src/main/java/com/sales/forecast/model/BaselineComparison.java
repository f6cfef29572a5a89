package com.sales.forecast.model;

/**
 * Model metrics next to the historical-mean baseline. Improvements are percentages
 * of the baseline value and are null where the baseline metric is zero or absent.
 */
public record BaselineComparison(ForecastMetrics model,
                                 ForecastMetrics baseline,
                                 Double maeImprovementPct,
                                 Double rmseImprovementPct,
                                 Double mapeImprovementPct) {
}
