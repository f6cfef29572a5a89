package com.sales.forecast.engine.features;

import com.sales.forecast.model.PanelSchema;

import java.util.List;

/**
 * Everything the pipeline learned in fit mode. Immutable; shared read-only by every later
 * transform call.
 *
 * @param featureColumns the canonical column list at fit time, checked on every transform
 */
public record LearnedStatistics(FeatureSettings settings,
                                PanelSchema schema,
                                HistoricalStatistics statistics,
                                EntityEncoders encoders,
                                List<String> featureColumns) {

    public LearnedStatistics {
        featureColumns = List.copyOf(featureColumns);
    }
}
