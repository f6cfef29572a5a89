package com.sales.forecast.engine.features;

import com.sales.forecast.model.PanelSchema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Canonical ordered feature list. Depends only on the derivation rules and the declared schema,
 * never on the columns of the panel being transformed.
 */
public final class FeatureColumns {

    private FeatureColumns() {}

    public static List<String> canonical(FeatureSettings settings, PanelSchema schema) {
        List<String> columns = new ArrayList<>();
        // Identifiers
        columns.add(EntityEncoders.AGENCY_ENCODED);
        columns.add(EntityEncoders.SKU_ENCODED);
        // Calendar
        Collections.addAll(columns, CalendarFeatureGenerator.FEATURE_NAMES);
        // Historical means
        columns.addAll(HistoricalAggregateGenerator.columnNames(settings.target()));
        // Lags and rolling means
        columns.addAll(new LagFeatureGenerator(settings).columnNames());
        // Covariates
        columns.addAll(schema.exogenousColumns());
        return List.copyOf(columns);
    }
}
