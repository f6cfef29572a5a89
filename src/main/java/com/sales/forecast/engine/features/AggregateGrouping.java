package com.sales.forecast.engine.features;

import com.sales.forecast.model.PanelRecord;

import java.util.List;

/**
 * Grouping keys of the historical mean tables.
 */
public enum AggregateGrouping {

    AGENCY_SKU_MONTH("agency_sku_month") {
        @Override
        public List<String> keyOf(PanelRecord record) {
            return List.of(record.getAgency(), record.getSku(), monthOf(record));
        }
    },

    AGENCY_SKU("agency_sku") {
        @Override
        public List<String> keyOf(PanelRecord record) {
            return List.of(record.getAgency(), record.getSku());
        }
    },

    SKU_MONTH("sku_month") {
        @Override
        public List<String> keyOf(PanelRecord record) {
            return List.of(record.getSku(), monthOf(record));
        }
    };

    private final String suffix;

    AggregateGrouping(String suffix) {
        this.suffix = suffix;
    }

    public abstract List<String> keyOf(PanelRecord record);

    public String columnName(String target) {
        return "mean_" + target + "_" + suffix;
    }

    private static String monthOf(PanelRecord record) {
        return Integer.toString(record.getDate().getMonthValue());
    }
}
