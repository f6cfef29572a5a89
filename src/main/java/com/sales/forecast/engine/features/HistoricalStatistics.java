package com.sales.forecast.engine.features;

import java.util.List;

/**
 * Historical mean tables fitted on the reference (training) panel, frozen after fitting.
 *
 * @param globalMean   mean target over the whole reference panel, the fallback for unmatched groups
 * @param sampleCount  number of reference rows the means were computed from
 */
public record HistoricalStatistics(List<AggregateTable> tables, double globalMean, long sampleCount) {

    public HistoricalStatistics {
        tables = List.copyOf(tables);
    }

    public AggregateTable table(AggregateGrouping grouping) {
        for (AggregateTable table : tables) {
            if (table.grouping() == grouping) return table;
        }
        throw new IllegalStateException("No historical table for grouping " + grouping);
    }
}
