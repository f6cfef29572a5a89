package com.sales.forecast.engine.features;

import com.sales.forecast.exception.SchemaException;
import com.sales.forecast.model.Panel;
import com.sales.forecast.model.PanelRecord;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Grouped historical means of the target.
 *
 * Fit mode runs on the reference panel only. Transform mode joins the frozen tables onto any
 * panel by group key and never looks at that panel's targets.
 */
public class HistoricalAggregateGenerator {

    public static List<String> columnNames(String target) {
        List<String> names = new ArrayList<>();
        for (AggregateGrouping grouping : AggregateGrouping.values()) {
            names.add(grouping.columnName(target));
        }
        return names;
    }

    /**
     * @throws SchemaException if the reference panel is empty or has rows without a target
     */
    public HistoricalStatistics fit(Panel reference, String target) {
        if (reference.isEmpty()) {
            throw new SchemaException("Cannot fit historical means on an empty panel.");
        }

        double total = 0.0;
        for (PanelRecord record : reference.records()) {
            if (!record.hasTarget()) {
                throw new SchemaException(String.format("Reference row %s on %s has no target value.",
                        record.getEntityKey(), record.getDate()));
            }
            total += record.getTarget();
        }

        List<AggregateTable> tables = new ArrayList<>();
        for (AggregateGrouping grouping : AggregateGrouping.values()) {
            Map<String, double[]> sums = new TreeMap<>();
            for (PanelRecord record : reference.records()) {
                double[] acc = sums.computeIfAbsent(AggregateTable.key(grouping.keyOf(record)), k -> new double[2]);
                acc[0] += record.getTarget();
                acc[1] += 1;
            }
            Map<String, Double> means = new TreeMap<>();
            sums.forEach((key, acc) -> means.put(key, acc[0] / acc[1]));
            tables.add(new AggregateTable(grouping, grouping.columnName(target), means));
        }

        return new HistoricalStatistics(tables, total / reference.size(), reference.size());
    }

    /**
     * Joins each table onto the records. Unmatched groups get NaN or the global mean,
     * depending on {@code fallback}.
     */
    public Map<String, double[]> transform(List<PanelRecord> records, HistoricalStatistics statistics,
                                           AggregateFallback fallback) {
        Map<String, double[]> columns = new LinkedHashMap<>();
        double missing = fallback == AggregateFallback.GLOBAL_MEAN ? statistics.globalMean() : Double.NaN;

        for (AggregateTable table : statistics.tables()) {
            double[] values = new double[records.size()];
            for (int i = 0; i < records.size(); i++) {
                Optional<Double> mean = table.lookup(table.grouping().keyOf(records.get(i)));
                values[i] = mean.orElse(missing);
            }
            columns.put(table.column(), values);
        }
        return columns;
    }
}
