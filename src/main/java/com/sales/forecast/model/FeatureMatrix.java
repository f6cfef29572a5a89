package com.sales.forecast.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.function.IntPredicate;

/**
 * Assembled features: one row per panel record, one column per canonical feature name.
 * Undefined values (missing history, unmatched aggregates, unresolved covariates) are NaN.
 * The matrix copies the rows it is given and hands out copies, so it never shares arrays.
 */
public final class FeatureMatrix {

    private final List<String> columns;
    private final List<PanelRecord> records;
    private final double[][] values;

    public FeatureMatrix(List<String> columns, List<PanelRecord> records, double[][] values) {
        if (records.size() != values.length) {
            throw new IllegalArgumentException("Row count mismatch: " + records.size() + " records, "
                    + values.length + " feature rows");
        }
        this.columns = List.copyOf(columns);
        this.records = List.copyOf(records);
        this.values = new double[values.length][];
        for (int i = 0; i < values.length; i++) {
            this.values[i] = Arrays.copyOf(values[i], values[i].length);
        }
    }

    public List<String> columns() {
        return columns;
    }

    public List<PanelRecord> records() {
        return records;
    }

    public int rowCount() {
        return values.length;
    }

    public int columnIndex(String column) {
        int idx = columns.indexOf(column);
        if (idx < 0) throw new IllegalArgumentException("Unknown feature column: " + column);
        return idx;
    }

    public double value(int row, String column) {
        return values[row][columnIndex(column)];
    }

    public double[] row(int row) {
        return Arrays.copyOf(values[row], values[row].length);
    }

    public double[] column(String column) {
        int idx = columnIndex(column);
        double[] out = new double[values.length];
        for (int i = 0; i < values.length; i++) out[i] = values[i][idx];
        return out;
    }

    public double[][] toArray() {
        double[][] copy = new double[values.length][];
        for (int i = 0; i < values.length; i++) copy[i] = row(i);
        return copy;
    }

    /**
     * Target per row, NaN where the record has no target.
     */
    public double[] targets() {
        double[] y = new double[records.size()];
        for (int i = 0; i < y.length; i++) {
            Double target = records.get(i).getTarget();
            y[i] = target == null ? Double.NaN : target;
        }
        return y;
    }

    public boolean isComplete(int row) {
        for (double v : values[row]) {
            if (Double.isNaN(v)) return false;
        }
        return true;
    }

    public FeatureMatrix completeRows() {
        return filter(this::isComplete);
    }

    public int incompleteRowCount() {
        int count = 0;
        for (int i = 0; i < values.length; i++) {
            if (!isComplete(i)) count++;
        }
        return count;
    }

    public FeatureMatrix filter(IntPredicate keep) {
        List<PanelRecord> keptRecords = new ArrayList<>();
        List<double[]> keptValues = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            if (keep.test(i)) {
                keptRecords.add(records.get(i));
                keptValues.add(values[i]);
            }
        }
        return new FeatureMatrix(columns, keptRecords, keptValues.toArray(new double[0][]));
    }

    public FeatureMatrix slice(int fromInclusive, int toExclusive) {
        return filter(i -> i >= fromInclusive && i < toExclusive);
    }

    /**
     * Rows reordered by date; rows sharing a date keep their relative order.
     */
    public FeatureMatrix sortedByDate() {
        Integer[] order = new Integer[values.length];
        for (int i = 0; i < order.length; i++) order[i] = i;
        Arrays.sort(order, Comparator.comparing(i -> records.get(i).getDate()));

        List<PanelRecord> sortedRecords = new ArrayList<>(order.length);
        double[][] sortedValues = new double[order.length][];
        for (int i = 0; i < order.length; i++) {
            sortedRecords.add(records.get(order[i]));
            sortedValues[i] = values[order[i]];
        }
        return new FeatureMatrix(columns, sortedRecords, sortedValues);
    }
}
