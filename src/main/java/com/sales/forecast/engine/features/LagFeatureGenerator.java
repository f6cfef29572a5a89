package com.sales.forecast.engine.features;

import com.sales.forecast.model.EntityKey;
import com.sales.forecast.model.Panel;
import com.sales.forecast.model.PanelRecord;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Backward-looking lag and rolling-mean features, computed within each entity's own
 * date-ordered series.
 *
 * <pre>
 *   {target}_lag_L[t]            = target[t - L]
 *   {target}_rolling_mean_W[t]   = mean(target[t - W] .. target[t - 1])
 * </pre>
 *
 * Offsets are positions in the entity's series, not calendar distances. The rolling window
 * stops at t - 1, so a row's own target never feeds its features. A value is NaN when the
 * series has too few earlier rows or when any referenced target is unknown.
 */
public class LagFeatureGenerator {

    private final String target;
    private final List<Integer> lags;
    private final List<Integer> rollingWindows;

    public LagFeatureGenerator(FeatureSettings settings) {
        this.target = settings.target();
        this.lags = settings.lags();
        this.rollingWindows = settings.rollingWindows();
    }

    public static String lagColumn(String target, int lag) {
        return target + "_lag_" + lag;
    }

    public static String rollingMeanColumn(String target, int window) {
        return target + "_rolling_mean_" + window;
    }

    public List<String> columnNames() {
        List<String> names = new ArrayList<>(lags.size() + rollingWindows.size());
        for (int lag : lags) names.add(lagColumn(target, lag));
        for (int window : rollingWindows) names.add(rollingMeanColumn(target, window));
        return names;
    }

    /**
     * Computes every lag and rolling column for the given records.
     *
     * @param records panel records strictly ordered by (agency, sku, date)
     * @return column name to values, aligned with {@code records}
     * @throws com.sales.forecast.exception.SchemaException if the records are not ordered
     */
    public Map<String, double[]> generate(List<PanelRecord> records) {
        Panel.assertOrdered(records);

        int n = records.size();
        Map<String, double[]> columns = new LinkedHashMap<>();
        for (String name : columnNames()) columns.put(name, new double[n]);

        int start = 0;
        while (start < n) {
            EntityKey entity = records.get(start).getEntityKey();
            int end = start;
            while (end < n && records.get(end).getEntityKey().equals(entity)) end++;
            fillSeries(records, start, end, columns);
            start = end;
        }
        return columns;
    }

    private void fillSeries(List<PanelRecord> records, int start, int end, Map<String, double[]> columns) {
        for (int t = start; t < end; t++) {
            for (int lag : lags) {
                int source = t - lag;
                columns.get(lagColumn(target, lag))[t] =
                        source >= start ? targetOf(records.get(source)) : Double.NaN;
            }
            for (int window : rollingWindows) {
                columns.get(rollingMeanColumn(target, window))[t] =
                        t - window >= start ? windowMean(records, t - window, t) : Double.NaN;
            }
        }
    }

    // Summed in date order at every position so a value never depends on where the series starts
    private static double windowMean(List<PanelRecord> records, int fromInclusive, int toExclusive) {
        double sum = 0.0;
        for (int i = fromInclusive; i < toExclusive; i++) {
            double value = targetOf(records.get(i));
            if (Double.isNaN(value)) return Double.NaN;
            sum += value;
        }
        return sum / (toExclusive - fromInclusive);
    }

    private static double targetOf(PanelRecord record) {
        Double value = record.getTarget();
        return value == null ? Double.NaN : value;
    }
}
