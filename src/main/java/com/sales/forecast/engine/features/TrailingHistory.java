package com.sales.forecast.engine.features;

import com.sales.forecast.model.Panel;
import com.sales.forecast.model.PanelRecord;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * The last {@code depth} observations of every entity, persisted at training time. Inference
 * computes lags, rolling means and carried-forward covariates from it.
 */
public record TrailingHistory(int depth, List<PanelRecord> records) {

    public TrailingHistory {
        records = List.copyOf(records);
    }

    public static TrailingHistory capture(Panel panel, int depth) {
        List<PanelRecord> kept = new ArrayList<>();
        for (List<PanelRecord> series : panel.byEntity().values()) {
            kept.addAll(series.subList(Math.max(0, series.size() - depth), series.size()));
        }
        return new TrailingHistory(depth, kept);
    }

    public Panel toPanel() {
        return Panel.of(records);
    }

    public LocalDate lastDate() {
        return toPanel().maxDate();
    }
}
