package com.sales.forecast.engine.features;

import com.sales.forecast.model.EntityKey;
import com.sales.forecast.model.Panel;
import com.sales.forecast.model.PanelRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Fills missing covariates of inference rows with the entity's most recent known value.
 *
 * Only history rows dated strictly before the inference row are considered. The target is
 * never filled. Entities without usable history keep the gap and are reported back.
 */
@Component
public class HistoryCarryForward {

    private static final Logger log = LoggerFactory.getLogger(HistoryCarryForward.class);

    public CarryForwardResult fill(Panel inference, Panel history, List<String> columns) {
        Map<EntityKey, List<PanelRecord>> seriesByEntity = history.byEntity();
        List<PanelRecord> filled = new ArrayList<>(inference.size());
        TreeSet<EntityKey> unresolved = new TreeSet<>();
        int filledValues = 0;

        for (PanelRecord record : inference.records()) {
            List<PanelRecord> series = seriesByEntity.getOrDefault(record.getEntityKey(), List.of());
            PanelRecord current = record;
            for (String column : columns) {
                if (current.exogenousValue(column).isPresent()) continue;

                Double last = lastKnownBefore(series, column, record);
                if (last == null) {
                    // Keep the key so the record still declares the column
                    current = current.withExogenous(column, null);
                    unresolved.add(record.getEntityKey());
                } else {
                    current = current.withExogenous(column, last);
                    filledValues++;
                }
            }
            filled.add(current);
        }

        if (!unresolved.isEmpty()) {
            log.warn("No history to carry forward covariates for {} entities: {}", unresolved.size(), unresolved);
        }
        log.debug("Carried forward {} covariate values into {} rows", filledValues, inference.size());

        return new CarryForwardResult(Panel.of(filled), filledValues, unresolved);
    }

    private static Double lastKnownBefore(List<PanelRecord> series, String column, PanelRecord row) {
        for (int i = series.size() - 1; i >= 0; i--) {
            PanelRecord candidate = series.get(i);
            if (!candidate.getDate().isBefore(row.getDate())) continue;
            Double value = candidate.getExogenous().get(column);
            if (value != null) return value;
        }
        return null;
    }
}
