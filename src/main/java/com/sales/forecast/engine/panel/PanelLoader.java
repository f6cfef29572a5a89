package com.sales.forecast.engine.panel;

import com.sales.forecast.config.ForecastProperties;
import com.sales.forecast.engine.features.CalendarFeatureGenerator;
import com.sales.forecast.exception.PanelParseException;
import com.sales.forecast.exception.SchemaException;
import com.sales.forecast.model.DatasetSummary;
import com.sales.forecast.model.Panel;
import com.sales.forecast.model.PanelRecord;
import com.sales.forecast.model.PanelSchema;
import com.sales.forecast.model.RawTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns raw rows into a sorted, validated {@link Panel}.
 *
 * The covariate schema is decided once, by {@link #loadForTraining}: declared (or all numeric)
 * columns minus those holding a single value. Inference loads with that stored schema and
 * never re-evaluates constancy.
 */
@Component
public class PanelLoader {

    private static final Logger log = LoggerFactory.getLogger(PanelLoader.class);
    private static final Set<String> MISSING_TOKENS = Set.of("", "nan", "NaN", "NA", "null");

    private final ForecastProperties.Columns columns;

    public PanelLoader(ForecastProperties properties) {
        this.columns = properties.getColumns();
    }

    /**
     * Fixes the schema from the training data and loads it. Every row must carry a target.
     *
     * @throws SchemaException if required columns are missing, a target is missing or a key repeats
     * @throws PanelParseException if a date or number cannot be parsed
     */
    public LoadedPanel loadForTraining(RawTable table) {
        requireColumns(table, List.of(columns.getAgency(), columns.getSku(), columns.getDate(), columns.getTarget()));

        List<String> candidates = new ArrayList<>();
        if (columns.getExogenous().isEmpty()) {
            for (String header : table.headers()) {
                if (isReserved(header)) continue;
                if (isNumericColumn(table, header)) {
                    candidates.add(header);
                } else {
                    log.warn("Ignoring non-numeric column '{}'", header);
                }
            }
        } else {
            requireColumns(table, columns.getExogenous());
            candidates.addAll(columns.getExogenous());
        }

        List<String> exogenous = new ArrayList<>();
        List<String> constant = new ArrayList<>();
        for (String column : candidates) {
            if (distinctValues(table, column) <= 1) {
                constant.add(column);
            } else {
                exogenous.add(column);
            }
        }
        if (!constant.isEmpty()) {
            log.info("Dropping constant columns: {}", constant);
        }

        PanelSchema schema = new PanelSchema(exogenous, constant);
        return new LoadedPanel(load(table, schema, true), schema);
    }

    /**
     * Loads rows against an already fixed schema. Covariates absent from the table are loaded as
     * missing; the target may be absent unless {@code requireTarget} is set.
     */
    public Panel load(RawTable table, PanelSchema schema, boolean requireTarget) {
        requireColumns(table, List.of(columns.getAgency(), columns.getSku(), columns.getDate()));
        if (requireTarget) requireColumns(table, List.of(columns.getTarget()));

        List<PanelRecord> records = new ArrayList<>(table.rows().size());
        int missingTargets = 0;
        int rowNumber = 0;
        for (Map<String, String> row : table.rows()) {
            rowNumber++;
            String agency = row.get(columns.getAgency());
            String sku = row.get(columns.getSku());
            if (agency == null || agency.isBlank() || sku == null || sku.isBlank()) {
                throw new SchemaException("Row " + rowNumber + " has no agency or SKU.");
            }

            Double target = parseNumber(row.get(columns.getTarget()), rowNumber, columns.getTarget());
            if (target == null) missingTargets++;

            Map<String, Double> exogenous = new LinkedHashMap<>();
            for (String column : schema.exogenousColumns()) {
                exogenous.put(column, parseNumber(row.get(column), rowNumber, column));
            }

            LocalDate date = parseDate(row.get(columns.getDate()), rowNumber);
            records.add(PanelRecord.builder()
                    .agency(agency.trim())
                    .sku(sku.trim())
                    .date(date)
                    .target(target)
                    .exogenous(exogenous)
                    .build());
        }

        if (requireTarget && missingTargets > 0) {
            throw new SchemaException("Found " + missingTargets + " missing values in target.");
        }

        Panel panel = Panel.of(records);
        log.info("Loaded {} rows for {} entities", panel.size(), panel.entities().size());
        return panel;
    }

    public DatasetSummary summarize(RawTable table, Panel panel) {
        Set<String> agencies = new HashSet<>();
        Set<String> skus = new HashSet<>();
        for (PanelRecord record : panel.records()) {
            agencies.add(record.getAgency());
            skus.add(record.getSku());
        }
        int columnCount = (int) table.headers().stream().filter(h -> !columns.getDrop().contains(h)).count();
        return new DatasetSummary(panel.size(), columnCount, panel.minDate(), panel.maxDate(),
                agencies.size(), skus.size());
    }

    private boolean isReserved(String header) {
        return columns.getDrop().contains(header)
                || header.equals(columns.getAgency())
                || header.equals(columns.getSku())
                || header.equals(columns.getDate())
                || header.equals(columns.getTarget());
    }

    private static void requireColumns(RawTable table, List<String> required) {
        List<String> missing = new ArrayList<>();
        for (String column : required) {
            if (!table.hasColumn(column)) missing.add(column);
        }
        if (!missing.isEmpty()) {
            throw new SchemaException("Missing required columns: " + missing);
        }
    }

    private static boolean isNumericColumn(RawTable table, String column) {
        for (Map<String, String> row : table.rows()) {
            String value = row.get(column);
            if (value == null || MISSING_TOKENS.contains(value.trim())) continue;
            try {
                Double.parseDouble(value.trim());
            } catch (NumberFormatException e) {
                return false;
            }
        }
        return true;
    }

    // Missing counts as a value of its own
    private static int distinctValues(RawTable table, String column) {
        Set<String> seen = new HashSet<>();
        for (Map<String, String> row : table.rows()) {
            String value = row.get(column);
            seen.add(value == null || MISSING_TOKENS.contains(value.trim()) ? "" : value.trim());
            if (seen.size() > 1) return seen.size();
        }
        return seen.size();
    }

    private static Double parseNumber(String raw, int rowNumber, String column) {
        if (raw == null || MISSING_TOKENS.contains(raw.trim())) return null;
        try {
            return Double.parseDouble(raw.trim());
        } catch (NumberFormatException e) {
            throw new PanelParseException("Row " + rowNumber + ", column '" + column
                    + "': '" + raw + "' is not a number", e);
        }
    }

    private static LocalDate parseDate(String raw, int rowNumber) {
        try {
            return CalendarFeatureGenerator.parseDate(raw);
        } catch (PanelParseException e) {
            throw new PanelParseException("Row " + rowNumber + ": " + e.getMessage(), e);
        }
    }
}
