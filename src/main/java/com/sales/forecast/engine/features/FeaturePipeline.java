package com.sales.forecast.engine.features;

import com.sales.forecast.exception.FeatureSchemaMismatchException;
import com.sales.forecast.model.FeatureMatrix;
import com.sales.forecast.model.Panel;
import com.sales.forecast.model.PanelRecord;
import com.sales.forecast.model.PanelSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Assembles the feature matrix. Stages run in a fixed order: calendar attributes, historical
 * means, lags and rolling means, identifier codes. Columns follow {@link FeatureColumns#canonical}.
 *
 * Two modes:
 * <ul>
 *   <li>{@link #fitTransform} learns historical means and encoders from the panel and applies them to it</li>
 *   <li>{@link #transform} applies previously learned statistics and learns nothing</li>
 * </ul>
 * The pipeline holds no state between calls.
 */
@Component
public class FeaturePipeline {

    private static final Logger log = LoggerFactory.getLogger(FeaturePipeline.class);

    private final HistoricalAggregateGenerator aggregateGenerator = new HistoricalAggregateGenerator();

    public FitResult fitTransform(Panel train, FeatureSettings settings, PanelSchema schema) {
        HistoricalStatistics statistics = aggregateGenerator.fit(train, settings.target());
        EntityEncoders encoders = EntityEncoders.fit(train);
        LearnedStatistics learned = new LearnedStatistics(settings, schema, statistics, encoders,
                FeatureColumns.canonical(settings, schema));

        log.info("Fitted pipeline on {} rows: {} agencies, {} SKUs, global mean {}",
                train.size(), encoders.agency().size(), encoders.sku().size(),
                String.format("%.3f", statistics.globalMean()));

        return new FitResult(assemble(train, Panel.empty(), learned), learned);
    }

    public FeatureMatrix transform(Panel panel, LearnedStatistics learned) {
        return transform(panel, learned, Panel.empty());
    }

    /**
     * Transforms {@code panel} using lag and rolling context from {@code context}. Context rows
     * feed the backward-looking features of the panel rows but are not part of the output.
     *
     * @throws FeatureSchemaMismatchException if the learned column list differs from the canonical one
     * @throws com.sales.forecast.exception.SchemaException if a panel row repeats a context row's entity and date
     */
    public FeatureMatrix transform(Panel panel, LearnedStatistics learned, Panel context) {
        List<String> expected = FeatureColumns.canonical(learned.settings(), learned.schema());
        if (!expected.equals(learned.featureColumns())) {
            throw new FeatureSchemaMismatchException(learned.featureColumns(), expected);
        }
        return assemble(panel, context, learned);
    }

    private FeatureMatrix assemble(Panel panel, Panel context, LearnedStatistics learned) {
        FeatureSettings settings = learned.settings();
        List<String> columns = learned.featureColumns();
        List<PanelRecord> rows = panel.records();

        // 1. Calendar
        double[][] calendar = new double[rows.size()][];
        for (int r = 0; r < rows.size(); r++) {
            calendar[r] = CalendarFeatureGenerator.toArray(CalendarFeatureGenerator.generate(rows.get(r).getDate()));
        }

        // 2. Historical means
        Map<String, double[]> aggregates = aggregateGenerator.transform(rows, learned.statistics(),
                settings.aggregateFallback());
        List<String> aggregateNames = HistoricalAggregateGenerator.columnNames(settings.target());

        // 3. Lags and rolling means over context + panel; only the panel rows are kept
        LagFeatureGenerator lagGenerator = new LagFeatureGenerator(settings);
        List<String> lagNames = lagGenerator.columnNames();
        Panel combined = context.isEmpty() ? panel : context.concat(panel);
        Map<String, double[]> lagColumns = lagGenerator.generate(combined.records());
        int[] positions = positionsOf(rows, combined);

        // 4. Identifier codes
        UnseenEntityPolicy policy = settings.unseenEntityPolicy();
        int[] agencyCodes = new int[rows.size()];
        int[] skuCodes = new int[rows.size()];
        int unknownAgencies = 0;
        int unknownSkus = 0;
        for (int r = 0; r < rows.size(); r++) {
            agencyCodes[r] = learned.encoders().agency().encode(rows.get(r).getAgency(), policy);
            skuCodes[r] = learned.encoders().sku().encode(rows.get(r).getSku(), policy);
            if (agencyCodes[r] == CategoricalEncoder.UNKNOWN_CODE) unknownAgencies++;
            if (skuCodes[r] == CategoricalEncoder.UNKNOWN_CODE) unknownSkus++;
        }
        if (unknownAgencies > 0 || unknownSkus > 0) {
            log.warn("Encoded {} rows with an unseen agency and {} rows with an unseen SKU as code {}",
                    unknownAgencies, unknownSkus, CategoricalEncoder.UNKNOWN_CODE);
        }

        double[][] values = new double[rows.size()][columns.size()];
        for (int r = 0; r < rows.size(); r++) {
            double[] row = values[r];
            int c = 0;
            row[c++] = agencyCodes[r];
            row[c++] = skuCodes[r];
            for (double v : calendar[r]) {
                row[c++] = v;
            }
            for (String column : aggregateNames) {
                row[c++] = aggregates.get(column)[r];
            }
            for (String column : lagNames) {
                row[c++] = lagColumns.get(column)[positions[r]];
            }
            for (String column : learned.schema().exogenousColumns()) {
                Double value = rows.get(r).getExogenous().get(column);
                row[c++] = value == null ? Double.NaN : value;
            }
        }

        return new FeatureMatrix(columns, rows, values);
    }

    // Index of each panel row inside the combined context + panel sequence
    private static int[] positionsOf(List<PanelRecord> rows, Panel combined) {
        Set<PanelRecord> wanted = Collections.newSetFromMap(new IdentityHashMap<>());
        wanted.addAll(rows);
        int[] positions = new int[rows.size()];
        int next = 0;
        for (int i = 0; i < combined.size(); i++) {
            if (wanted.contains(combined.records().get(i))) {
                positions[next++] = i;
            }
        }
        return positions;
    }
}
