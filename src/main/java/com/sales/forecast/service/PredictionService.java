package com.sales.forecast.service;

import com.sales.forecast.config.MetricsConfig;
import com.sales.forecast.engine.features.CarryForwardResult;
import com.sales.forecast.engine.features.CategoricalEncoder;
import com.sales.forecast.engine.features.EntityEncoders;
import com.sales.forecast.engine.features.FeaturePipeline;
import com.sales.forecast.engine.features.HistoryCarryForward;
import com.sales.forecast.engine.features.LearnedStatistics;
import com.sales.forecast.engine.features.TrailingHistory;
import com.sales.forecast.engine.features.TrainingArtifacts;
import com.sales.forecast.engine.gbt.ForecastModel;
import com.sales.forecast.engine.panel.PanelLoader;
import com.sales.forecast.exception.InsufficientHistoryException;
import com.sales.forecast.exception.InvalidForecastRangeException;
import com.sales.forecast.model.EntityKey;
import com.sales.forecast.model.FeatureMatrix;
import com.sales.forecast.model.Panel;
import com.sales.forecast.model.PanelRecord;
import com.sales.forecast.model.Prediction;
import com.sales.forecast.model.PredictionResult;
import com.sales.forecast.model.RawTable;
import com.sales.forecast.repository.ArtifactRepository;
import com.sales.forecast.repository.ModelRepository;
import com.sales.forecast.repository.PanelCsvReader;
import com.sales.forecast.repository.PredictionCsvWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Inference with a trained model and its artifacts. Features are always derived from the
 * artifacts' stored settings, schema, statistics and trailing history, never refitted.
 */
@Service
public class PredictionService {

    private static final Logger log = LoggerFactory.getLogger(PredictionService.class);

    private static final Comparator<Prediction> OUTPUT_ORDER = Comparator.comparing(Prediction::date)
            .thenComparing(Prediction::agency)
            .thenComparing(Prediction::sku);

    private final PanelCsvReader csvReader;
    private final PanelLoader panelLoader;
    private final HistoryCarryForward carryForward;
    private final FeaturePipeline pipeline;
    private final ArtifactRepository artifactRepository;
    private final ModelRepository modelRepository;
    private final PredictionCsvWriter csvWriter;
    private final MetricsConfig metrics;

    public PredictionService(PanelCsvReader csvReader,
                             PanelLoader panelLoader,
                             HistoryCarryForward carryForward,
                             FeaturePipeline pipeline,
                             ArtifactRepository artifactRepository,
                             ModelRepository modelRepository,
                             PredictionCsvWriter csvWriter,
                             MetricsConfig metrics) {
        this.csvReader = csvReader;
        this.panelLoader = panelLoader;
        this.carryForward = carryForward;
        this.pipeline = pipeline;
        this.artifactRepository = artifactRepository;
        this.modelRepository = modelRepository;
        this.csvWriter = csvWriter;
        this.metrics = metrics;
    }

    public PredictionResult predictFile(Path dataPath, Path modelPath, Path artifactsPath, Path outputPath) {
        log.info("=== Predicting rows of {} ===", dataPath);
        ForecastModel model = modelRepository.load(modelPath);
        TrainingArtifacts artifacts = artifactRepository.load(artifactsPath);

        PredictionResult result = predictBatch(csvReader.read(dataPath), model, artifacts);
        csvWriter.write(outputPath, result.predictions());
        return result;
    }

    public PredictionResult forecastToFile(LocalDate start, LocalDate end, Path modelPath, Path artifactsPath,
                                           Path outputPath) {
        log.info("=== Forecasting {} to {} ===", start, end);
        ForecastModel model = modelRepository.load(modelPath);
        TrainingArtifacts artifacts = artifactRepository.load(artifactsPath);

        PredictionResult result = forecast(start, end, model, artifacts);
        csvWriter.write(outputPath, result.predictions());
        return result;
    }

    /**
     * Predicts every row of a new panel. Missing covariates are carried forward from the
     * stored history; rows whose features are still incomplete are dropped and counted.
     *
     * @throws InsufficientHistoryException if no row can be predicted
     */
    public PredictionResult predictBatch(RawTable raw, ForecastModel model, TrainingArtifacts artifacts) {
        LearnedStatistics learned = artifacts.learned();
        Panel panel = panelLoader.load(raw, learned.schema(), false);
        Panel history = artifacts.history().toPanel();
        recordUnseen(panel, learned.encoders());

        CarryForwardResult filled = carryForward.fill(panel, history, learned.schema().exogenousColumns());
        FeatureMatrix features = pipeline.transform(filled.panel(), learned, contextFor(filled.panel(), history));

        FeatureMatrix complete = features.completeRows();
        int dropped = features.rowCount() - complete.rowCount();
        metrics.recordRowsDropped("predict", dropped);
        if (complete.rowCount() == 0) {
            throw new InsufficientHistoryException("None of the " + features.rowCount()
                    + " rows has a complete feature set.");
        }
        if (dropped > 0) {
            log.warn("Dropped {} of {} rows with incomplete features", dropped, features.rowCount());
        }

        List<Prediction> predictions = toPredictions(complete, model.predict(complete.toArray()), learned.encoders());
        metrics.recordPredictions("batch", predictions.size());
        log.info("Predicted {} rows", predictions.size());
        return new PredictionResult(predictions, dropped, filled.unresolvedEntities());
    }

    /**
     * Recursive monthly forecast for every known (agency, SKU) pair. Months from the one after
     * the last stored date up to {@code end} are predicted in order, and each month's
     * predictions serve as history for the next. Only month starts within [start, end] are returned.
     *
     * @throws InvalidForecastRangeException if the range is empty, holds no month start, or starts
     *                                       before the first month after the stored history
     */
    public PredictionResult forecast(LocalDate start, LocalDate end, ForecastModel model, TrainingArtifacts artifacts) {
        LearnedStatistics learned = artifacts.learned();
        Panel running = artifacts.history().toPanel();
        if (running.isEmpty()) {
            throw new InsufficientHistoryException("The training artifacts hold no history to forecast from.");
        }

        YearMonth first = YearMonth.from(running.maxDate()).plusMonths(1);
        YearMonth to = YearMonth.from(end);
        if (end.isBefore(start)) {
            throw new InvalidForecastRangeException("End date " + end + " is before start date " + start + ".");
        }
        // First month start on or after the start date
        YearMonth from = start.getDayOfMonth() == 1 ? YearMonth.from(start) : YearMonth.from(start).plusMonths(1);
        if (from.atDay(1).isAfter(end)) {
            throw new InvalidForecastRangeException("No month starts between " + start + " and " + end + ".");
        }
        if (from.isBefore(first)) {
            throw new InvalidForecastRangeException("Forecast must start on or after " + first.atDay(1)
                    + ", the month after the last known date " + running.maxDate() + ".");
        }

        List<EntityKey> entities = crossProduct(learned.encoders());
        int depth = learned.settings().historyDepth();
        List<String> covariates = learned.schema().exogenousColumns();

        List<Prediction> predictions = new ArrayList<>();
        Set<EntityKey> unresolved = new TreeSet<>();
        int dropped = 0;

        for (YearMonth month = first; !month.isAfter(to); month = month.plusMonths(1)) {
            LocalDate date = month.atDay(1);
            List<PanelRecord> rows = new ArrayList<>(entities.size());
            for (EntityKey entity : entities) {
                rows.add(PanelRecord.builder().agency(entity.agency()).sku(entity.sku()).date(date).build());
            }

            CarryForwardResult filled = carryForward.fill(Panel.of(rows), running, covariates);
            unresolved.addAll(filled.unresolvedEntities());
            FeatureMatrix features = pipeline.transform(filled.panel(), learned, running);
            FeatureMatrix complete = features.completeRows();
            int monthDropped = features.rowCount() - complete.rowCount();
            if (monthDropped > 0) {
                log.warn("{}: {} of {} series lack history and were not forecast", month, monthDropped,
                        features.rowCount());
            }

            double[] values = clip(complete.rowCount() == 0 ? new double[0] : model.predict(complete.toArray()));
            List<PanelRecord> predicted = new ArrayList<>(values.length);
            for (int i = 0; i < values.length; i++) {
                predicted.add(complete.records().get(i).withTarget(values[i]));
            }
            running = TrailingHistory.capture(running.concat(Panel.of(predicted)), depth).toPanel();

            if (!date.isBefore(start) && !date.isAfter(end)) {
                dropped += monthDropped;
                predictions.addAll(toPredictions(complete, values, learned.encoders()));
            }
        }

        if (predictions.isEmpty()) {
            throw new InsufficientHistoryException("No series has enough history to forecast " + from + " to " + to + ".");
        }
        metrics.recordRowsDropped("forecast", dropped);
        metrics.recordPredictions("forecast", predictions.size());
        predictions.sort(OUTPUT_ORDER);
        log.info("Forecast {} rows for {} series over {} to {}", predictions.size(), entities.size(), from, to);
        return new PredictionResult(predictions, dropped, unresolved);
    }

    private List<Prediction> toPredictions(FeatureMatrix features, double[] raw, EntityEncoders encoders) {
        double[] values = clip(raw);
        int agencyColumn = features.columnIndex(EntityEncoders.AGENCY_ENCODED);
        int skuColumn = features.columnIndex(EntityEncoders.SKU_ENCODED);

        List<Prediction> predictions = new ArrayList<>(values.length);
        for (int i = 0; i < values.length; i++) {
            PanelRecord record = features.records().get(i);
            double[] row = features.row(i);
            predictions.add(new Prediction(record.getDate(),
                    decode(encoders.agency(), (int) row[agencyColumn], record.getAgency()),
                    decode(encoders.sku(), (int) row[skuColumn], record.getSku()),
                    values[i]));
        }
        return predictions;
    }

    // Unseen identifiers carry the sentinel code and are reported under their raw value
    private static String decode(CategoricalEncoder encoder, int code, String raw) {
        return code == CategoricalEncoder.UNKNOWN_CODE ? raw : encoder.decode(code);
    }

    private static double[] clip(double[] values) {
        double[] out = new double[values.length];
        for (int i = 0; i < values.length; i++) out[i] = Math.max(0.0, values[i]);
        return out;
    }

    /**
     * History rows that precede each entity's first inference date. Rows at or after it are
     * superseded by the inference panel.
     */
    private static Panel contextFor(Panel inference, Panel history) {
        Map<EntityKey, LocalDate> firstDates = new HashMap<>();
        for (PanelRecord record : inference.records()) {
            firstDates.merge(record.getEntityKey(), record.getDate(), (a, b) -> a.isBefore(b) ? a : b);
        }
        return history.filter(record -> {
            LocalDate first = firstDates.get(record.getEntityKey());
            return first != null && record.getDate().isBefore(first);
        });
    }

    private static List<EntityKey> crossProduct(EntityEncoders encoders) {
        List<EntityKey> entities = new ArrayList<>();
        for (String agency : encoders.agency().getCategories()) {
            for (String sku : encoders.sku().getCategories()) {
                entities.add(new EntityKey(agency, sku));
            }
        }
        return entities;
    }

    private void recordUnseen(Panel panel, EntityEncoders encoders) {
        Set<String> agencies = new TreeSet<>();
        Set<String> skus = new TreeSet<>();
        for (PanelRecord record : panel.records()) {
            if (!encoders.agency().contains(record.getAgency())) agencies.add(record.getAgency());
            if (!encoders.sku().contains(record.getSku())) skus.add(record.getSku());
        }
        if (!agencies.isEmpty() || !skus.isEmpty()) {
            log.warn("Identifiers not seen at training: agencies {}, SKUs {}", agencies, skus);
        }
        metrics.recordUnseenEntities("agency", agencies.size());
        metrics.recordUnseenEntities("sku", skus.size());
    }
}
