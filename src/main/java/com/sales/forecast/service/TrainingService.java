package com.sales.forecast.service;

import com.sales.forecast.config.ForecastProperties;
import com.sales.forecast.config.MetricsConfig;
import com.sales.forecast.engine.features.AggregateGrouping;
import com.sales.forecast.engine.features.FeaturePipeline;
import com.sales.forecast.engine.features.FeatureSettings;
import com.sales.forecast.engine.features.FitResult;
import com.sales.forecast.engine.features.LearnedStatistics;
import com.sales.forecast.engine.features.TrailingHistory;
import com.sales.forecast.engine.features.TrainingArtifacts;
import com.sales.forecast.engine.gbt.ForecastModel;
import com.sales.forecast.engine.gbt.ModelTrainer;
import com.sales.forecast.engine.gbt.ValidationSet;
import com.sales.forecast.engine.panel.LoadedPanel;
import com.sales.forecast.engine.panel.PanelLoader;
import com.sales.forecast.engine.panel.TemporalSplit;
import com.sales.forecast.engine.panel.TemporalSplitter;
import com.sales.forecast.exception.InsufficientHistoryException;
import com.sales.forecast.model.BaselineComparison;
import com.sales.forecast.model.CrossValidationFold;
import com.sales.forecast.model.DatasetSummary;
import com.sales.forecast.model.FeatureImportance;
import com.sales.forecast.model.FeatureMatrix;
import com.sales.forecast.model.RawTable;
import com.sales.forecast.model.TrainingReport;
import com.sales.forecast.repository.ArtifactRepository;
import com.sales.forecast.repository.ModelRepository;
import com.sales.forecast.repository.PanelCsvReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

@Service
public class TrainingService {

    private static final Logger log = LoggerFactory.getLogger(TrainingService.class);
    private static final int IMPORTANCES_LOGGED = 20;

    private final ForecastProperties properties;
    private final PanelCsvReader csvReader;
    private final PanelLoader panelLoader;
    private final TemporalSplitter splitter;
    private final FeaturePipeline pipeline;
    private final ModelTrainer trainer;
    private final EvaluationService evaluationService;
    private final ArtifactRepository artifactRepository;
    private final ModelRepository modelRepository;
    private final MetricsConfig metrics;

    public TrainingService(ForecastProperties properties,
                           PanelCsvReader csvReader,
                           PanelLoader panelLoader,
                           TemporalSplitter splitter,
                           FeaturePipeline pipeline,
                           ModelTrainer trainer,
                           EvaluationService evaluationService,
                           ArtifactRepository artifactRepository,
                           ModelRepository modelRepository,
                           MetricsConfig metrics) {
        this.properties = properties;
        this.csvReader = csvReader;
        this.panelLoader = panelLoader;
        this.splitter = splitter;
        this.pipeline = pipeline;
        this.trainer = trainer;
        this.evaluationService = evaluationService;
        this.artifactRepository = artifactRepository;
        this.modelRepository = modelRepository;
        this.metrics = metrics;
    }

    /**
     * Full training run: load, split, derive features, fit, evaluate against the baseline and
     * persist the model and the training artifacts.
     *
     * @param testDate first date of the holdout; null holds out the last configured number of months
     */
    public TrainingReport train(Path dataPath, LocalDate testDate, Path modelOutput, Path artifactsOutput,
                                boolean crossValidate) {
        Instant start = Instant.now();
        log.info("=== Starting training on {} ===", dataPath);

        RawTable raw = csvReader.read(dataPath);
        LoadedPanel loaded = panelLoader.loadForTraining(raw);
        DatasetSummary summary = panelLoader.summarize(raw, loaded.panel());
        log.info("Dataset: {} rows, {} columns, {} to {}, {} agencies, {} SKUs",
                summary.rows(), summary.columns(), summary.dateMin(), summary.dateMax(),
                summary.agencies(), summary.skus());

        TemporalSplit split = testDate != null
                ? splitter.split(loaded.panel(), testDate)
                : splitter.splitByPeriods(loaded.panel(), properties.getSplit().getValidationPeriods());

        FeatureSettings settings = properties.toFeatureSettings();
        FitResult fit = pipeline.fitTransform(split.train(), settings, loaded.schema());
        LearnedStatistics learned = fit.learned();

        // Test rows see the tail of the training series as lag context
        TrailingHistory trainTail = TrailingHistory.capture(split.train(), settings.historyDepth());
        FeatureMatrix testFeatures = pipeline.transform(split.test(), learned, trainTail.toPanel());

        FeatureMatrix train = fit.features().completeRows();
        FeatureMatrix test = testFeatures.completeRows();
        int droppedTrain = fit.features().rowCount() - train.rowCount();
        int droppedTest = testFeatures.rowCount() - test.rowCount();
        metrics.recordRowsDropped("train", droppedTrain);
        metrics.recordRowsDropped("test", droppedTest);
        log.info("Feature rows: train {} ({} dropped), test {} ({} dropped)",
                train.rowCount(), droppedTrain, test.rowCount(), droppedTest);

        if (train.rowCount() == 0) {
            throw new InsufficientHistoryException("No training rows have a complete feature set; "
                    + "the series are shorter than the longest lag or window (" + settings.historyDepth() + ").");
        }
        if (test.rowCount() == 0) {
            throw new InsufficientHistoryException("No test rows from " + split.cutoff()
                    + " onwards have a complete feature set.");
        }

        ForecastModel model = trainer.fit(train.columns(), train.toArray(), train.targets(),
                new ValidationSet(test.toArray(), test.targets()));

        double[] baseline = test.column(AggregateGrouping.AGENCY_SKU_MONTH.columnName(settings.target()));
        BaselineComparison evaluation = evaluationService.compare(test.targets(), model.predict(test.toArray()), baseline);
        evaluationService.logReport(evaluation);

        List<FeatureImportance> importances = model.featureImportances();
        logImportances(importances);

        List<CrossValidationFold> folds = crossValidate
                ? evaluationService.crossValidate(train, trainer, properties.getCrossValidation().getFolds())
                : List.of();

        TrailingHistory history = TrailingHistory.capture(loaded.panel(), settings.historyDepth());
        artifactRepository.save(artifactsOutput, new TrainingArtifacts(learned, history));
        modelRepository.save(modelOutput, model);

        Duration elapsed = Duration.between(start, Instant.now());
        metrics.recordTrainingDuration(elapsed);
        log.info("=== Training complete in {} ms ===", elapsed.toMillis());

        return new TrainingReport(summary, split.cutoff(), train.rowCount(), test.rowCount(),
                droppedTrain, droppedTest, evaluation, importances, folds);
    }

    private static void logImportances(List<FeatureImportance> importances) {
        log.info("Top feature importances:");
        importances.stream()
                .limit(IMPORTANCES_LOGGED)
                .forEach(fi -> log.info("  {} {}", fi.feature(), String.format("%.4f", fi.importance())));
    }
}
