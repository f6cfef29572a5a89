package com.sales.forecast.runner;

import com.sales.forecast.config.ForecastProperties;
import com.sales.forecast.config.MetricsConfig;
import com.sales.forecast.engine.features.CalendarFeatureGenerator;
import com.sales.forecast.exception.ForecastException;
import com.sales.forecast.exception.InvalidForecastRangeException;
import com.sales.forecast.model.PredictionResult;
import com.sales.forecast.model.TrainingReport;
import com.sales.forecast.service.PredictionService;
import com.sales.forecast.service.TrainingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;

/**
 * Command-line entry point.
 *
 * <pre>
 *   train   [--data=path] [--test-date=yyyy-MM-dd] [--model-output=path] [--artifacts-output=path] [--cross-validate]
 *   predict [--data=path] [--model=path] [--artifacts=path] [--output=path]
 *   predict --forecast --start-date=yyyy-MM-dd --end-date=yyyy-MM-dd [--model=path] [--artifacts=path] [--output=path]
 * </pre>
 * Omitted paths fall back to {@code forecast.storage.*}.
 */
@Component
public class ForecastCommandRunner implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(ForecastCommandRunner.class);

    private final TrainingService trainingService;
    private final PredictionService predictionService;
    private final ForecastProperties properties;
    private final MetricsConfig metrics;

    public ForecastCommandRunner(TrainingService trainingService,
                                 PredictionService predictionService,
                                 ForecastProperties properties,
                                 MetricsConfig metrics) {
        this.trainingService = trainingService;
        this.predictionService = predictionService;
        this.properties = properties;
        this.metrics = metrics;
    }

    @Override
    public void run(ApplicationArguments args) {
        List<String> commands = args.getNonOptionArgs();
        if (commands.isEmpty()) {
            log.info("Usage: train [--data=..] [--test-date=..] [--model-output=..] [--artifacts-output=..] [--cross-validate]");
            log.info("       predict [--data=..] | --forecast --start-date=.. --end-date=.. [--model=..] [--artifacts=..] [--output=..]");
            return;
        }

        try {
            switch (commands.get(0)) {
                case "train" -> train(args);
                case "predict" -> predict(args);
                default -> throw new IllegalArgumentException("Unknown command '" + commands.get(0)
                        + "'. Expected 'train' or 'predict'.");
            }
        } catch (ForecastException e) {
            log.error("{}: {}", e.getErrorCode(), e.getMessage());
            throw e;
        } finally {
            metrics.logSummary();
        }
    }

    private void train(ApplicationArguments args) {
        ForecastProperties.Storage storage = properties.getStorage();
        String testDate = option(args, "test-date", null);

        TrainingReport report = trainingService.train(
                Path.of(option(args, "data", storage.getTrainData())),
                testDate == null ? null : CalendarFeatureGenerator.parseDate(testDate),
                Path.of(option(args, "model-output", storage.getModel())),
                Path.of(option(args, "artifacts-output", storage.getArtifacts())),
                args.containsOption("cross-validate") || properties.getCrossValidation().isEnabled());

        log.info("Trained on {} rows, evaluated on {} rows from {}", report.trainRows(), report.testRows(),
                report.cutoff());
    }

    private void predict(ApplicationArguments args) {
        ForecastProperties.Storage storage = properties.getStorage();
        Path model = Path.of(option(args, "model", storage.getModel()));
        Path artifacts = Path.of(option(args, "artifacts", storage.getArtifacts()));
        Path output = Path.of(option(args, "output", storage.getOutput()));

        PredictionResult result;
        if (args.containsOption("forecast")) {
            String start = option(args, "start-date", null);
            String end = option(args, "end-date", null);
            if (start == null || end == null) {
                throw new InvalidForecastRangeException("--forecast needs both --start-date and --end-date.");
            }
            result = predictionService.forecastToFile(CalendarFeatureGenerator.parseDate(start),
                    CalendarFeatureGenerator.parseDate(end), model, artifacts, output);
        } else {
            result = predictionService.predictFile(Path.of(option(args, "data", storage.getPredictData())),
                    model, artifacts, output);
        }

        log.info("Wrote {} predictions to {} ({} rows dropped, {} series without covariate history)",
                result.predictions().size(), output, result.droppedRows(), result.unresolvedEntities().size());
    }

    private static String option(ApplicationArguments args, String name, String fallback) {
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty()) return fallback;
        return values.get(values.size() - 1);
    }
}
