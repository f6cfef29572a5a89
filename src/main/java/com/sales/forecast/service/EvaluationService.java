package com.sales.forecast.service;

import com.sales.forecast.engine.gbt.ForecastModel;
import com.sales.forecast.engine.gbt.ModelTrainer;
import com.sales.forecast.exception.InsufficientHistoryException;
import com.sales.forecast.model.BaselineComparison;
import com.sales.forecast.model.CrossValidationFold;
import com.sales.forecast.model.FeatureMatrix;
import com.sales.forecast.model.ForecastMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Error metrics, the historical-mean baseline comparison and time-series cross-validation.
 */
@Service
public class EvaluationService {

    private static final Logger log = LoggerFactory.getLogger(EvaluationService.class);

    /**
     * MAE, RMSE and MAPE. MAPE only averages over rows with a non-zero actual.
     */
    public ForecastMetrics metrics(double[] actual, double[] predicted) {
        if (actual.length != predicted.length) {
            throw new IllegalArgumentException("Actual and predicted lengths differ: "
                    + actual.length + " vs " + predicted.length);
        }
        if (actual.length == 0) {
            throw new IllegalArgumentException("Cannot compute metrics on zero rows");
        }

        double absSum = 0.0;
        double sqSum = 0.0;
        double pctSum = 0.0;
        int nonZero = 0;
        for (int i = 0; i < actual.length; i++) {
            double error = actual[i] - predicted[i];
            absSum += Math.abs(error);
            sqSum += error * error;
            if (actual[i] != 0.0) {
                pctSum += Math.abs(error / actual[i]);
                nonZero++;
            }
        }

        Double mape = nonZero == 0 ? null : pctSum / nonZero * 100.0;
        return new ForecastMetrics(absSum / actual.length, Math.sqrt(sqSum / actual.length), mape);
    }

    public BaselineComparison compare(double[] actual, double[] predicted, double[] baseline) {
        ForecastMetrics model = metrics(actual, predicted);
        ForecastMetrics reference = metrics(actual, baseline);
        return new BaselineComparison(model, reference,
                improvement(model.mae(), reference.mae()),
                improvement(model.rmse(), reference.rmse()),
                model.mape() == null || reference.mape() == null ? null : improvement(model.mape(), reference.mape()));
    }

    public void logReport(BaselineComparison comparison) {
        log.info("=== Model evaluation ===");
        log.info("Model    MAE {} | RMSE {} | MAPE {}", fmt(comparison.model().mae()),
                fmt(comparison.model().rmse()), pct(comparison.model().mape()));
        log.info("Baseline MAE {} | RMSE {} | MAPE {}", fmt(comparison.baseline().mae()),
                fmt(comparison.baseline().rmse()), pct(comparison.baseline().mape()));
        log.info("Improvement MAE {} | RMSE {} | MAPE {}", pct(comparison.maeImprovementPct()),
                pct(comparison.rmseImprovementPct()), pct(comparison.mapeImprovementPct()));
    }

    /**
     * Expanding-window cross-validation over rows in date order. The rows are cut into
     * {@code folds + 1} equal blocks; fold i trains on every block before block i + 1 and tests on it.
     *
     * @throws InsufficientHistoryException if there are fewer rows than blocks
     */
    public List<CrossValidationFold> crossValidate(FeatureMatrix features, ModelTrainer trainer, int folds) {
        if (folds < 2) {
            throw new IllegalArgumentException("Cross-validation needs at least 2 folds, got " + folds);
        }
        FeatureMatrix ordered = features.sortedByDate();
        int n = ordered.rowCount();
        int testSize = n / (folds + 1);
        if (testSize == 0) {
            throw new InsufficientHistoryException("Cannot run " + folds + "-fold cross-validation on "
                    + n + " rows.");
        }

        log.info("=== Time-series cross-validation: {} folds, {} rows ===", folds, n);
        List<CrossValidationFold> results = new ArrayList<>(folds);
        for (int fold = 0; fold < folds; fold++) {
            int testStart = n - (folds - fold) * testSize;
            FeatureMatrix train = ordered.slice(0, testStart);
            FeatureMatrix test = ordered.slice(testStart, testStart + testSize);

            ForecastModel model = trainer.fit(train.columns(), train.toArray(), train.targets());
            ForecastMetrics metrics = metrics(test.targets(), model.predict(test.toArray()));

            CrossValidationFold result = new CrossValidationFold(fold + 1, train.rowCount(), test.rowCount(),
                    metrics.mae(), metrics.rmse());
            log.info("Fold {}: train {} rows, test {} rows, MAE {}, RMSE {}", result.fold(),
                    result.trainSize(), result.testSize(), fmt(result.mae()), fmt(result.rmse()));
            results.add(result);
        }

        double meanMae = results.stream().mapToDouble(CrossValidationFold::mae).average().orElse(Double.NaN);
        double meanRmse = results.stream().mapToDouble(CrossValidationFold::rmse).average().orElse(Double.NaN);
        log.info("Cross-validation mean MAE {}, mean RMSE {}", fmt(meanMae), fmt(meanRmse));
        return results;
    }

    private static Double improvement(double model, double baseline) {
        if (baseline == 0.0) return null;
        return (baseline - model) / baseline * 100.0;
    }

    private static String fmt(double value) {
        return String.format("%.2f", value);
    }

    private static String pct(Double value) {
        return value == null ? "n/a" : String.format("%.2f%%", value);
    }
}
