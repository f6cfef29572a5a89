package com.sales.forecast.config;

import com.sales.forecast.engine.features.AggregateFallback;
import com.sales.forecast.engine.features.FeatureSettings;
import com.sales.forecast.engine.features.UnseenEntityPolicy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Data
@Configuration
@ConfigurationProperties(prefix = "forecast")
public class ForecastProperties {

    private Columns columns = new Columns();

    private Features features = new Features();

    private Split split = new Split();

    private Model model = new Model();

    private CrossValidation crossValidation = new CrossValidation();

    private Storage storage = new Storage();

    /**
     * Feature derivation rules as configured now. Training copies these into the artifacts;
     * inference always uses the copy stored with the artifacts, never this method.
     */
    public FeatureSettings toFeatureSettings() {
        return new FeatureSettings(
                columns.getTarget(),
                features.getLags(),
                features.getRollingWindows(),
                features.getUnseenEntityPolicy(),
                features.getAggregateFallback());
    }

    @Data
    public static class Columns {
        private String agency = "agency";
        private String sku = "sku";
        private String date = "date";
        private String target = "volume";

        // Index and bookkeeping columns removed on load
        private List<String> drop = List.of("", "Unnamed: 0", "timeseries");

        // Declared covariates. Empty = every remaining numeric column.
        private List<String> exogenous = List.of();
    }

    @Data
    public static class Features {
        private List<Integer> lags = List.of(1, 2, 3, 6, 12);
        private List<Integer> rollingWindows = List.of(3, 6, 12);
        private UnseenEntityPolicy unseenEntityPolicy = UnseenEntityPolicy.SENTINEL;
        private AggregateFallback aggregateFallback = AggregateFallback.GLOBAL_MEAN;
    }

    @Data
    public static class Split {
        // Months before the last date that go to the holdout when no explicit test date is given
        private int validationPeriods = 12;
    }

    @Data
    public static class Model {
        private int numTrees = 500;
        private double learningRate = 0.05;
        private int maxDepth = 6;
        private int minSamplesLeaf = 20;
        private double subsample = 0.8;
        // Rounds without validation improvement before boosting stops
        private int earlyStoppingRounds = 50;
        private long seed = 42;
    }

    @Data
    public static class CrossValidation {
        private boolean enabled = false;
        private int folds = 5;
    }

    @Data
    public static class Storage {
        private String trainData = "data/raw/raw_data.csv";
        private String predictData = "data/raw/new_data.csv";
        private String model = "models/model.json";
        private String artifacts = "models/artifacts.json";
        private String output = "outputs/predictions.csv";
    }
}
