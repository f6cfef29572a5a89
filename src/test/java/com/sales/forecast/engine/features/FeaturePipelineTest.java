package com.sales.forecast.engine.features;

import com.sales.forecast.exception.FeatureSchemaMismatchException;
import com.sales.forecast.exception.UnseenEntityException;
import com.sales.forecast.model.FeatureMatrix;
import com.sales.forecast.model.Panel;
import com.sales.forecast.model.PanelRecord;
import com.sales.forecast.model.PanelSchema;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;

import static com.sales.forecast.testutil.TestDataFactory.JAN_2017;
import static com.sales.forecast.testutil.TestDataFactory.record;
import static com.sales.forecast.testutil.TestDataFactory.settings;
import static com.sales.forecast.testutil.TestDataFactory.syntheticPanel;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FeaturePipelineTest {

    private static final List<String> EXPECTED_COLUMNS = List.of(
            "agency_encoded", "sku_encoded",
            "year", "month", "day", "day_of_week", "week_of_year", "quarter",
            "mean_volume_agency_sku_month", "mean_volume_agency_sku", "mean_volume_sku_month",
            "volume_lag_1", "volume_lag_2", "volume_rolling_mean_2",
            "price");

    private final FeaturePipeline pipeline = new FeaturePipeline();
    private final PanelSchema schema = new PanelSchema(List.of("price"), List.of());

    private Panel train;
    private Panel test;
    private FitResult fit;

    @BeforeEach
    void setUp() {
        Panel full = Panel.of(syntheticPanel(List.of("A", "B"), List.of("S1"), JAN_2017, 8));
        LocalDate cutoff = LocalDate.of(2017, 7, 1);
        train = full.filter(r -> r.getDate().isBefore(cutoff));
        test = full.filter(r -> !r.getDate().isBefore(cutoff));
        fit = pipeline.fitTransform(train, settings(List.of(1, 2), List.of(2)), schema);
    }

    @Test
    void fitTransform_canonicalColumnOrder() {
        assertThat(fit.features().columns()).containsExactlyElementsOf(EXPECTED_COLUMNS);
        assertThat(fit.learned().featureColumns()).containsExactlyElementsOf(EXPECTED_COLUMNS);
        assertThat(fit.features().rowCount()).isEqualTo(train.size());
    }

    @Test
    void transform_sameColumnsAsFitTransform() {
        FeatureMatrix features = pipeline.transform(test, fit.learned());

        assertThat(features.columns()).isEqualTo(fit.features().columns());
    }

    @Test
    void transform_calledTwice_identicalOutput() {
        Panel context = TrailingHistory.capture(train, 2).toPanel();

        double[][] first = pipeline.transform(test, fit.learned(), context).toArray();
        double[][] second = pipeline.transform(test, fit.learned(), context).toArray();

        assertThat(Arrays.deepEquals(first, second)).isTrue();
    }

    @Test
    void transform_withContext_lagsReachIntoHistoryButOnlyPanelRowsAreEmitted() {
        Panel context = TrailingHistory.capture(train, 2).toPanel();

        FeatureMatrix withContext = pipeline.transform(test, fit.learned(), context);
        FeatureMatrix withoutContext = pipeline.transform(test, fit.learned());

        assertThat(withContext.rowCount()).isEqualTo(test.size());
        assertThat(withContext.records()).isEqualTo(test.records());
        // First test month of A: lag 1 is A's June volume from the context
        PanelRecord juneA = train.filter(r -> r.getAgency().equals("A") && r.getDate().getMonthValue() == 6)
                .records().get(0);
        assertThat(withContext.value(0, "volume_lag_1")).isEqualTo(juneA.getTarget());
        assertThat(withContext.isComplete(0)).isTrue();
        assertThat(withoutContext.value(0, "volume_lag_1")).isNaN();
    }

    @Test
    void fitTransform_firstRowsOfEachEntityAreIncomplete() {
        FeatureMatrix complete = fit.features().completeRows();

        // Two entities, two leading months each without a second lag
        assertThat(fit.features().incompleteRowCount()).isEqualTo(4);
        assertThat(complete.rowCount()).isEqualTo(train.size() - 4);
    }

    @Test
    void transform_encodesIdentifiersAndCalendar() {
        FeatureMatrix features = pipeline.transform(test, fit.learned());

        int lastRow = features.rowCount() - 1;
        assertThat(features.value(0, "agency_encoded")).isEqualTo(0.0);
        assertThat(features.value(lastRow, "agency_encoded")).isEqualTo(1.0);
        assertThat(features.value(0, "sku_encoded")).isEqualTo(0.0);
        assertThat(features.value(0, "month")).isEqualTo(7.0);
        assertThat(features.value(0, "quarter")).isEqualTo(3.0);
    }

    @Test
    void transform_missingCovariate_isUndefined() {
        Panel panel = Panel.of(List.of(record("A", "S1", LocalDate.of(2017, 9, 1), null, "price", null)));

        FeatureMatrix features = pipeline.transform(panel, fit.learned());

        assertThat(features.value(0, "price")).isNaN();
        assertThat(features.isComplete(0)).isFalse();
    }

    @Test
    void transform_unseenEntity_sentinelCode() {
        Panel panel = Panel.of(List.of(record("Z", "S9", LocalDate.of(2017, 9, 1), null, "price", 1.0)));

        FeatureMatrix features = pipeline.transform(panel, fit.learned());

        assertThat(features.value(0, "agency_encoded")).isEqualTo(-1.0);
        assertThat(features.value(0, "sku_encoded")).isEqualTo(-1.0);
        // No historical group matched, so the global mean fills in
        assertThat(features.value(0, "mean_volume_agency_sku"))
                .isEqualTo(fit.learned().statistics().globalMean());
    }

    @Test
    void transform_unseenEntityUnderFailPolicy_throws() {
        FitResult strict = pipeline.fitTransform(train,
                settings(List.of(1, 2), List.of(2), UnseenEntityPolicy.FAIL, AggregateFallback.LEAVE_NULL), schema);
        Panel panel = Panel.of(List.of(record("Z", "S1", LocalDate.of(2017, 9, 1), null, "price", 1.0)));

        assertThatThrownBy(() -> pipeline.transform(panel, strict.learned()))
                .isInstanceOf(UnseenEntityException.class);
    }

    @Test
    void transform_learnedColumnsDiffer_throwsMismatch() {
        LearnedStatistics learned = fit.learned();
        LearnedStatistics tampered = new LearnedStatistics(learned.settings(), learned.schema(),
                learned.statistics(), learned.encoders(), EXPECTED_COLUMNS.subList(0, 10));

        assertThatThrownBy(() -> pipeline.transform(test, tampered))
                .isInstanceOf(FeatureSchemaMismatchException.class)
                .extracting("errorCode").isEqualTo("FEATURE_SCHEMA_MISMATCH");
    }

    @Test
    void transform_doesNotReadTargetsOfTransformedRows() {
        Panel blanked = Panel.of(test.records().stream().map(r -> r.withTarget(null)).toList());
        Panel context = TrailingHistory.capture(train, 2).toPanel();

        FeatureMatrix original = pipeline.transform(test, fit.learned(), context);
        FeatureMatrix withoutTargets = pipeline.transform(blanked, fit.learned(), context);

        // First test month only depends on context targets
        assertThat(withoutTargets.row(0)).containsExactly(original.row(0));
        assertThat(withoutTargets.value(1, "volume_lag_1")).isNaN();
    }
}
