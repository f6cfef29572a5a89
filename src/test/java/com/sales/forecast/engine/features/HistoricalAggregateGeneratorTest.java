package com.sales.forecast.engine.features;

import com.sales.forecast.exception.SchemaException;
import com.sales.forecast.model.Panel;
import com.sales.forecast.model.PanelRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static com.sales.forecast.testutil.TestDataFactory.record;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class HistoricalAggregateGeneratorTest {

    private final HistoricalAggregateGenerator generator = new HistoricalAggregateGenerator();
    private HistoricalStatistics statistics;

    @BeforeEach
    void setUp() {
        Panel reference = Panel.of(List.of(
                record("A", "S1", LocalDate.of(2017, 1, 1), 10.0),
                record("A", "S1", LocalDate.of(2017, 2, 1), 20.0),
                record("A", "S1", LocalDate.of(2018, 1, 1), 30.0),
                record("B", "S1", LocalDate.of(2017, 1, 1), 40.0)));
        statistics = generator.fit(reference, "volume");
    }

    @Test
    void columnNames_oneMeanPerGrouping() {
        assertThat(HistoricalAggregateGenerator.columnNames("volume")).containsExactly(
                "mean_volume_agency_sku_month", "mean_volume_agency_sku", "mean_volume_sku_month");
    }

    @Test
    void fit_computesGroupMeansAndGlobalMean() {
        assertThat(statistics.globalMean()).isEqualTo(25.0);
        assertThat(statistics.sampleCount()).isEqualTo(4);
        assertThat(statistics.table(AggregateGrouping.AGENCY_SKU_MONTH).lookup(List.of("A", "S1", "1"))).contains(20.0);
        assertThat(statistics.table(AggregateGrouping.AGENCY_SKU).lookup(List.of("A", "S1"))).contains(20.0);
        assertThat(statistics.table(AggregateGrouping.SKU_MONTH).lookup(List.of("S1", "1")).orElseThrow())
                .isCloseTo(80.0 / 3, within(1e-12));
    }

    @Test
    void transform_matchedGroups_ignoreTransformedTargets() {
        PanelRecord query = record("A", "S1", LocalDate.of(2019, 1, 1), 1_000_000.0);

        Map<String, double[]> columns = generator.transform(List.of(query), statistics, AggregateFallback.LEAVE_NULL);

        assertThat(columns.get("mean_volume_agency_sku_month")[0]).isEqualTo(20.0);
        assertThat(columns.get("mean_volume_agency_sku")[0]).isEqualTo(20.0);
        assertThat(columns.get("mean_volume_sku_month")[0]).isCloseTo(80.0 / 3, within(1e-12));
    }

    @Test
    void transform_unmatchedGroup_globalMeanFallback() {
        PanelRecord unseen = record("C", "S2", LocalDate.of(2017, 3, 1), null);

        Map<String, double[]> columns = generator.transform(List.of(unseen), statistics, AggregateFallback.GLOBAL_MEAN);

        assertThat(columns.values()).allSatisfy(values -> assertThat(values[0]).isEqualTo(25.0));
    }

    @Test
    void transform_unmatchedGroup_leaveNullFallback() {
        PanelRecord unseen = record("C", "S2", LocalDate.of(2017, 3, 1), null);

        Map<String, double[]> columns = generator.transform(List.of(unseen), statistics, AggregateFallback.LEAVE_NULL);

        assertThat(columns.values()).allSatisfy(values -> assertThat(values[0]).isNaN());
    }

    @Test
    void transform_partialMatch_onlyMissingGroupsFallBack() {
        // B/S1 exists, but never in March
        PanelRecord row = record("B", "S1", LocalDate.of(2017, 3, 1), null);

        Map<String, double[]> columns = generator.transform(List.of(row), statistics, AggregateFallback.LEAVE_NULL);

        assertThat(columns.get("mean_volume_agency_sku")[0]).isEqualTo(40.0);
        assertThat(columns.get("mean_volume_agency_sku_month")[0]).isNaN();
        assertThat(columns.get("mean_volume_sku_month")[0]).isNaN();
    }

    @Test
    void fit_emptyPanel_throwsSchemaError() {
        assertThatThrownBy(() -> generator.fit(Panel.empty(), "volume"))
                .isInstanceOf(SchemaException.class);
    }

    @Test
    void fit_rowWithoutTarget_throwsSchemaError() {
        Panel reference = Panel.of(List.of(record("A", "S1", LocalDate.of(2017, 1, 1), null)));

        assertThatThrownBy(() -> generator.fit(reference, "volume"))
                .isInstanceOf(SchemaException.class)
                .hasMessageContaining("no target");
    }
}
