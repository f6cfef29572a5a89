package com.sales.forecast.engine.features;

import com.sales.forecast.model.EntityKey;
import com.sales.forecast.model.Panel;
import com.sales.forecast.model.PanelRecord;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static com.sales.forecast.testutil.TestDataFactory.record;
import static org.assertj.core.api.Assertions.assertThat;

class HistoryCarryForwardTest {

    private static final LocalDate JAN = LocalDate.of(2017, 1, 1);
    private static final LocalDate FEB = LocalDate.of(2017, 2, 1);
    private static final LocalDate MAR = LocalDate.of(2017, 3, 1);

    private final HistoryCarryForward carryForward = new HistoryCarryForward();

    private final Panel history = Panel.of(List.of(
            record("A", "S1", JAN, 10.0, "price_actual", 900.0),
            record("A", "S1", FEB, 20.0, "price_actual", 1000.0)));

    @Test
    void fill_missingCovariate_takesLastKnownValue() {
        Panel inference = Panel.of(List.of(record("A", "S1", MAR, null)));

        CarryForwardResult result = carryForward.fill(inference, history, List.of("price_actual"));

        PanelRecord filled = result.panel().records().get(0);
        assertThat(filled.getExogenous().get("price_actual")).isEqualTo(1000.0);
        assertThat(result.filledValues()).isEqualTo(1);
        assertThat(result.unresolvedEntities()).isEmpty();
    }

    @Test
    void fill_usesOnlyHistoryStrictlyBeforeTheRow() {
        Panel withSameDay = Panel.of(List.of(
                record("A", "S1", JAN, 10.0, "price_actual", 900.0),
                record("A", "S1", FEB, 20.0, "price_actual", 1000.0),
                record("A", "S1", MAR, 30.0, "price_actual", 5000.0)));
        Panel inference = Panel.of(List.of(record("A", "S1", MAR, null)));

        CarryForwardResult result = carryForward.fill(inference, withSameDay, List.of("price_actual"));

        assertThat(result.panel().records().get(0).getExogenous().get("price_actual")).isEqualTo(1000.0);
    }

    @Test
    void fill_skipsMissingHistoryValues() {
        Panel gappy = Panel.of(List.of(
                record("A", "S1", JAN, 10.0, "price_actual", 900.0),
                record("A", "S1", FEB, 20.0, "price_actual", null)));
        Panel inference = Panel.of(List.of(record("A", "S1", MAR, null)));

        CarryForwardResult result = carryForward.fill(inference, gappy, List.of("price_actual"));

        assertThat(result.panel().records().get(0).getExogenous().get("price_actual")).isEqualTo(900.0);
    }

    @Test
    void fill_presentValue_isKept() {
        Panel inference = Panel.of(List.of(record("A", "S1", MAR, null, "price_actual", 1200.0)));

        CarryForwardResult result = carryForward.fill(inference, history, List.of("price_actual"));

        assertThat(result.panel().records().get(0).getExogenous().get("price_actual")).isEqualTo(1200.0);
        assertThat(result.filledValues()).isZero();
    }

    @Test
    void fill_entityWithoutHistory_staysMissingAndIsReported() {
        Panel inference = Panel.of(List.of(record("B", "S1", MAR, null)));

        CarryForwardResult result = carryForward.fill(inference, history, List.of("price_actual"));

        PanelRecord row = result.panel().records().get(0);
        assertThat(row.getExogenous()).containsKey("price_actual");
        assertThat(row.getExogenous().get("price_actual")).isNull();
        assertThat(result.unresolvedEntities()).containsExactly(new EntityKey("B", "S1"));
    }

    @Test
    void fill_neverTouchesTarget() {
        Panel inference = Panel.of(List.of(record("A", "S1", MAR, null)));

        CarryForwardResult result = carryForward.fill(inference, history, List.of("price_actual", "volume"));

        assertThat(result.panel().records().get(0).getTarget()).isNull();
    }

    @Test
    void fill_leavesInputPanelUnchanged() {
        PanelRecord original = record("A", "S1", MAR, null);
        Panel inference = Panel.of(List.of(original));

        carryForward.fill(inference, history, List.of("price_actual"));

        assertThat(original.getExogenous()).doesNotContainKey("price_actual");
    }
}
