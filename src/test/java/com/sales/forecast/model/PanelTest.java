package com.sales.forecast.model;

import com.sales.forecast.exception.SchemaException;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static com.sales.forecast.testutil.TestDataFactory.record;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PanelTest {

    @Test
    void of_sortsByAgencySkuThenDate() {
        Panel panel = Panel.of(List.of(
                record("B", "S1", LocalDate.of(2017, 1, 1), 1.0),
                record("A", "S2", LocalDate.of(2017, 2, 1), 2.0),
                record("A", "S2", LocalDate.of(2017, 1, 1), 3.0),
                record("A", "S1", LocalDate.of(2017, 3, 1), 4.0)));

        assertThat(panel.records()).extracting(PanelRecord::getTarget).containsExactly(4.0, 3.0, 2.0, 1.0);
        assertThat(panel.entities()).containsExactly(
                new EntityKey("A", "S1"), new EntityKey("A", "S2"), new EntityKey("B", "S1"));
        assertThat(panel.minDate()).isEqualTo(LocalDate.of(2017, 1, 1));
        assertThat(panel.maxDate()).isEqualTo(LocalDate.of(2017, 3, 1));
    }

    @Test
    void of_duplicateKeyAndDate_isRejected() {
        assertThatThrownBy(() -> Panel.of(List.of(
                record("A", "S1", LocalDate.of(2017, 1, 1), 1.0),
                record("A", "S1", LocalDate.of(2017, 1, 1), 2.0))))
                .isInstanceOf(SchemaException.class)
                .hasMessageContaining("A/S1");
    }

    @Test
    void concat_overlappingRows_isRejected() {
        Panel left = Panel.of(List.of(record("A", "S1", LocalDate.of(2017, 1, 1), 1.0)));
        Panel right = Panel.of(List.of(record("A", "S1", LocalDate.of(2017, 1, 1), null)));

        assertThatThrownBy(() -> left.concat(right)).isInstanceOf(SchemaException.class);
    }

    @Test
    void byEntity_groupsSeriesInDateOrder() {
        Panel panel = Panel.of(List.of(
                record("A", "S1", LocalDate.of(2017, 2, 1), 2.0),
                record("A", "S1", LocalDate.of(2017, 1, 1), 1.0),
                record("B", "S1", LocalDate.of(2017, 1, 1), 5.0)));

        assertThat(panel.byEntity()).containsOnlyKeys(new EntityKey("A", "S1"), new EntityKey("B", "S1"));
        assertThat(panel.byEntity().get(new EntityKey("A", "S1")))
                .extracting(PanelRecord::getTarget).containsExactly(1.0, 2.0);
    }

    @Test
    void empty_hasNoDates() {
        assertThat(Panel.empty().isEmpty()).isTrue();
        assertThat(Panel.empty().maxDate()).isNull();
    }
}
