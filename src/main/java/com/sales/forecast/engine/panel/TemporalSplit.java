package com.sales.forecast.engine.panel;

import com.sales.forecast.model.Panel;

import java.time.LocalDate;

/**
 * Train holds every row dated before the cutoff, test every row on or after it.
 */
public record TemporalSplit(Panel train, Panel test, LocalDate cutoff) {
}
