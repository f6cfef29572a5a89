package com.sales.forecast.engine.panel;

import com.sales.forecast.exception.EmptyPartitionException;
import com.sales.forecast.model.Panel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.LocalDate;

/**
 * Splits a panel at a single global cutoff date, so every test row is later than every train row.
 */
@Component
public class TemporalSplitter {

    private static final Logger log = LoggerFactory.getLogger(TemporalSplitter.class);

    /**
     * @throws EmptyPartitionException if either side of the cutoff has no rows
     */
    public TemporalSplit split(Panel panel, LocalDate cutoff) {
        Panel train = panel.filter(r -> r.getDate().isBefore(cutoff));
        Panel test = panel.filter(r -> !r.getDate().isBefore(cutoff));

        if (train.isEmpty()) throw new EmptyPartitionException("train", cutoff);
        if (test.isEmpty()) throw new EmptyPartitionException("test", cutoff);

        log.info("Train: {} rows ({} -> {})", train.size(), train.minDate(), train.maxDate());
        log.info("Test:  {} rows ({} -> {})", test.size(), test.minDate(), test.maxDate());
        return new TemporalSplit(train, test, cutoff);
    }

    /**
     * Holds out the last {@code periods} months: the cutoff is the date {@code periods} months
     * before the last date of the panel, and rows on the cutoff go to the test side.
     */
    public TemporalSplit splitByPeriods(Panel panel, int periods) {
        if (panel.isEmpty()) {
            throw new EmptyPartitionException("train", null);
        }
        return split(panel, panel.maxDate().minusMonths(periods));
    }
}
