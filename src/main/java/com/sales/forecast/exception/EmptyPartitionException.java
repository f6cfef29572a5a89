package com.sales.forecast.exception;

import java.time.LocalDate;

public class EmptyPartitionException extends ForecastException {
    public EmptyPartitionException(String side, LocalDate cutoff) {
        super("EMPTY_PARTITION",
              "The " + side + " partition is empty for cutoff date " + cutoff + ".");
    }
}
