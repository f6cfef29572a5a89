package com.sales.forecast.exception;

public class InsufficientHistoryException extends ForecastException {
    public InsufficientHistoryException(String message) {
        super("INSUFFICIENT_HISTORY", message);
    }
}
