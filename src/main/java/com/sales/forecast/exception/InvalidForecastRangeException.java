package com.sales.forecast.exception;

public class InvalidForecastRangeException extends ForecastException {
    public InvalidForecastRangeException(String message) {
        super("INVALID_FORECAST_RANGE", message);
    }
}
