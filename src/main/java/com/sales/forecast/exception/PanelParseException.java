package com.sales.forecast.exception;

public class PanelParseException extends ForecastException {
    public PanelParseException(String message) {
        super("PARSE_ERROR", message);
    }
    public PanelParseException(String message, Throwable cause) {
        super("PARSE_ERROR", message, cause);
    }
}
