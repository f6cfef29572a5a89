package com.sales.forecast.exception;

public class SchemaException extends ForecastException {
    public SchemaException(String message) {
        super("SCHEMA_ERROR", message);
    }
}
