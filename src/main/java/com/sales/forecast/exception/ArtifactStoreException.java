package com.sales.forecast.exception;

public class ArtifactStoreException extends ForecastException {
    public ArtifactStoreException(String message, Throwable cause) {
        super("ARTIFACT_STORE_ERROR", message, cause);
    }
}
