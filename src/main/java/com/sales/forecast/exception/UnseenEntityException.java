package com.sales.forecast.exception;

public class UnseenEntityException extends ForecastException {
    public UnseenEntityException(String field, String value) {
        super("UNSEEN_ENTITY",
              "Value '" + value + "' of '" + field + "' was not seen at training time.");
    }
}
