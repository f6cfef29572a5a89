package com.sales.forecast.model;

import java.time.LocalDate;

public record Prediction(LocalDate date, String agency, String sku, double prediction) {
}
