package com.sales.forecast.model;

import java.time.LocalDate;

public record DatasetSummary(int rows, int columns, LocalDate dateMin, LocalDate dateMax,
                             int agencies, int skus) {
}
