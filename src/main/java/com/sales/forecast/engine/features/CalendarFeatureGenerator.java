package com.sales.forecast.engine.features;

import com.sales.forecast.exception.PanelParseException;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.time.temporal.IsoFields;

public final class CalendarFeatureGenerator {

    public static final String YEAR = "year";
    public static final String MONTH = "month";
    public static final String DAY = "day";
    public static final String DAY_OF_WEEK = "day_of_week";
    public static final String WEEK_OF_YEAR = "week_of_year";
    public static final String QUARTER = "quarter";

    public static final String[] FEATURE_NAMES = {YEAR, MONTH, DAY, DAY_OF_WEEK, WEEK_OF_YEAR, QUARTER};

    private CalendarFeatureGenerator() {}

    public static CalendarFeatures generate(LocalDate date) {
        int month = date.getMonthValue();
        return new CalendarFeatures(
                date.getYear(),
                month,
                date.getDayOfMonth(),
                date.getDayOfWeek().getValue() - 1,
                date.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR),
                (month - 1) / 3 + 1);
    }

    public static double[] toArray(CalendarFeatures features) {
        return new double[]{
                features.year(),
                features.month(),
                features.day(),
                features.dayOfWeek(),
                features.weekOfYear(),
                features.quarter()
        };
    }

    /**
     * Parses an ISO date. A trailing time part ({@code 2017-01-01 00:00:00} or
     * {@code 2017-01-01T00:00:00}) is accepted and ignored.
     *
     * @throws PanelParseException if the value is blank or not a date
     */
    public static LocalDate parseDate(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new PanelParseException("Missing date value");
        }
        String value = raw.trim();
        if (value.length() > 10 && (value.charAt(10) == ' ' || value.charAt(10) == 'T')) {
            value = value.substring(0, 10);
        }
        try {
            return LocalDate.parse(value);
        } catch (DateTimeParseException e) {
            throw new PanelParseException("Malformed date '" + raw + "'", e);
        }
    }
}
