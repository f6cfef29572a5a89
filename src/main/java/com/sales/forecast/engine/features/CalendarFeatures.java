package com.sales.forecast.engine.features;

/**
 * Calendar attributes of a date.
 *
 * @param dayOfWeek  Monday = 0 ... Sunday = 6
 * @param weekOfYear ISO-8601 week number
 */
public record CalendarFeatures(int year, int month, int day, int dayOfWeek, int weekOfYear, int quarter) {
}
