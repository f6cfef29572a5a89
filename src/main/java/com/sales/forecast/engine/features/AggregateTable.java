package com.sales.forecast.engine.features;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Mean target per group of one {@link AggregateGrouping}. Keys are the group's field values
 * joined with {@link #KEY_SEPARATOR}.
 */
public record AggregateTable(AggregateGrouping grouping, String column, Map<String, Double> means) {

    public static final String KEY_SEPARATOR = "\u001f";

    public AggregateTable {
        means = Collections.unmodifiableMap(new TreeMap<>(means));
    }

    public static String key(List<String> parts) {
        return String.join(KEY_SEPARATOR, parts);
    }

    public Optional<Double> lookup(List<String> parts) {
        return Optional.ofNullable(means.get(key(parts)));
    }
}
