package com.sales.forecast.model;

import java.util.Comparator;

/**
 * Identifies one sales series: an (agency, SKU) pair.
 */
public record EntityKey(String agency, String sku) implements Comparable<EntityKey> {

    private static final Comparator<EntityKey> ORDER =
            Comparator.comparing(EntityKey::agency).thenComparing(EntityKey::sku);

    @Override
    public int compareTo(EntityKey other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return agency + "/" + sku;
    }
}
