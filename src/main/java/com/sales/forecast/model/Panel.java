package com.sales.forecast.model;

import com.sales.forecast.exception.SchemaException;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.function.Predicate;

/**
 * Immutable time-ordered panel of records, sorted by (agency, sku, date) and unique per
 * (entity, date). Every stage that derives a panel goes through {@link #of(Collection)},
 * so the ordering holds everywhere, not only after loading.
 */
public final class Panel {

    public static final Comparator<PanelRecord> ORDER =
            Comparator.comparing(PanelRecord::getEntityKey).thenComparing(PanelRecord::getDate);

    private static final Panel EMPTY = new Panel(List.of());

    private final List<PanelRecord> records;

    private Panel(List<PanelRecord> records) {
        this.records = Collections.unmodifiableList(records);
    }

    public static Panel empty() {
        return EMPTY;
    }

    /**
     * Sorts the records and rejects duplicate (entity, date) pairs.
     *
     * @throws SchemaException if two records share an entity and a date
     */
    public static Panel of(Collection<PanelRecord> records) {
        List<PanelRecord> sorted = new ArrayList<>(records);
        sorted.sort(ORDER);

        int duplicates = 0;
        PanelRecord first = null;
        for (int i = 1; i < sorted.size(); i++) {
            if (ORDER.compare(sorted.get(i - 1), sorted.get(i)) == 0) {
                if (first == null) first = sorted.get(i);
                duplicates++;
            }
        }
        if (duplicates > 0) {
            throw new SchemaException(String.format("Found %d duplicated rows, first at %s on %s.",
                    duplicates, first.getEntityKey(), first.getDate()));
        }
        return new Panel(sorted);
    }

    /**
     * Verifies that the records are strictly increasing by (entity, date).
     *
     * @throws SchemaException on the first out-of-order or repeated record
     */
    public static void assertOrdered(List<PanelRecord> records) {
        for (int i = 1; i < records.size(); i++) {
            PanelRecord previous = records.get(i - 1);
            PanelRecord current = records.get(i);
            if (ORDER.compare(previous, current) >= 0) {
                throw new SchemaException(String.format(
                        "Panel is not sorted by (agency, sku, date): row %d (%s, %s) follows (%s, %s).",
                        i, current.getEntityKey(), current.getDate(),
                        previous.getEntityKey(), previous.getDate()));
            }
        }
    }

    public List<PanelRecord> records() {
        return records;
    }

    public int size() {
        return records.size();
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    public Panel filter(Predicate<PanelRecord> predicate) {
        List<PanelRecord> kept = new ArrayList<>();
        for (PanelRecord record : records) {
            if (predicate.test(record)) kept.add(record);
        }
        return new Panel(kept);
    }

    public Panel concat(Panel other) {
        List<PanelRecord> all = new ArrayList<>(records.size() + other.size());
        all.addAll(records);
        all.addAll(other.records);
        return of(all);
    }

    /**
     * Records grouped per entity, entities in sorted order, each series in date order.
     */
    public Map<EntityKey, List<PanelRecord>> byEntity() {
        Map<EntityKey, List<PanelRecord>> groups = new LinkedHashMap<>();
        for (PanelRecord record : records) {
            groups.computeIfAbsent(record.getEntityKey(), k -> new ArrayList<>()).add(record);
        }
        return groups;
    }

    public SortedSet<EntityKey> entities() {
        SortedSet<EntityKey> keys = new TreeSet<>();
        for (PanelRecord record : records) keys.add(record.getEntityKey());
        return keys;
    }

    public LocalDate minDate() {
        return records.stream().map(PanelRecord::getDate).min(Comparator.naturalOrder()).orElse(null);
    }

    public LocalDate maxDate() {
        return records.stream().map(PanelRecord::getDate).max(Comparator.naturalOrder()).orElse(null);
    }
}
