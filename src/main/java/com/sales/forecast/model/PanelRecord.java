package com.sales.forecast.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * One observation of an (agency, SKU) series at a date. Immutable: panels, trailing history and
 * loaded artifacts share records freely.
 *
 * The target is null for rows whose volume is not known yet (new rows to predict,
 * forecast periods). Exogenous covariates are keyed by column name; a null value
 * means the covariate is missing for this row.
 */
@Getter
@EqualsAndHashCode
@ToString
public final class PanelRecord {

    private final String agency;

    private final String sku;

    private final LocalDate date;

    private final Double target;

    private final Map<String, Double> exogenous;

    @Builder(toBuilder = true)
    @JsonCreator
    public PanelRecord(@JsonProperty("agency") String agency,
                       @JsonProperty("sku") String sku,
                       @JsonProperty("date") LocalDate date,
                       @JsonProperty("target") Double target,
                       @JsonProperty("exogenous") Map<String, Double> exogenous) {
        this.agency = agency;
        this.sku = sku;
        this.date = date;
        this.target = target;
        // Copied into a map that keeps null values for missing covariates
        this.exogenous = exogenous == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(exogenous));
    }

    @JsonIgnore
    public EntityKey getEntityKey() {
        return new EntityKey(agency, sku);
    }

    public boolean hasTarget() {
        return target != null;
    }

    public Optional<Double> exogenousValue(String column) {
        return Optional.ofNullable(exogenous.get(column));
    }

    /**
     * Copy of this record with the given covariate set. The original is left untouched.
     */
    public PanelRecord withExogenous(String column, Double value) {
        Map<String, Double> copy = new LinkedHashMap<>(exogenous);
        copy.put(column, value);
        return toBuilder().exogenous(copy).build();
    }

    public PanelRecord withTarget(Double value) {
        return toBuilder().target(value).build();
    }
}
