package com.sales.forecast.engine.features;

import com.sales.forecast.model.Panel;
import com.sales.forecast.model.PanelRecord;

import java.util.ArrayList;
import java.util.List;

public record EntityEncoders(CategoricalEncoder agency, CategoricalEncoder sku) {

    public static final String AGENCY_ENCODED = "agency_encoded";
    public static final String SKU_ENCODED = "sku_encoded";

    public static EntityEncoders fit(Panel reference) {
        List<String> agencies = new ArrayList<>();
        List<String> skus = new ArrayList<>();
        for (PanelRecord record : reference.records()) {
            agencies.add(record.getAgency());
            skus.add(record.getSku());
        }
        return new EntityEncoders(
                CategoricalEncoder.fit("agency", agencies),
                CategoricalEncoder.fit("sku", skus));
    }
}
