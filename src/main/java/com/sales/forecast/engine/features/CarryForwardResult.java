package com.sales.forecast.engine.features;

import com.sales.forecast.model.EntityKey;
import com.sales.forecast.model.Panel;

import java.util.Set;

/**
 * @param filledValues        number of covariate cells filled from history
 * @param unresolvedEntities  entities with at least one covariate left missing for lack of history
 */
public record CarryForwardResult(Panel panel, int filledValues, Set<EntityKey> unresolvedEntities) {

    public CarryForwardResult {
        unresolvedEntities = Set.copyOf(unresolvedEntities);
    }
}
