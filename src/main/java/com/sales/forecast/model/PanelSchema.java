package com.sales.forecast.model;

import java.util.List;

/**
 * Column layout of a panel, fixed once at training time and reused unchanged for inference.
 *
 * @param exogenousColumns        covariates kept as model inputs, in declaration order
 * @param droppedConstantColumns  columns elided at training because they held a single value
 */
public record PanelSchema(List<String> exogenousColumns, List<String> droppedConstantColumns) {

    public PanelSchema {
        exogenousColumns = List.copyOf(exogenousColumns);
        droppedConstantColumns = List.copyOf(droppedConstantColumns);
    }
}
