package com.sales.forecast.engine.panel;

import com.sales.forecast.model.Panel;
import com.sales.forecast.model.PanelSchema;

public record LoadedPanel(Panel panel, PanelSchema schema) {
}
