package org.flowxmi.activity.conversion.config.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Root configuration file structure.
 * Groups diagram export settings, layout constants and repair heuristics.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ConverterConfig {
    public DiagramConfig diagram = new DiagramConfig();
    public LayoutConfig layout = new LayoutConfig();
    public RepairConfig repair = new RepairConfig();
}
