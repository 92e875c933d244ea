package org.flowxmi.activity.conversion.config.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Layout constants as written in the configuration file. Missing or zero values
 * fall back to the layout defaults.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class LayoutConfig {
    public int canvasWidth;
    public int canvasHeight;
    public int marginX;
    public int marginY;
    public double columnSpacingFactor;
    public double rowSpacingFactor;
    public int laneMarginX;
    public int laneMarginTop;
    public int laneMarginBottom;
    public int overlapIterationCap;
    public int levelingPassCap;
    public int crossingReductionSweeps = 5;
    public Boolean finalsOnLastLayer;
}
