package org.flowxmi.activity.conversion.layout.models;

import lombok.Builder;

/**
 * Tunable constants of the layout and overlap phases. Unset (zero) values fall back to the defaults.
 */
@Builder
public record LayoutSettings(
        int canvasWidth,   // minimum canvas size, grows to fit the grid
        int canvasHeight,
        int marginX,
        int marginY,
        double columnSpacingFactor,  // column pitch = widest node * factor
        double rowSpacingFactor,     // row pitch = tallest node * factor
        int laneMarginX,
        int laneMarginTop,
        int laneMarginBottom,
        int overlapIterationCap,
        int levelingPassCap,
        int crossingReductionSweeps,
        Boolean finalsOnLastLayer
) {
    public static final int DEFAULT_CANVAS_WIDTH = 1600;
    public static final int DEFAULT_CANVAS_HEIGHT = 1400;

    // Default values for unset fields
    public LayoutSettings {
        if (canvasWidth <= 0) {
            canvasWidth = DEFAULT_CANVAS_WIDTH;
        }
        if (canvasHeight <= 0) {
            canvasHeight = DEFAULT_CANVAS_HEIGHT;
        }
        if (marginX <= 0) {
            marginX = 120;
        }
        if (marginY <= 0) {
            marginY = 100;
        }
        if (columnSpacingFactor <= 0) {
            columnSpacingFactor = 1.5;
        }
        if (rowSpacingFactor <= 0) {
            rowSpacingFactor = 2.5;
        }
        if (laneMarginX <= 0) {
            laneMarginX = 20;
        }
        if (laneMarginTop <= 0) {
            laneMarginTop = 40;
        }
        if (laneMarginBottom <= 0) {
            laneMarginBottom = 40;
        }
        if (overlapIterationCap <= 0) {
            overlapIterationCap = 10;
        }
        if (levelingPassCap <= 0) {
            levelingPassCap = 10_000;
        }
        if (crossingReductionSweeps < 0) {
            crossingReductionSweeps = 0;
        }
        if (finalsOnLastLayer == null) {
            finalsOnLastLayer = Boolean.TRUE;
        }
    }

    public static LayoutSettings defaults() {
        return LayoutSettings.builder()
                .crossingReductionSweeps(5)
                .build();
    }

    public LayoutSettingsBuilder toBuilder() {
        return LayoutSettings.builder()
                .canvasWidth(this.canvasWidth)
                .canvasHeight(this.canvasHeight)
                .marginX(this.marginX)
                .marginY(this.marginY)
                .columnSpacingFactor(this.columnSpacingFactor)
                .rowSpacingFactor(this.rowSpacingFactor)
                .laneMarginX(this.laneMarginX)
                .laneMarginTop(this.laneMarginTop)
                .laneMarginBottom(this.laneMarginBottom)
                .overlapIterationCap(this.overlapIterationCap)
                .levelingPassCap(this.levelingPassCap)
                .crossingReductionSweeps(this.crossingReductionSweeps)
                .finalsOnLastLayer(this.finalsOnLastLayer);
    }
}
