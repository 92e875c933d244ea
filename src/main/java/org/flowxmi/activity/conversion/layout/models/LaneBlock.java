package org.flowxmi.activity.conversion.layout.models;

/**
 * Contiguous run of grid columns owned by one swimlane.
 */
public record LaneBlock(int firstColumn, int columnCount) {
}
