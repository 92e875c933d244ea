package org.flowxmi.activity.conversion.layout.models;

/**
 * Width and height of a node, in diagram units.
 */
public record Size(int width, int height) {
}
