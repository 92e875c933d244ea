package org.flowxmi.activity.conversion.layout.models;

/**
 * Placed bounding box of a node. {@code x}/{@code y} is the top-left corner.
 *
 * @param x      left edge
 * @param y      top edge
 * @param width  box width, positive
 * @param height box height, positive
 * @param layer  the layer the node was assigned to, -1 when unknown
 */
public record NodeGeometry(
        int x,
        int y,
        int width,
        int height,
        int layer
) {
    public int right() {
        return x + width;
    }

    public int bottom() {
        return y + height;
    }

    public int centerX() {
        return x + width / 2;
    }

    public int centerY() {
        return y + height / 2;
    }

    public NodeGeometry withPosition(int newX, int newY) {
        return new NodeGeometry(newX, newY, width, height, layer);
    }

    /** True when the two boxes share interior area; touching edges do not count. */
    public boolean overlaps(NodeGeometry other) {
        return x < other.right() && other.x < right()
                && y < other.bottom() && other.y < bottom();
    }

    public boolean sameAnchor(NodeGeometry other) {
        return x == other.x && y == other.y;
    }
}
