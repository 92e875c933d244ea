package org.flowxmi.activity.conversion.layout.models;

public record SwimlaneBounds(int left, int top, int right, int bottom) {

    public int width() {
        return right - left;
    }

    public int height() {
        return bottom - top;
    }
}
