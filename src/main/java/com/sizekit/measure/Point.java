package com.sizekit.measure;

/**
 * A 2-D point in pixel coordinates. Used for landmarks, contour pixels and polygon corners.
 */
public record Point(double x, double y) {

    public static Point of(int x, int y) {
        return new Point(x, y);
    }

    public double distanceTo(Point other) {
        return Math.hypot(other.x - x, other.y - y);
    }
}
