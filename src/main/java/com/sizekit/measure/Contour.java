package com.sizekit.measure;

import java.util.List;

/**
 * One 8-connected set of edge pixels, in traversal order.
 */
public record Contour(List<Point> points) {

    public Contour {
        points = List.copyOf(points);
    }

    public int length() {
        return points.size();
    }

    public Point centroid() {
        double sx = 0;
        double sy = 0;
        for (Point p : points) {
            sx += p.x();
            sy += p.y();
        }
        int n = Math.max(1, points.size());
        return new Point(sx / n, sy / n);
    }
}
