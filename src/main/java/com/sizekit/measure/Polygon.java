package com.sizekit.measure;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Quadrilateral with corners ordered top-left, top-right, bottom-right, bottom-left.
 */
public record Polygon(List<Point> corners) {

    public Polygon {
        Objects.requireNonNull(corners, "corners");
        if (corners.size() != 4) {
            throw new IllegalArgumentException("Polygon needs exactly 4 corners, got " + corners.size());
        }
        corners = List.copyOf(corners);
    }

    /**
     * Order four arbitrary points as TL, TR, BR, BL.
     * TL has the smallest x+y, BR the largest; TR has the smallest y-x, BL the largest.
     */
    public static Polygon ordered(List<Point> points) {
        if (points.size() != 4) {
            throw new IllegalArgumentException("Polygon needs exactly 4 corners, got " + points.size());
        }
        List<Point> pts = new ArrayList<>(points);
        pts.sort(Comparator.comparingDouble(p -> p.x() + p.y()));
        Point topLeft = pts.get(0);
        Point bottomRight = pts.get(3);
        pts.sort(Comparator.comparingDouble(p -> p.y() - p.x()));
        Point topRight = pts.get(0);
        Point bottomLeft = pts.get(3);
        return new Polygon(List.of(topLeft, topRight, bottomRight, bottomLeft));
    }

    public Point topLeft() {
        return corners.get(0);
    }

    public Point topRight() {
        return corners.get(1);
    }

    public Point bottomRight() {
        return corners.get(2);
    }

    public Point bottomLeft() {
        return corners.get(3);
    }

    /** Average length of the top and bottom edges. */
    public double width() {
        return (topLeft().distanceTo(topRight()) + bottomLeft().distanceTo(bottomRight())) / 2.0;
    }

    /** Average length of the left and right edges. */
    public double height() {
        return (topRight().distanceTo(bottomRight()) + topLeft().distanceTo(bottomLeft())) / 2.0;
    }

    public double longSide() {
        return Math.max(width(), height());
    }

    public double shortSide() {
        return Math.min(width(), height());
    }

    /** Absolute area (shoelace formula). */
    public double area() {
        double s = 0.0;
        for (int i = 0; i < 4; i++) {
            Point a = corners.get(i);
            Point b = corners.get((i + 1) % 4);
            s += a.x() * b.y() - b.x() * a.y();
        }
        return Math.abs(0.5 * s);
    }

    public double perimeter() {
        double p = 0.0;
        for (int i = 0; i < 4; i++) {
            p += corners.get(i).distanceTo(corners.get((i + 1) % 4));
        }
        return p;
    }

    /** True when any two corners coincide. */
    public boolean hasRepeatedCorners() {
        for (int i = 0; i < 4; i++) {
            for (int j = i + 1; j < 4; j++) {
                if (corners.get(i).equals(corners.get(j))) return true;
            }
        }
        return false;
    }

    /**
     * Largest distance between corresponding corners of two polygons.
     */
    public double maxCornerDistance(Polygon other) {
        double max = 0.0;
        for (int i = 0; i < 4; i++) {
            max = Math.max(max, corners.get(i).distanceTo(other.corners.get(i)));
        }
        return max;
    }

    /**
     * Bilinear interpolation inside the quad: (0,0) is TL, (1,0) TR, (1,1) BR, (0,1) BL.
     */
    public Point sample(double t, double s) {
        Point tl = topLeft();
        Point tr = topRight();
        Point br = bottomRight();
        Point bl = bottomLeft();
        double x = (1 - t) * (1 - s) * tl.x() + t * (1 - s) * tr.x() + t * s * br.x() + (1 - t) * s * bl.x();
        double y = (1 - t) * (1 - s) * tl.y() + t * (1 - s) * tr.y() + t * s * br.y() + (1 - t) * s * bl.y();
        return new Point(x, y);
    }

    /**
     * Smallest pixel rectangle containing all four corners.
     */
    public Region boundingBox() {
        double minX = Double.MAX_VALUE;
        double minY = Double.MAX_VALUE;
        double maxX = -Double.MAX_VALUE;
        double maxY = -Double.MAX_VALUE;
        for (Point p : corners) {
            minX = Math.min(minX, p.x());
            minY = Math.min(minY, p.y());
            maxX = Math.max(maxX, p.x());
            maxY = Math.max(maxY, p.y());
        }
        int x0 = (int) Math.floor(minX);
        int y0 = (int) Math.floor(minY);
        int x1 = (int) Math.floor(maxX) + 1;
        int y1 = (int) Math.floor(maxY) + 1;
        return new Region(x0, y0, x1 - x0, y1 - y0);
    }
}
