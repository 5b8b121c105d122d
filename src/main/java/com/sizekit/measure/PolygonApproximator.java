package com.sizekit.measure;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Reduces a contour to a quadrilateral.
 * <p>
 * The contour is put in path order by polar angle around its centroid, then simplified
 * as a closed curve with Ramer-Douglas-Peucker. Epsilon grows through a fixed list of
 * perimeter fractions until exactly four vertices remain. If none does, the four extreme
 * points of the contour are used instead.
 * <p>
 * Deterministic: identical input always produces identical output.
 */
public class PolygonApproximator {

    private static final double MIN_AREA = 1.0;

    private final double[] epsilonFractions;

    public PolygonApproximator() {
        this(CardDetectionSettings.DEFAULT.epsilonFractions());
    }

    public PolygonApproximator(double[] epsilonFractions) {
        this.epsilonFractions = epsilonFractions.clone();
    }

    /**
     * @return the ordered quadrilateral, or empty when the contour cannot yield a usable one
     */
    public Optional<Polygon> approximate(Contour contour) {
        List<Point> points = contour.points();
        if (points.size() < 4) {
            return Optional.empty();
        }

        List<Point> path = orderByAngle(points, contour.centroid());
        double perimeter = closedPerimeter(path);

        for (double fraction : epsilonFractions) {
            List<Point> simplified = simplifyClosed(path, fraction * perimeter);
            if (simplified.size() == 4) {
                return toQuad(simplified);
            }
        }
        return toQuad(extremePoints(points));
    }

    /**
     * Fallback corners: TL minimizes x+y, TR maximizes x-y, BR maximizes x+y, BL maximizes y-x.
     */
    static List<Point> extremePoints(List<Point> points) {
        Point topLeft = points.get(0);
        Point topRight = points.get(0);
        Point bottomRight = points.get(0);
        Point bottomLeft = points.get(0);
        for (Point p : points) {
            if (p.x() + p.y() < topLeft.x() + topLeft.y()) topLeft = p;
            if (p.x() - p.y() > topRight.x() - topRight.y()) topRight = p;
            if (p.x() + p.y() > bottomRight.x() + bottomRight.y()) bottomRight = p;
            if (p.y() - p.x() > bottomLeft.y() - bottomLeft.x()) bottomLeft = p;
        }
        return List.of(topLeft, topRight, bottomRight, bottomLeft);
    }

    /**
     * Closed-curve simplification: split the ring at two far-apart anchors and simplify
     * both halves as open polylines.
     */
    static List<Point> simplifyClosed(List<Point> ring, double epsilon) {
        int n = ring.size();
        if (n < 3) return new ArrayList<>(ring);

        int a = farthestFrom(ring, ring.get(0));
        int b = farthestFrom(ring, ring.get(a));
        if (a == b) return List.of(ring.get(a));
        int i = Math.min(a, b);
        int j = Math.max(a, b);

        List<Point> first = new ArrayList<>(ring.subList(i, j + 1));
        List<Point> second = new ArrayList<>(ring.subList(j, n));
        second.addAll(ring.subList(0, i + 1));

        List<Point> s1 = simplifyOpen(first, epsilon);
        List<Point> s2 = simplifyOpen(second, epsilon);

        // Each half ends where the other starts
        List<Point> result = new ArrayList<>(s1.subList(0, s1.size() - 1));
        result.addAll(s2.subList(0, s2.size() - 1));
        return result;
    }

    /**
     * Iterative Ramer-Douglas-Peucker, avoids deep recursion on long contours.
     */
    static List<Point> simplifyOpen(List<Point> points, double epsilon) {
        int n = points.size();
        if (n < 3) return new ArrayList<>(points);

        boolean[] keep = new boolean[n];
        keep[0] = true;
        keep[n - 1] = true;
        Deque<int[]> ranges = new ArrayDeque<>();
        ranges.push(new int[]{0, n - 1});

        while (!ranges.isEmpty()) {
            int[] range = ranges.pop();
            int start = range[0];
            int end = range[1];
            double maxDist = 0;
            int maxIdx = -1;
            for (int k = start + 1; k < end; k++) {
                double d = distanceToSegment(points.get(k), points.get(start), points.get(end));
                if (d > maxDist) {
                    maxDist = d;
                    maxIdx = k;
                }
            }
            if (maxIdx >= 0 && maxDist > epsilon) {
                keep[maxIdx] = true;
                ranges.push(new int[]{start, maxIdx});
                ranges.push(new int[]{maxIdx, end});
            }
        }

        List<Point> result = new ArrayList<>();
        for (int k = 0; k < n; k++) {
            if (keep[k]) result.add(points.get(k));
        }
        return result;
    }

    static double distanceToSegment(Point p, Point a, Point b) {
        double dx = b.x() - a.x();
        double dy = b.y() - a.y();
        double lenSq = dx * dx + dy * dy;
        if (lenSq == 0) {
            return p.distanceTo(a);
        }
        double t = ((p.x() - a.x()) * dx + (p.y() - a.y()) * dy) / lenSq;
        t = Math.max(0, Math.min(1, t));
        return Math.hypot(p.x() - (a.x() + t * dx), p.y() - (a.y() + t * dy));
    }

    private static List<Point> orderByAngle(List<Point> points, Point center) {
        List<Point> path = new ArrayList<>(points);
        path.sort(Comparator
                .comparingDouble((Point p) -> Math.atan2(p.y() - center.y(), p.x() - center.x()))
                .thenComparingDouble(p -> p.distanceTo(center)));
        return path;
    }

    private static double closedPerimeter(List<Point> path) {
        double perimeter = 0;
        for (int k = 0; k < path.size(); k++) {
            perimeter += path.get(k).distanceTo(path.get((k + 1) % path.size()));
        }
        return perimeter;
    }

    private static int farthestFrom(List<Point> points, Point origin) {
        int best = 0;
        double bestDist = -1;
        for (int k = 0; k < points.size(); k++) {
            double d = points.get(k).distanceTo(origin);
            if (d > bestDist) {
                bestDist = d;
                best = k;
            }
        }
        return best;
    }

    private static Optional<Polygon> toQuad(List<Point> corners) {
        Polygon polygon = Polygon.ordered(corners);
        if (polygon.hasRepeatedCorners() || polygon.area() < MIN_AREA) {
            return Optional.empty();
        }
        return Optional.of(polygon);
    }
}
