package com.sizekit.measure;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;

/**
 * Extracts the longest connected edge components from an {@link EdgeMap}.
 * <p>
 * Traces start only from seed pixels inside the search region but may follow an edge
 * outside it. A component larger than the point cap is consumed whole and discarded,
 * never returned as a partial outline.
 */
public class ContourTracer {

    private static final int[] DX = {1, 1, 0, -1, -1, -1, 0, 1};
    private static final int[] DY = {0, 1, 1, 1, 0, -1, -1, -1};

    private final int minLength;
    private final double capFactor;
    private final int maxContours;

    /**
     * @param contours       Retained contours, longest first
     * @param tracedCount    Number of traces started, including discarded ones
     * @param truncatedCount Traces discarded because they exceeded the point cap
     */
    public record Result(List<Contour> contours, int tracedCount, int truncatedCount) {
        public Result {
            contours = List.copyOf(contours);
        }
    }

    private record Trace(List<Point> points, boolean truncated) {}

    public ContourTracer() {
        this(CardDetectionSettings.DEFAULT);
    }

    public ContourTracer(CardDetectionSettings settings) {
        this(settings.minContourLength(), settings.contourCapFactor(), settings.maxContours());
    }

    /**
     * @param minLength   Shorter contours are noise
     * @param capFactor   Point cap per trace, as a multiple of the edge map's width + height
     * @param maxContours Number of longest contours kept
     */
    public ContourTracer(int minLength, double capFactor, int maxContours) {
        if (minLength < 1) {
            throw new IllegalArgumentException("minLength must be >= 1, got " + minLength);
        }
        if (!(capFactor > 0) || Double.isInfinite(capFactor)) {
            throw new IllegalArgumentException("capFactor must be a positive number, got " + capFactor);
        }
        if (maxContours < 1) {
            throw new IllegalArgumentException("maxContours must be >= 1, got " + maxContours);
        }
        this.minLength = minLength;
        this.capFactor = capFactor;
        this.maxContours = maxContours;
    }

    /** Largest number of pixels a single trace over {@code edges} may collect. */
    public int pointCap(EdgeMap edges) {
        double cap = Math.ceil(capFactor * ((double) edges.width() + edges.height()));
        return (int) Math.min(Integer.MAX_VALUE, Math.max(minLength, cap));
    }

    /**
     * @param edges        Edge mask
     * @param searchRegion Seed area, or null for the full frame
     */
    public Result trace(EdgeMap edges, Region searchRegion) {
        int w = edges.width();
        int h = edges.height();
        int cap = pointCap(edges);
        boolean[] visited = new boolean[w * h];

        // Border pixels are never edges, seeds stay in the interior.
        int minX = 1;
        int minY = 1;
        int maxX = w - 1;
        int maxY = h - 1;
        if (searchRegion != null) {
            minX = Math.max(minX, searchRegion.x());
            minY = Math.max(minY, searchRegion.y());
            maxX = Math.min(maxX, searchRegion.right());
            maxY = Math.min(maxY, searchRegion.bottom());
        }

        List<Contour> contours = new ArrayList<>();
        int traced = 0;
        int truncated = 0;
        for (int y = minY; y < maxY; y++) {
            for (int x = minX; x < maxX; x++) {
                int idx = y * w + x;
                if (!edges.isEdge(x, y) || visited[idx]) continue;

                Trace trace = traceFrom(edges, visited, x, y, cap);
                traced++;
                if (trace.truncated()) {
                    truncated++;
                } else if (trace.points().size() >= minLength) {
                    contours.add(new Contour(trace.points()));
                }
            }
        }

        // Longest first: the card outline is one of the largest boundaries in the search area
        contours.sort(Comparator.comparingInt(Contour::length).reversed());
        if (contours.size() > maxContours) {
            contours = new ArrayList<>(contours.subList(0, maxContours));
        }
        return new Result(contours, traced, truncated);
    }

    /**
     * Flood the component containing the start pixel. Past the cap, pixels are still marked
     * visited so the rest of the component cannot resurface as a separate fragment.
     */
    private Trace traceFrom(EdgeMap edges, boolean[] visited, int startX, int startY, int cap) {
        int w = edges.width();
        int h = edges.height();
        List<Point> points = new ArrayList<>();
        boolean truncated = false;
        Deque<Integer> stack = new ArrayDeque<>();
        stack.push(startY * w + startX);

        while (!stack.isEmpty()) {
            int idx = stack.pop();
            if (visited[idx]) continue;
            visited[idx] = true;

            int x = idx % w;
            int y = idx / w;
            if (!truncated) {
                if (points.size() < cap) {
                    points.add(Point.of(x, y));
                } else {
                    truncated = true;
                    points = List.of();
                }
            }

            for (int i = 0; i < DX.length; i++) {
                int nx = x + DX[i];
                int ny = y + DY[i];
                if (nx < 0 || nx >= w || ny < 0 || ny >= h) continue;
                int nIdx = ny * w + nx;
                if (!visited[nIdx] && edges.isEdge(nx, ny)) {
                    stack.push(nIdx);
                }
            }
        }
        return new Trace(points, truncated);
    }
}
