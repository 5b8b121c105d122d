package com.sizekit.measure;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ContourTracerTest {

    /** One-pixel rectangle outlines on an otherwise empty mask. */
    static EdgeMap outlines(int w, int h, int[]... rects) {
        boolean[] edges = new boolean[w * h];
        for (int[] r : rects) {
            int x0 = r[0], y0 = r[1], x1 = r[0] + r[2] - 1, y1 = r[1] + r[3] - 1;
            for (int x = x0; x <= x1; x++) {
                edges[y0 * w + x] = true;
                edges[y1 * w + x] = true;
            }
            for (int y = y0; y <= y1; y++) {
                edges[y * w + x0] = true;
                edges[y * w + x1] = true;
            }
        }
        return new EdgeMap(w, h, edges);
    }

    @Test
    void singleOutline_isOneContour() {
        EdgeMap edges = outlines(200, 200, new int[]{20, 30, 100, 60});
        ContourTracer.Result result = new ContourTracer(10, 6.0, 5).trace(edges, null);

        assertEquals(1, result.contours().size());
        assertEquals(1, result.tracedCount());
        // 2 * (100 + 60) - 4 shared corners
        assertEquals(316, result.contours().get(0).length());
    }

    @Test
    void shortContours_discarded() {
        EdgeMap edges = outlines(200, 200, new int[]{10, 10, 100, 60}, new int[]{150, 150, 5, 5});
        ContourTracer.Result result = new ContourTracer(50, 6.0, 5).trace(edges, null);

        assertEquals(1, result.contours().size());
        assertEquals(2, result.tracedCount());
    }

    @Test
    void keepsOnlyLongestContours_longestFirst() {
        EdgeMap edges = outlines(300, 300,
                new int[]{5, 5, 40, 40},
                new int[]{60, 5, 100, 100},
                new int[]{5, 180, 60, 60});
        ContourTracer.Result result = new ContourTracer(10, 6.0, 2).trace(edges, null);

        assertEquals(2, result.contours().size());
        assertEquals(3, result.tracedCount());
        assertTrue(result.contours().get(0).length() > result.contours().get(1).length());
        assertEquals(396, result.contours().get(0).length());
    }

    @Test
    void seedsRestrictedToSearchRegion_butTraceMayLeaveIt() {
        EdgeMap edges = outlines(300, 300, new int[]{10, 10, 100, 100}, new int[]{180, 180, 100, 100});
        // Region covers only the top-left corner of the first outline
        ContourTracer.Result result = new ContourTracer(10, 6.0, 5).trace(edges, new Region(0, 0, 30, 30));

        assertEquals(1, result.contours().size());
        assertEquals(396, result.contours().get(0).length(), "whole outline is followed");
    }

    @Test
    void componentOverCap_isDiscardedWhole() {
        // 796-pixel outline, cap = 0.5 * (300 + 300) = 300
        EdgeMap edges = outlines(300, 300, new int[]{10, 10, 200, 200}, new int[]{240, 240, 20, 20});
        ContourTracer tracer = new ContourTracer(10, 0.5, 5);
        assertEquals(300, tracer.pointCap(edges));

        ContourTracer.Result result = tracer.trace(edges, null);

        assertEquals(2, result.tracedCount(), "no leftover fragments are traced");
        assertEquals(1, result.truncatedCount());
        assertEquals(1, result.contours().size());
        assertEquals(76, result.contours().get(0).length());
    }

    @Test
    void pointCap_scalesWithFrame() {
        ContourTracer tracer = new ContourTracer();
        assertEquals(6 * (1000 + 800), tracer.pointCap(new EdgeMap(1000, 800, new boolean[800_000])));
        assertEquals(6 * (4000 + 3000), tracer.pointCap(new EdgeMap(4000, 3000, new boolean[12_000_000])));
        // never below the minimum length
        assertEquals(40, new ContourTracer(40, 0.01, 5).pointCap(new EdgeMap(10, 10, new boolean[100])));
    }

    @Test
    void invalidConstruction_rejected() {
        assertThrows(IllegalArgumentException.class, () -> new ContourTracer(0, 6.0, 5));
        assertThrows(IllegalArgumentException.class, () -> new ContourTracer(10, 0, 5));
        assertThrows(IllegalArgumentException.class, () -> new ContourTracer(10, Double.NaN, 5));
        assertThrows(IllegalArgumentException.class, () -> new ContourTracer(10, Double.POSITIVE_INFINITY, 5));
        assertThrows(IllegalArgumentException.class, () -> new ContourTracer(10, 6.0, 0));
    }

    @Test
    void emptyMask_noContours() {
        ContourTracer.Result result = new ContourTracer().trace(new EdgeMap(50, 50, new boolean[2500]), null);
        assertTrue(result.contours().isEmpty());
        assertEquals(0, result.tracedCount());
    }
}
