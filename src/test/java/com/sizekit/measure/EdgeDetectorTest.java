package com.sizekit.measure;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class EdgeDetectorTest {

    /** Left half {@code left}, right half (x >= splitX) {@code right}. */
    static GrayImage verticalStep(int w, int h, int splitX, int left, int right) {
        int[] values = new int[w * h];
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                values[y * w + x] = x < splitX ? left : right;
            }
        }
        return new GrayImage(w, h, values);
    }

    @Test
    void flatImage_hasNoEdges() {
        EdgeMap edges = new EdgeDetector().detect(verticalStep(20, 20, 10, 128, 128));
        assertEquals(0, edges.edgeCount());
    }

    @Test
    void step_marksTwoColumnBand() {
        EdgeMap edges = new EdgeDetector().detect(verticalStep(20, 10, 10, 50, 240));

        for (int y = 1; y < 9; y++) {
            assertTrue(edges.isEdge(9, y), "x=9 y=" + y);
            assertTrue(edges.isEdge(10, y), "x=10 y=" + y);
            assertFalse(edges.isEdge(8, y));
            assertFalse(edges.isEdge(11, y));
        }
        assertEquals(2 * 8, edges.edgeCount());
    }

    @Test
    void borderPixels_neverEdges() {
        EdgeMap edges = new EdgeDetector().detect(verticalStep(20, 10, 10, 0, 255));
        assertFalse(edges.isEdge(9, 0));
        assertFalse(edges.isEdge(10, 9));
    }

    @Test
    void threshold_isStrict() {
        // A step of d gives |gx| = 4d on the band
        assertEquals(0, new EdgeDetector(40).detect(verticalStep(10, 10, 5, 100, 110)).edgeCount());
        assertTrue(new EdgeDetector(40).detect(verticalStep(10, 10, 5, 100, 111)).edgeCount() > 0);
    }

    @Test
    void horizontalStep_detected() {
        int w = 12;
        int h = 12;
        int[] values = new int[w * h];
        for (int y = 6; y < h; y++) {
            for (int x = 0; x < w; x++) values[y * w + x] = 200;
        }
        EdgeMap edges = new EdgeDetector().detect(new GrayImage(w, h, values));
        assertTrue(edges.isEdge(4, 5));
        assertTrue(edges.isEdge(4, 6));
        assertFalse(edges.isEdge(4, 3));
    }

    @Test
    void negativeThreshold_rejected() {
        assertThrows(IllegalArgumentException.class, () -> new EdgeDetector(-1));
    }

    @Test
    void edgeMap_dimensionsMustMatch() {
        assertThrows(IllegalArgumentException.class, () -> new EdgeMap(3, 3, new boolean[8]));
        assertThrows(IllegalArgumentException.class, () -> new EdgeMap(65536, 65536, new boolean[0]));
        assertThrows(NullPointerException.class, () -> new EdgeMap(3, 3, null));
    }
}
