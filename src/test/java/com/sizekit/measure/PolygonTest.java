package com.sizekit.measure;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PolygonTest {

    static Polygon rect(double x, double y, double w, double h) {
        return new Polygon(List.of(new Point(x, y), new Point(x + w, y), new Point(x + w, y + h), new Point(x, y + h)));
    }

    @Test
    void ordered_sortsCornersClockwiseFromTopLeft() {
        Polygon p = Polygon.ordered(List.of(
                new Point(400, 300), new Point(10, 20), new Point(15, 310), new Point(390, 5)));

        assertEquals(new Point(10, 20), p.topLeft());
        assertEquals(new Point(390, 5), p.topRight());
        assertEquals(new Point(400, 300), p.bottomRight());
        assertEquals(new Point(15, 310), p.bottomLeft());
    }

    @Test
    void requiresExactlyFourCorners() {
        assertThrows(IllegalArgumentException.class,
                () -> new Polygon(List.of(new Point(0, 0), new Point(1, 0), new Point(1, 1))));
        assertThrows(IllegalArgumentException.class,
                () -> Polygon.ordered(List.of(new Point(0, 0))));
    }

    @Test
    void geometry_ofAxisAlignedRectangle() {
        Polygon p = rect(10, 20, 428, 270);

        assertEquals(428.0, p.width(), 1e-9);
        assertEquals(270.0, p.height(), 1e-9);
        assertEquals(428.0, p.longSide(), 1e-9);
        assertEquals(270.0, p.shortSide(), 1e-9);
        assertEquals(428.0 * 270.0, p.area(), 1e-6);
        assertEquals(2 * (428.0 + 270.0), p.perimeter(), 1e-9);
    }

    @Test
    void portraitRectangle_longSideIsHeight() {
        Polygon p = rect(0, 0, 100, 300);
        assertEquals(300.0, p.longSide(), 1e-9);
        assertEquals(100.0, p.shortSide(), 1e-9);
    }

    @Test
    void sample_interpolatesCorners() {
        Polygon p = rect(0, 0, 100, 50);
        assertEquals(new Point(0, 0), p.sample(0, 0));
        assertEquals(new Point(100, 50), p.sample(1, 1));
        assertEquals(new Point(50, 25), p.sample(0.5, 0.5));
    }

    @Test
    void boundingBox_coversAllCorners() {
        Region box = rect(10.4, 20.6, 100, 50).boundingBox();
        assertEquals(10, box.x());
        assertEquals(20, box.y());
        assertTrue(box.contains(110.4, 70.6));
    }

    @Test
    void repeatedCorners_detected() {
        Polygon p = new Polygon(List.of(new Point(0, 0), new Point(5, 0), new Point(5, 0), new Point(0, 5)));
        assertTrue(p.hasRepeatedCorners());
        assertFalse(rect(0, 0, 5, 5).hasRepeatedCorners());
    }

    @Test
    void maxCornerDistance_isLargestMove() {
        Polygon a = rect(0, 0, 100, 50);
        Polygon b = new Polygon(List.of(new Point(3, 4), new Point(100, 0), new Point(100, 50), new Point(0, 50)));
        assertEquals(5.0, a.maxCornerDistance(b), 1e-9);
    }
}
