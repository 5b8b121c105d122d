package com.sizekit.measure;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static com.sizekit.measure.PolygonTest.rect;
import static org.junit.jupiter.api.Assertions.*;

class CornerSmootherTest {

    @Test
    void identicalDetections_smoothToInput() {
        CornerSmoother smoother = new CornerSmoother();
        Polygon p = rect(60, 60, 428, 270);
        Polygon smoothed = null;
        for (int i = 0; i < 5; i++) smoothed = smoother.update(p);

        assertEquals(0.0, smoothed.maxCornerDistance(p), 1e-9);
        assertEquals(5, smoother.historySize());
    }

    @Test
    void averagesAcrossHistory() {
        CornerSmoother smoother = new CornerSmoother();
        smoother.update(rect(0, 0, 100, 60));
        Polygon smoothed = smoother.update(rect(10, 0, 100, 60));
        assertEquals(5.0, smoothed.topLeft().x(), 1e-9);
    }

    @Test
    void stepChange_convergesWithinWindow() {
        CornerSmoother smoother = new CornerSmoother();
        Polygon before = rect(60, 60, 428, 270);
        Polygon after = rect(80, 70, 428, 270);
        for (int i = 0; i < 5; i++) smoother.update(before);

        Polygon smoothed = null;
        for (int i = 0; i < 4; i++) {
            smoothed = smoother.update(after);
            assertTrue(smoothed.maxCornerDistance(after) > 0, "still converging after " + (i + 1));
        }
        smoothed = smoother.update(after);
        assertEquals(0.0, smoothed.maxCornerDistance(after), 1e-9);
        assertEquals(5, smoother.historySize());
    }

    @Test
    void stableAfterConsecutiveConsistentDetections() {
        CornerSmoother smoother = new CornerSmoother();
        smoother.update(rect(60, 60, 428, 270));
        assertFalse(smoother.isStable());
        smoother.update(rect(65, 62, 428, 270));
        assertFalse(smoother.isStable());
        smoother.update(rect(62, 60, 428, 270));
        assertTrue(smoother.isStable());
        assertEquals(3, smoother.consistentRun());
    }

    @Test
    void largeMove_restartsRun() {
        CornerSmoother smoother = new CornerSmoother();
        for (int i = 0; i < 3; i++) smoother.update(rect(60, 60, 428, 270));
        assertTrue(smoother.isStable());

        smoother.update(rect(120, 60, 428, 270));
        assertFalse(smoother.isStable());
        assertEquals(1, smoother.consistentRun());
    }

    @Test
    void miss_clearsHistoryAndUnlocks() {
        CornerSmoother smoother = new CornerSmoother();
        smoother.update(rect(60, 60, 428, 270));
        smoother.lock();
        assertTrue(smoother.isLocked());

        smoother.miss();

        assertFalse(smoother.isLocked());
        assertEquals(0, smoother.historySize());
        assertTrue(smoother.smoothed().isEmpty());
        assertFalse(smoother.isStable());
    }

    @Test
    void lockWithoutDetection_throws() {
        assertThrows(IllegalStateException.class, () -> new CornerSmoother().lock());
    }

    @Test
    void regionOfInterest_onlyWhileLocked() {
        CornerSmoother smoother = new CornerSmoother();
        smoother.update(rect(100, 100, 400, 200));
        assertTrue(smoother.regionOfInterest(1000, 800).isEmpty());

        smoother.lock();
        Region roi = smoother.regionOfInterest(1000, 800).orElseThrow();
        // box (100, 100, 401x201) padded by ceil(401 * 0.25) = 101, then clipped at the origin
        assertEquals(new Region(0, 0, 602, 402), roi);

        smoother.unlock();
        assertTrue(smoother.regionOfInterest(1000, 800).isEmpty());
    }

    @Test
    void regionOfInterest_clippedToFrame() {
        CornerSmoother smoother = new CornerSmoother();
        smoother.update(rect(10, 10, 400, 200));
        smoother.lock();
        Optional<Region> roi = smoother.regionOfInterest(450, 250);

        assertTrue(roi.isPresent());
        assertEquals(new Region(0, 0, 450, 250), roi.get());
    }

    @Test
    void roiFollowsNewDetections() {
        CornerSmoother smoother = new CornerSmoother(new SmoothingSettings(1, 3, 12.0, 0.0));
        smoother.update(rect(100, 100, 200, 100));
        smoother.lock();
        smoother.update(rect(300, 300, 200, 100));

        assertEquals(new Region(300, 300, 201, 101), smoother.regionOfInterest(1000, 800).orElseThrow());
    }
}
