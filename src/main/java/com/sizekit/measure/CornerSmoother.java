package com.sizekit.measure;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Temporal stabilization of detected card corners, plus the UNLOCKED/LOCKED search state.
 * <p>
 * The smoothed polygon is the plain average of each corner over the last
 * {@code historySize} accepted detections. A detection is stable once {@code stableFrames}
 * consecutive detections each stay within {@code stableEpsilonPx} of the previous one.
 * <p>
 * Not thread-safe: one instance serves one detection session.
 */
public class CornerSmoother {

    private final SmoothingSettings settings;
    private final Deque<Polygon> history = new ArrayDeque<>();

    private Polygon lastRaw;
    private Polygon smoothed;
    private int consistentRun;
    private boolean locked;

    public CornerSmoother() {
        this(SmoothingSettings.DEFAULT);
    }

    public CornerSmoother(SmoothingSettings settings) {
        this.settings = settings;
    }

    /**
     * Record an accepted detection.
     *
     * @return the smoothed polygon including this detection
     */
    public Polygon update(Polygon raw) {
        if (lastRaw != null && raw.maxCornerDistance(lastRaw) <= settings.stableEpsilonPx()) {
            consistentRun++;
        } else {
            consistentRun = 1;
        }
        lastRaw = raw;

        history.addLast(raw);
        while (history.size() > settings.historySize()) {
            history.removeFirst();
        }
        smoothed = average(history);
        return smoothed;
    }

    /**
     * Record a call that produced no valid candidate. Clears history and drops any lock.
     */
    public void miss() {
        history.clear();
        lastRaw = null;
        smoothed = null;
        consistentRun = 0;
        locked = false;
    }

    public boolean isStable() {
        return consistentRun >= settings.stableFrames();
    }

    public Optional<Polygon> smoothed() {
        return Optional.ofNullable(smoothed);
    }

    /**
     * Restrict later searches to the area around the current smoothed polygon.
     *
     * @throws IllegalStateException when nothing has been detected yet
     */
    public void lock() {
        if (smoothed == null) {
            throw new IllegalStateException("Cannot lock before a detection has been accepted");
        }
        locked = true;
    }

    public void unlock() {
        locked = false;
    }

    public boolean isLocked() {
        return locked;
    }

    public void reset() {
        miss();
    }

    /**
     * Padded bounding box of the smoothed polygon, clipped to the frame. Empty while unlocked.
     */
    public Optional<Region> regionOfInterest(int frameWidth, int frameHeight) {
        if (!locked || smoothed == null) {
            return Optional.empty();
        }
        Region box = smoothed.boundingBox();
        int padding = (int) Math.ceil(Math.max(box.width(), box.height()) * settings.roiPaddingFraction());
        return Optional.ofNullable(box.padded(padding).clip(frameWidth, frameHeight));
    }

    public int historySize() {
        return history.size();
    }

    public int consistentRun() {
        return consistentRun;
    }

    private static Polygon average(Deque<Polygon> polygons) {
        double[] sx = new double[4];
        double[] sy = new double[4];
        for (Polygon p : polygons) {
            for (int i = 0; i < 4; i++) {
                sx[i] += p.corners().get(i).x();
                sy[i] += p.corners().get(i).y();
            }
        }
        int n = polygons.size();
        List<Point> corners = new ArrayList<>(4);
        for (int i = 0; i < 4; i++) {
            corners.add(new Point(sx[i] / n, sy[i] / n));
        }
        return new Polygon(corners);
    }
}
