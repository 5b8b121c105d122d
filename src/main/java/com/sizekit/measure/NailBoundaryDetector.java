package com.sizekit.measure;

import java.util.Objects;

/**
 * Finds the nail's left and right edges by scanning outward from the fingertip until the
 * luminance falls below a threshold derived from the surrounding skin and the nail itself.
 * <p>
 * Nails reflect more light than the skin around them; the edge is where that brightness
 * ends. Several rows around the tip are scanned and the widest usable one is reported.
 */
public class NailBoundaryDetector {

    private final NailScanSettings settings;

    public NailBoundaryDetector() {
        this(NailScanSettings.DEFAULT);
    }

    public NailBoundaryDetector(NailScanSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    /**
     * @param gray Frame luminance
     * @param tip  Fingertip landmark, the scan anchor
     * @param base Base-joint landmark, used for the skin reference
     */
    public DetectionResult<NailBoundary> detect(GrayImage gray, Point tip, Point base) {
        Objects.requireNonNull(gray, "gray");
        Objects.requireNonNull(tip, "tip");
        Objects.requireNonNull(base, "base");

        if (!covers(gray, tip.x(), tip.y())) {
            return DetectionResult.failure(DetectionFailure.BOUNDARY_DETECTION_FAILED,
                    "Fingertip (" + tip.x() + ", " + tip.y() + ") is outside the image");
        }
        if (!Double.isFinite(base.x()) || !Double.isFinite(base.y())) {
            return DetectionResult.failure(DetectionFailure.BOUNDARY_DETECTION_FAILED,
                    "Base joint (" + base.x() + ", " + base.y() + ") is not a finite position");
        }
        int ax = (int) Math.round(tip.x());
        int ay = (int) Math.round(tip.y());

        double skin = ringBrightness(gray, base);
        double target = brightestNear(gray, ax, ay);
        double threshold = Math.max(settings.targetFraction() * target, settings.skinMultiplier() * skin);

        int bestWidth = -1;
        int bestRow = ay;
        int bestLeft = ax;
        int bestRight = ax;
        int usableRows = 0;
        int[] widths = new int[2 * settings.rowWindow() / settings.rowStep() + 1];

        for (int dy = -settings.rowWindow(); dy <= settings.rowWindow(); dy += settings.rowStep()) {
            int y = ay + dy;
            if (y < 0 || y >= gray.height()) continue;

            int left;
            int right;
            if (gray.get(ax, y) < threshold) {
                // Anchor itself is outside the nail on this row
                left = ax;
                right = ax - 1;
            } else {
                left = scanEdge(gray, ax, y, threshold, -1);
                right = scanEdge(gray, ax, y, threshold, 1);
                if (left < 0 || right < 0) continue;
            }

            int width = right - left + 1;
            widths[usableRows++] = width;
            if (width > bestWidth) {
                bestWidth = width;
                bestRow = y;
                bestLeft = left;
                bestRight = right;
            }
        }

        if (usableRows == 0) {
            return DetectionResult.failure(DetectionFailure.BOUNDARY_DETECTION_FAILED,
                    "No scanned row around (" + ax + ", " + ay + ") reached a darker edge on both sides");
        }
        if (bestWidth < settings.minWidthPixels()) {
            return DetectionResult.failure(DetectionFailure.BOUNDARY_DETECTION_FAILED,
                    "Widest row is " + bestWidth + " px, below the minimum of " + settings.minWidthPixels());
        }

        int agreeing = 0;
        for (int i = 0; i < usableRows; i++) {
            if (widths[i] >= settings.agreementRatio() * bestWidth) agreeing++;
        }
        double agreement = (double) agreeing / usableRows;

        return DetectionResult.success(new NailBoundary(tip, bestRow, bestLeft, bestRight, bestWidth,
                skin, target, threshold, agreement));
    }

    /**
     * Walk from the anchor in direction {@code dir} until a pixel drops below the threshold.
     *
     * @return the last column still at or above the threshold, or -1 when the border or the
     *         maximum scan distance is reached first
     */
    private int scanEdge(GrayImage gray, int ax, int y, double threshold, int dir) {
        for (int d = 1; d <= settings.maxScanDistance(); d++) {
            int x = ax + dir * d;
            if (x < 0 || x >= gray.width()) {
                return -1;
            }
            if (gray.get(x, y) < threshold) {
                return x - dir;
            }
        }
        return -1;
    }

    private double ringBrightness(GrayImage gray, Point center) {
        double sum = 0;
        int count = 0;
        int n = settings.ringSamples();
        for (int k = 0; k < n; k++) {
            double angle = 2.0 * Math.PI * k / n;
            double sx = center.x() + settings.ringRadius() * Math.cos(angle);
            double sy = center.y() + settings.ringRadius() * Math.sin(angle);
            if (covers(gray, sx, sy)) {
                sum += gray.get((int) Math.round(sx), (int) Math.round(sy));
                count++;
            }
        }
        return count > 0 ? sum / count : 0.0;
    }

    /** True when {@code (x, y)} is finite and rounds to a pixel inside the image. */
    static boolean covers(GrayImage gray, double x, double y) {
        return x >= -0.5 && x < gray.width() - 0.5
                && y >= -0.5 && y < gray.height() - 0.5;
    }

    private int brightestNear(GrayImage gray, int ax, int ay) {
        int r = settings.anchorRadius();
        int max = 0;
        for (int y = ay - r; y <= ay + r; y++) {
            for (int x = ax - r; x <= ax + r; x++) {
                if (gray.inBounds(x, y)) {
                    max = Math.max(max, gray.get(x, y));
                }
            }
        }
        return max;
    }
}
