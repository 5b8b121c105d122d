package com.sizekit.measure;

/**
 * Sobel gradient-magnitude edge detector.
 * <p>
 * Interior pixels whose gradient magnitude is strictly above the threshold are edges.
 * The one-pixel border is never marked since the 3x3 kernel needs a full neighborhood.
 */
public class EdgeDetector {

    private final double threshold;

    public EdgeDetector() {
        this(CardDetectionSettings.DEFAULT.edgeThreshold());
    }

    public EdgeDetector(double threshold) {
        if (!(threshold >= 0)) {
            throw new IllegalArgumentException("Edge threshold must be >= 0, got " + threshold);
        }
        this.threshold = threshold;
    }

    public EdgeMap detect(GrayImage gray) {
        int w = gray.width();
        int h = gray.height();
        int[] lum = gray.values();
        boolean[] edges = new boolean[w * h];

        for (int y = 1; y < h - 1; y++) {
            for (int x = 1; x < w - 1; x++) {
                // Standard Sobel
                int gx = lum[(y - 1) * w + (x + 1)] + 2 * lum[y * w + (x + 1)] + lum[(y + 1) * w + (x + 1)]
                        - lum[(y - 1) * w + (x - 1)] - 2 * lum[y * w + (x - 1)] - lum[(y + 1) * w + (x - 1)];
                int gy = lum[(y + 1) * w + (x - 1)] + 2 * lum[(y + 1) * w + x] + lum[(y + 1) * w + (x + 1)]
                        - lum[(y - 1) * w + (x - 1)] - 2 * lum[(y - 1) * w + x] - lum[(y - 1) * w + (x + 1)];
                double magnitude = Math.sqrt((double) gx * gx + (double) gy * gy);
                edges[y * w + x] = magnitude > threshold;
            }
        }
        return new EdgeMap(w, h, edges);
    }

    public double threshold() {
        return threshold;
    }
}
