package com.sizekit.measure;

/**
 * Temporal smoothing and lock tunables for {@link CornerSmoother}.
 *
 * @param historySize        Number of accepted detections averaged into the smoothed polygon
 * @param stableFrames       Consecutive consistent detections required before the detection is stable
 * @param stableEpsilonPx    Maximum per-corner movement between consecutive detections that still counts as consistent
 * @param roiPaddingFraction Padding of the locked region of interest, as a fraction of the polygon's larger side
 */
public record SmoothingSettings(
        int historySize,
        int stableFrames,
        double stableEpsilonPx,
        double roiPaddingFraction
) {

    public static final SmoothingSettings DEFAULT = new SmoothingSettings(5, 3, 12.0, 0.25);

    public SmoothingSettings {
        if (historySize < 1) {
            throw new IllegalArgumentException("historySize must be >= 1, got " + historySize);
        }
        if (stableFrames < 1) {
            throw new IllegalArgumentException("stableFrames must be >= 1, got " + stableFrames);
        }
        if (!(stableEpsilonPx >= 0) || !(roiPaddingFraction >= 0)) {
            throw new IllegalArgumentException("stableEpsilonPx and roiPaddingFraction must be >= 0");
        }
    }
}
