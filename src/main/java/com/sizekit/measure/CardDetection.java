package com.sizekit.measure;

/**
 * Outcome of one successful {@link CardDetector#detect} call.
 *
 * @param candidate        Winning raw candidate of this call
 * @param smoothed         Corners averaged over the recent history
 * @param stable           True once enough consecutive detections agreed
 * @param locked           Whether the search was restricted to the locked region of interest
 * @param contourCount     Contours considered for this call
 * @param processingTimeMs Wall time of the call
 */
public record CardDetection(
        CardCandidate candidate,
        Polygon smoothed,
        boolean stable,
        boolean locked,
        int contourCount,
        double processingTimeMs
) {

    /** Card width in pixels used for calibration: the smoothed polygon's long side. */
    public double widthPixels() {
        return smoothed.longSide();
    }
}
