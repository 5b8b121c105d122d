package com.sizekit.measure;

/**
 * Physical width and size of one nail.
 *
 * @param digit       Which digit
 * @param widthPixels Straight edge-to-edge width in the photo
 * @param chordMm     widthPixels converted with the calibration scale
 * @param curvedMm    chordMm corrected for nail curvature
 * @param size        Ordinal size from the size table
 * @param confidence  Hand-landmark confidence times row agreement of the edge scan [0, 1]
 */
public record NailMeasurement(
        Digit digit,
        double widthPixels,
        double chordMm,
        double curvedMm,
        int size,
        double confidence
) {

    /** Curvature-corrected width rounded to one decimal. */
    public double roundedMm() {
        return Math.round(curvedMm * 10.0) / 10.0;
    }
}
