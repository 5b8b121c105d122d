package com.sizekit.measure;

/**
 * Left and right nail edges found on the widest scanned row.
 *
 * @param anchor          Fingertip point the scan started from
 * @param row             Image row of the widest scan
 * @param left            Leftmost column at or above the edge threshold
 * @param right           Rightmost column at or above the edge threshold
 * @param widthPixels     right - left + 1
 * @param skinBrightness  Mean luminance around the base joint
 * @param targetBrightness Brightest luminance near the anchor
 * @param edgeThreshold   Luminance below which a pixel is outside the nail
 * @param rowAgreement    Fraction of scanned rows close to the widest width [0, 1]
 */
public record NailBoundary(
        Point anchor,
        int row,
        int left,
        int right,
        int widthPixels,
        double skinBrightness,
        double targetBrightness,
        double edgeThreshold,
        double rowAgreement
) {
}
