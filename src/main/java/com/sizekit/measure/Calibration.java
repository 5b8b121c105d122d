package com.sizekit.measure;

/**
 * Pixel-to-millimeter scale derived from one photo's reference object.
 *
 * @param pixelsPerMm          Scale
 * @param referenceWidthMm     Physical width of the reference object
 * @param referenceWidthPixels Measured width of the reference object
 */
public record Calibration(double pixelsPerMm, double referenceWidthMm, double referenceWidthPixels) {

    public double toMillimeters(double pixels) {
        return pixels / pixelsPerMm;
    }
}
