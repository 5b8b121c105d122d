package com.sizekit.measure;

/**
 * Tunables for the shadow/brightness edge scan of {@link NailBoundaryDetector}.
 *
 * @param ringRadius      Radius of the skin-brightness ring around the base joint, px
 * @param ringSamples     Number of samples on that ring
 * @param anchorRadius    Half-size of the neighborhood searched for the brightest pixel near the tip
 * @param targetFraction  Edge threshold candidate: this fraction of the target brightness
 * @param skinMultiplier  Edge threshold candidate: this multiple of the skin brightness
 * @param rowWindow       Rows within +/- this many pixels of the anchor are scanned
 * @param rowStep         Spacing between scanned rows
 * @param maxScanDistance A scan that runs this far without dropping below the threshold has no edge
 * @param minWidthPixels  Narrower results are reported as a failure
 * @param agreementRatio  Rows at least this fraction of the widest row count as agreeing
 */
public record NailScanSettings(
        int ringRadius,
        int ringSamples,
        int anchorRadius,
        double targetFraction,
        double skinMultiplier,
        int rowWindow,
        int rowStep,
        int maxScanDistance,
        int minWidthPixels,
        double agreementRatio
) {

    public static final NailScanSettings DEFAULT = new NailScanSettings(
            8,    // ringRadius
            16,   // ringSamples
            3,    // anchorRadius
            0.70, // targetFraction
            1.05, // skinMultiplier
            10,   // rowWindow
            2,    // rowStep
            150,  // maxScanDistance
            10,   // minWidthPixels
            0.80  // agreementRatio
    );

    public NailScanSettings {
        if (ringRadius < 1 || ringSamples < 1 || anchorRadius < 0) {
            throw new IllegalArgumentException("Ring and anchor sampling sizes must be positive");
        }
        if (rowWindow < 0 || rowStep < 1) {
            throw new IllegalArgumentException("rowWindow must be >= 0 and rowStep >= 1");
        }
        if (maxScanDistance < 1 || minWidthPixels < 1) {
            throw new IllegalArgumentException("maxScanDistance and minWidthPixels must be >= 1");
        }
    }
}
