package com.sizekit.measure;

/**
 * Tunables for the card detection chain: edge map, contour tracing, polygon
 * approximation and candidate scoring.
 *
 * @param edgeThreshold      Sobel magnitude above which a pixel is an edge
 * @param minContourLength   Contours with fewer pixels are discarded as noise (text, logos)
 * @param contourCapFactor   A single trace may collect at most {@code contourCapFactor * (width + height)}
 *                           pixels of the edge map; larger components are discarded, never cut
 * @param maxContours        Only the longest {@code maxContours} contours are kept
 * @param epsilonFractions   Douglas-Peucker tolerances as fractions of the contour perimeter, tried in order
 * @param minGuideFill       Minimum candidate width / guide width
 * @param maxGuideFill       Maximum candidate width / guide width
 * @param targetGuideFill    Guide fill that scores a perfect guide fit
 * @param minFrameFill       Minimum candidate width / frame width when no guide is given
 * @param maxFrameFill       Maximum candidate width / frame width when no guide is given
 * @param sizeWeight         Score weight of the width relative to the widest survivor
 * @param aspectWeight       Score weight of aspect-ratio accuracy
 * @param guideWeight        Score weight of guide fit
 * @param brightnessWeight   Score weight of mean brightness inside the polygon
 * @param uniformityWeight   Score weight of brightness uniformity inside the polygon
 * @param sampleGrid         Samples per side of the interior brightness grid
 */
public record CardDetectionSettings(
        double edgeThreshold,
        int minContourLength,
        double contourCapFactor,
        int maxContours,
        double[] epsilonFractions,
        double minGuideFill,
        double maxGuideFill,
        double targetGuideFill,
        double minFrameFill,
        double maxFrameFill,
        double sizeWeight,
        double aspectWeight,
        double guideWeight,
        double brightnessWeight,
        double uniformityWeight,
        int sampleGrid
) {

    public static final CardDetectionSettings DEFAULT = new CardDetectionSettings(
            40.0, // edgeThreshold
            200,  // minContourLength
            6.0,  // contourCapFactor
            5,    // maxContours
            new double[]{0.02, 0.03, 0.04, 0.05, 0.06, 0.08, 0.10},
            0.50, // minGuideFill
            1.15, // maxGuideFill
            0.85, // targetGuideFill
            0.20, // minFrameFill
            0.60, // maxFrameFill
            0.40, // sizeWeight
            0.25, // aspectWeight
            0.15, // guideWeight
            0.10, // brightnessWeight
            0.10, // uniformityWeight
            8     // sampleGrid
    );

    public CardDetectionSettings {
        if (minContourLength < 4) {
            throw new IllegalArgumentException("minContourLength must be >= 4, got " + minContourLength);
        }
        if (!(contourCapFactor > 0) || Double.isInfinite(contourCapFactor)) {
            throw new IllegalArgumentException("contourCapFactor must be a positive number, got " + contourCapFactor);
        }
        if (maxContours < 1) {
            throw new IllegalArgumentException("maxContours must be >= 1, got " + maxContours);
        }
        if (epsilonFractions == null || epsilonFractions.length == 0) {
            throw new IllegalArgumentException("At least one epsilon fraction is required");
        }
        if (minGuideFill > maxGuideFill || minFrameFill > maxFrameFill) {
            throw new IllegalArgumentException("Fill bands must have min <= max");
        }
        if (sampleGrid < 1) {
            throw new IllegalArgumentException("sampleGrid must be >= 1, got " + sampleGrid);
        }
        epsilonFractions = epsilonFractions.clone();
    }

    @Override
    public double[] epsilonFractions() {
        return epsilonFractions.clone();
    }

    public CardDetectionSettings withEdgeThreshold(double threshold) {
        return new CardDetectionSettings(threshold, minContourLength, contourCapFactor, maxContours,
                epsilonFractions, minGuideFill, maxGuideFill, targetGuideFill, minFrameFill, maxFrameFill,
                sizeWeight, aspectWeight, guideWeight, brightnessWeight, uniformityWeight, sampleGrid);
    }

    public CardDetectionSettings withFrameFill(double min, double max) {
        return new CardDetectionSettings(edgeThreshold, minContourLength, contourCapFactor, maxContours,
                epsilonFractions, minGuideFill, maxGuideFill, targetGuideFill, min, max,
                sizeWeight, aspectWeight, guideWeight, brightnessWeight, uniformityWeight, sampleGrid);
    }

    public CardDetectionSettings withContourCapFactor(double factor) {
        return new CardDetectionSettings(edgeThreshold, minContourLength, factor, maxContours,
                epsilonFractions, minGuideFill, maxGuideFill, targetGuideFill, minFrameFill, maxFrameFill,
                sizeWeight, aspectWeight, guideWeight, brightnessWeight, uniformityWeight, sampleGrid);
    }
}
