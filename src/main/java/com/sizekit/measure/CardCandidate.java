package com.sizekit.measure;

/**
 * A quadrilateral that passed the reference-object filters, with its geometry and scores.
 *
 * @param polygon     Ordered corners
 * @param width       Longer pair of opposite edges, averaged (px)
 * @param height      Shorter pair of opposite edges, averaged (px)
 * @param aspectRatio width / height
 * @param aspectError |aspectRatio - target| / target
 * @param guideFill   width / guide width, or -1 when no guide region was given
 * @param sizeScore   width relative to the widest surviving candidate [0, 1]
 * @param aspectScore 1 - aspectError
 * @param guideScore  Closeness of guideFill to the target fill [0, 1]; 1 without a guide
 * @param brightness  Mean interior luminance / 255
 * @param uniformity  1 / (1 + interior variance / 1000)
 * @param score       Weighted total
 */
public record CardCandidate(
        Polygon polygon,
        double width,
        double height,
        double aspectRatio,
        double aspectError,
        double guideFill,
        double sizeScore,
        double aspectScore,
        double guideScore,
        double brightness,
        double uniformity,
        double score
) {

    static CardCandidate unscored(Polygon polygon, double width, double height,
                                  double aspectRatio, double aspectError, double guideFill) {
        return new CardCandidate(polygon, width, height, aspectRatio, aspectError, guideFill,
                0.0, 0.0, 0.0, 0.0, 0.0, 0.0);
    }

    CardCandidate withScores(double sizeScore, double aspectScore, double guideScore,
                             double brightness, double uniformity, double score) {
        return new CardCandidate(polygon, width, height, aspectRatio, aspectError, guideFill,
                sizeScore, aspectScore, guideScore, brightness, uniformity, score);
    }

    public boolean hasGuideFill() {
        return guideFill >= 0;
    }
}
