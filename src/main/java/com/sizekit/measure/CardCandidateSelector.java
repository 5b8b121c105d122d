package com.sizekit.measure;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Filters quadrilaterals against the reference object's aspect ratio and expected size,
 * then scores the survivors.
 * <p>
 * Score = size * w1 + aspect * w2 + guide fit * w3 + brightness * w4 + uniformity * w5.
 * Reference cards are assumed bright and visually uniform relative to typical backgrounds.
 */
public class CardCandidateSelector {

    private final ReferenceObject reference;
    private final CardDetectionSettings settings;

    public CardCandidateSelector() {
        this(ReferenceObject.CREDIT_CARD, CardDetectionSettings.DEFAULT);
    }

    public CardCandidateSelector(ReferenceObject reference, CardDetectionSettings settings) {
        this.reference = reference;
        this.settings = settings;
    }

    /**
     * Pick the best-scoring polygon.
     *
     * @param polygons   Candidate quadrilaterals
     * @param gray       Frame luminance, for interior brightness sampling
     * @param guide      Expected card area, or null
     * @return the winner, or empty when nothing passes the filters
     */
    public Optional<CardCandidate> select(List<Polygon> polygons, GrayImage gray, Region guide) {
        List<CardCandidate> survivors = filter(polygons, gray.width(), guide);
        if (survivors.isEmpty()) {
            return Optional.empty();
        }

        double maxWidth = 0;
        for (CardCandidate c : survivors) {
            maxWidth = Math.max(maxWidth, c.width());
        }

        CardCandidate best = null;
        for (CardCandidate c : survivors) {
            CardCandidate scored = score(c, gray, maxWidth);
            // Strict comparison: ties keep the earlier (longer contour) candidate
            if (best == null || scored.score() > best.score()) {
                best = scored;
            }
        }
        return Optional.of(best);
    }

    /**
     * Apply the aspect-ratio and size filters without scoring.
     */
    public List<CardCandidate> filter(List<Polygon> polygons, int frameWidth, Region guide) {
        List<CardCandidate> survivors = new ArrayList<>();
        for (Polygon polygon : polygons) {
            double width = polygon.longSide();
            double height = polygon.shortSide();
            if (height <= 0) continue;

            double aspectRatio = width / height;
            double aspectError = Math.abs(aspectRatio - reference.aspectRatio()) / reference.aspectRatio();
            if (aspectError > reference.aspectTolerance()) continue;

            double guideFill = -1.0;
            if (guide != null) {
                guideFill = width / guide.width();
                if (guideFill < settings.minGuideFill() || guideFill > settings.maxGuideFill()) continue;
            } else {
                double frameFill = width / frameWidth;
                if (frameFill < settings.minFrameFill() || frameFill > settings.maxFrameFill()) continue;
            }

            survivors.add(CardCandidate.unscored(polygon, width, height, aspectRatio, aspectError, guideFill));
        }
        return survivors;
    }

    private CardCandidate score(CardCandidate c, GrayImage gray, double maxWidth) {
        double sizeScore = maxWidth > 0 ? c.width() / maxWidth : 0.0;
        double aspectScore = 1.0 - c.aspectError();

        double guideScore = 1.0;
        if (c.hasGuideFill()) {
            double fillError = Math.abs(c.guideFill() - settings.targetGuideFill());
            guideScore = Math.max(0.0, 1.0 - fillError * 2.0);
        }

        double[] interior = sampleInterior(c.polygon(), gray);
        double brightness = interior[0] / 255.0;
        double uniformity = interior[2] > 0 ? 1.0 / (1.0 + interior[1] / 1000.0) : 0.0;

        double total = sizeScore * settings.sizeWeight()
                + aspectScore * settings.aspectWeight()
                + guideScore * settings.guideWeight()
                + brightness * settings.brightnessWeight()
                + uniformity * settings.uniformityWeight();
        return c.withScores(sizeScore, aspectScore, guideScore, brightness, uniformity, total);
    }

    /**
     * Deterministic grid of bilinear samples inside the polygon.
     *
     * @return {mean, variance, sampleCount}
     */
    private double[] sampleInterior(Polygon polygon, GrayImage gray) {
        int n = settings.sampleGrid();
        double sum = 0;
        double sumSq = 0;
        int count = 0;
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                Point p = polygon.sample((i + 0.5) / n, (j + 0.5) / n);
                int x = (int) Math.floor(p.x());
                int y = (int) Math.floor(p.y());
                if (!gray.inBounds(x, y)) continue;
                int v = gray.get(x, y);
                sum += v;
                sumSq += (double) v * v;
                count++;
            }
        }
        if (count == 0) {
            return new double[]{0.0, 0.0, 0.0};
        }
        double mean = sum / count;
        double variance = Math.max(0.0, sumSq / count - mean * mean);
        return new double[]{mean, variance, count};
    }
}
