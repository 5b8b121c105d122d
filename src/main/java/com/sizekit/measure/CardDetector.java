package com.sizekit.measure;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * One card detection session: grayscale, edges, contours, quadrilaterals, candidate
 * selection and temporal smoothing, run on each frame passed to {@link #detect}.
 * <p>
 * Holds the smoothing history and lock state across calls. Not thread-safe.
 */
public class CardDetector {

    private final EdgeDetector edgeDetector;
    private final ContourTracer contourTracer;
    private final PolygonApproximator approximator;
    private final CardCandidateSelector selector;
    private final CornerSmoother smoother;

    private double lastProcessTimeMs;
    private int lastContourCount;

    public CardDetector() {
        this(ReferenceObject.CREDIT_CARD, CardDetectionSettings.DEFAULT, SmoothingSettings.DEFAULT);
    }

    public CardDetector(ReferenceObject reference, CardDetectionSettings settings, SmoothingSettings smoothing) {
        Objects.requireNonNull(reference, "reference");
        Objects.requireNonNull(settings, "settings");
        this.edgeDetector = new EdgeDetector(settings.edgeThreshold());
        this.contourTracer = new ContourTracer(settings);
        this.approximator = new PolygonApproximator(settings.epsilonFractions());
        this.selector = new CardCandidateSelector(reference, settings);
        this.smoother = new CornerSmoother(Objects.requireNonNull(smoothing, "smoothing"));
    }

    public DetectionResult<CardDetection> detect(PixelBuffer frame) {
        return detect(frame, null);
    }

    /**
     * Run the chain on one frame.
     *
     * @param frame Source pixels, not modified
     * @param guide Expected card area, or null. Ignored for seeding while locked.
     */
    public DetectionResult<CardDetection> detect(PixelBuffer frame, Region guide) {
        Objects.requireNonNull(frame, "frame");
        long start = System.nanoTime();

        boolean locked = smoother.isLocked();
        Region searchRegion = smoother.regionOfInterest(frame.width(), frame.height())
                .orElse(guide);

        GrayImage gray = GrayscaleConverter.toGray(frame);
        EdgeMap edges = edgeDetector.detect(gray);
        ContourTracer.Result traced = contourTracer.trace(edges, searchRegion);
        lastContourCount = traced.contours().size();

        if (traced.contours().isEmpty()) {
            smoother.miss();
            lastProcessTimeMs = elapsedMs(start);
            String detail = traced.truncatedCount() > 0
                    ? traced.truncatedCount() + " edge components exceeded the point cap"
                    : traced.tracedCount() + " traced";
            return DetectionResult.failure(DetectionFailure.INSUFFICIENT_CONTOUR_DATA,
                    "No complete edge contour of at least the minimum length (" + detail + ")");
        }

        List<Polygon> polygons = new ArrayList<>();
        for (Contour contour : traced.contours()) {
            approximator.approximate(contour).ifPresent(polygons::add);
        }

        Optional<CardCandidate> best = selector.select(polygons, gray, guide);
        if (best.isEmpty()) {
            smoother.miss();
            lastProcessTimeMs = elapsedMs(start);
            return DetectionResult.failure(DetectionFailure.REFERENCE_NOT_FOUND,
                    polygons.size() + " quadrilaterals from " + lastContourCount
                            + " contours, none matched the reference object");
        }

        Polygon smoothed = smoother.update(best.get().polygon());
        lastProcessTimeMs = elapsedMs(start);
        return DetectionResult.success(new CardDetection(best.get(), smoothed, smoother.isStable(),
                locked, lastContourCount, lastProcessTimeMs));
    }

    /**
     * Lock onto the current detection; later calls search only around it.
     *
     * @throws IllegalStateException when there is no detection to lock onto
     */
    public void accept() {
        smoother.lock();
    }

    public boolean isLocked() {
        return smoother.isLocked();
    }

    public boolean isStable() {
        return smoother.isStable();
    }

    public Optional<Region> regionOfInterest(int frameWidth, int frameHeight) {
        return smoother.regionOfInterest(frameWidth, frameHeight);
    }

    public void reset() {
        smoother.reset();
        lastProcessTimeMs = 0;
        lastContourCount = 0;
    }

    public double lastProcessTimeMs() {
        return lastProcessTimeMs;
    }

    public int lastContourCount() {
        return lastContourCount;
    }

    private static double elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000.0;
    }
}
