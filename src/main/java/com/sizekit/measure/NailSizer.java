package com.sizekit.measure;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Top-level entry point: one photo containing a credit card and a hand, plus the hand's
 * landmarks, in; one size per nail out.
 * <p>
 * Pipeline:
 * 1. Detect the card and calibrate pixels per millimeter from its width.
 * 2. Scan each fingertip for the nail's edges.
 * 3. Convert each nail width to millimeters and a size.
 */
public class NailSizer {

    private final ReferenceObject reference;
    private final CardDetectionSettings cardSettings;
    private final SmoothingSettings smoothingSettings;
    private final ScaleCalibrator calibrator;
    private final NailBoundaryDetector boundaryDetector;
    private final UnitConverter converter;

    public NailSizer() {
        this(ReferenceObject.CREDIT_CARD, CardDetectionSettings.DEFAULT, SmoothingSettings.DEFAULT,
                NailScanSettings.DEFAULT, MeasurementSettings.DEFAULT, SizeTable.DEFAULT);
    }

    public NailSizer(MeasurementSettings measurementSettings) {
        this(ReferenceObject.CREDIT_CARD, CardDetectionSettings.DEFAULT, SmoothingSettings.DEFAULT,
                NailScanSettings.DEFAULT, measurementSettings, SizeTable.DEFAULT);
    }

    public NailSizer(ReferenceObject reference,
                     CardDetectionSettings cardSettings,
                     SmoothingSettings smoothingSettings,
                     NailScanSettings scanSettings,
                     MeasurementSettings measurementSettings,
                     SizeTable sizeTable) {
        this.reference = Objects.requireNonNull(reference, "reference");
        this.cardSettings = Objects.requireNonNull(cardSettings, "cardSettings");
        this.smoothingSettings = Objects.requireNonNull(smoothingSettings, "smoothingSettings");
        this.calibrator = new ScaleCalibrator(reference, measurementSettings);
        this.boundaryDetector = new NailBoundaryDetector(scanSettings);
        this.converter = new UnitConverter(sizeTable, measurementSettings);
    }

    /**
     * @throws IOException when the file cannot be read or decoded as an image
     */
    public DetectionResult<HandMeasurement> measure(
            Path imageFile, List<Point> landmarks, double handConfidence) throws IOException {

        BufferedImage image = ImageIO.read(imageFile.toFile());
        if (image == null) {
            throw new IOException("Failed to decode image: " + imageFile);
        }
        return measure(image, landmarks, handConfidence, null);
    }

    public DetectionResult<HandMeasurement> measure(
            BufferedImage image, List<Point> landmarks, double handConfidence, Region guide) {
        return measure(PixelBuffer.fromImage(image), landmarks, handConfidence, guide);
    }

    /**
     * @param frame          Photo pixels, not modified
     * @param landmarks      Hand landmarks in pixel coordinates, at least 21 points
     * @param handConfidence Landmark detector confidence
     * @param guide          Expected card area, or null
     * @throws IllegalArgumentException when fewer than 21 landmarks are given
     */
    public DetectionResult<HandMeasurement> measure(
            PixelBuffer frame, List<Point> landmarks, double handConfidence, Region guide) {

        FingertipSet fingertips = FingertipSet.fromLandmarks(landmarks);

        // 1. Reference card and scale
        DetectionResult<Calibration> calibration = newCardDetector()
                .detect(frame, guide)
                .flatMap(calibrator::calibrate);
        if (calibration.isFailure()) {
            return DetectionResult.failure(calibration.failure(), calibration.message());
        }

        // 2-3. Nails
        return measureNails(GrayscaleConverter.toGray(frame), fingertips, calibration.value(), handConfidence);
    }

    /**
     * Measure all five nails against an existing calibration. Stops at the first digit
     * whose boundary cannot be found.
     */
    public DetectionResult<HandMeasurement> measureNails(
            GrayImage gray, FingertipSet fingertips, Calibration calibration, double handConfidence) {

        List<NailMeasurement> nails = new ArrayList<>(Digit.values().length);
        for (FingertipSet.Fingertip tip : fingertips.all()) {
            DetectionResult<NailBoundary> boundary = boundaryDetector.detect(gray, tip.tip(), tip.base());
            if (boundary.isFailure()) {
                return DetectionResult.failure(boundary.failure(),
                        tip.digit().displayName() + ": " + boundary.message());
            }
            nails.add(converter.convert(tip.digit(), boundary.value(), calibration, handConfidence));
        }
        return DetectionResult.success(new HandMeasurement(nails, calibration));
    }

    /**
     * A detector configured like this sizer, for callers running their own multi-frame session.
     */
    public CardDetector newCardDetector() {
        return new CardDetector(reference, cardSettings, smoothingSettings);
    }

    public ScaleCalibrator calibrator() {
        return calibrator;
    }

    public UnitConverter converter() {
        return converter;
    }
}
